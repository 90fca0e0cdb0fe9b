package com.tradedesk.risk;

import com.tradedesk.domain.enums.VarMethod;
import com.tradedesk.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

/**
 * Value-at-Risk and expected shortfall from a series of periodic returns.
 *
 * <p>All results are positive loss fractions (0.03 = 3% of exposure). Every estimator returns
 * 0 for fewer than 2 observations instead of failing, so thin price histories stay usable.
 *
 * <ul>
 *   <li>Historical: the (1 - confidence) empirical quantile</li>
 *   <li>Parametric: mean + z(1 - confidence) * sample standard deviation</li>
 *   <li>Monte Carlo: the same quantile over draws from Normal(mean, sd), seeded</li>
 *   <li>Expected shortfall: mean of returns at or below the historical quantile</li>
 * </ul>
 *
 * <p>Volatility is the sample standard deviation of daily returns scaled by sqrt(252).
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class RiskMetricsCalculator {

    public static final int DEFAULT_SIMULATIONS = 10_000;
    public static final long DEFAULT_SEED = 42L;
    public static final int TRADING_DAYS_PER_YEAR = 252;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private static final int MIN_OBSERVATIONS = 2;

    // Absorbs binary rounding in (1 - confidence) * n, e.g. (1 - 0.9) * 10 = 0.9999999999999998
    private static final double INDEX_EPSILON = 1e-9;

    public double historicalVar(double[] returns, double confidence) {
        requireConfidence(confidence);
        if (returns.length < MIN_OBSERVATIONS) {
            return 0.0;
        }
        return Math.abs(quantile(returns, confidence));
    }

    public double annualizedVolatility(double[] returns) {
        if (returns.length < MIN_OBSERVATIONS) {
            return 0.0;
        }
        return new DescriptiveStatistics(returns).getStandardDeviation() * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    public double parametricVar(double[] returns, double confidence) {
        requireConfidence(confidence);
        if (returns.length < MIN_OBSERVATIONS) {
            return 0.0;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(returns);
        double z = NORM.inverseCumulativeProbability(1.0 - confidence);
        return Math.abs(stats.getMean() + z * stats.getStandardDeviation());
    }

    public double monteCarloVar(double[] returns, double confidence) {
        return monteCarloVar(returns, confidence, DEFAULT_SIMULATIONS, DEFAULT_SEED);
    }

    public double monteCarloVar(double[] returns, double confidence, int draws, long seed) {
        requireConfidence(confidence);
        if (draws < 1) {
            throw new ValidationException("draws", "Monte Carlo draws must be positive");
        }
        if (returns.length < MIN_OBSERVATIONS) {
            return 0.0;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(returns);
        double mean = stats.getMean();
        double sd = stats.getStandardDeviation();
        if (sd == 0.0) {
            return Math.abs(mean);
        }
        NormalDistribution simulated = new NormalDistribution(
                new Well19937c(seed), mean, sd, NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
        return Math.abs(quantile(simulated.sample(draws), confidence));
    }

    public double expectedShortfall(double[] returns, double confidence) {
        requireConfidence(confidence);
        if (returns.length < MIN_OBSERVATIONS) {
            return 0.0;
        }
        double threshold = quantile(returns, confidence);
        double[] tail = Arrays.stream(returns).filter(r -> r <= threshold).toArray();
        if (tail.length == 0) {
            return Math.abs(threshold);
        }
        return Math.abs(Arrays.stream(tail).average().orElse(threshold));
    }

    /** Dispatches to the estimator for {@code method}. Monte Carlo uses the default draws and seed. */
    public double valueAtRisk(VarMethod method, double[] returns, double confidence) {
        return switch (method) {
            case HISTORICAL -> historicalVar(returns, confidence);
            case PARAMETRIC -> parametricVar(returns, confidence);
            case MONTE_CARLO -> monteCarloVar(returns, confidence);
        };
    }

    /**
     * Absolute Pearson correlation of two equally long series, or empty when either series
     * is shorter than 2 or has zero variance.
     */
    public OptionalDouble correlation(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        if (n < MIN_OBSERVATIONS) {
            return OptionalDouble.empty();
        }
        double[] x = Arrays.copyOfRange(a, a.length - n, a.length);
        double[] y = Arrays.copyOfRange(b, b.length - n, b.length);
        double r = new PearsonsCorrelation().correlation(x, y);
        return Double.isNaN(r) ? OptionalDouble.empty() : OptionalDouble.of(Math.abs(r));
    }

    /** Simple period-over-period returns: {@code p[i] / p[i-1] - 1}. */
    public double[] returnsFromPrices(List<BigDecimal> prices) {
        if (prices.size() < 2) {
            return new double[0];
        }
        double[] returns = new double[prices.size() - 1];
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1).doubleValue();
            returns[i - 1] = previous == 0.0 ? 0.0 : prices.get(i).doubleValue() / previous - 1.0;
        }
        return returns;
    }

    /** Signed empirical quantile at index floor((1 - confidence) * n) of the sorted sample. */
    private static double quantile(double[] sample, double confidence) {
        double[] sorted = sample.clone();
        Arrays.sort(sorted);
        int index = (int) Math.floor((1.0 - confidence) * sorted.length + INDEX_EPSILON);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    private static void requireConfidence(double confidence) {
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new ValidationException("confidence", "Confidence must be between 0 and 1, got " + confidence);
        }
    }
}
