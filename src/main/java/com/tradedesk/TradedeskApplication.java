package com.tradedesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradedeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradedeskApplication.class, args);
    }
}
