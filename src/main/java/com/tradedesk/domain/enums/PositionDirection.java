package com.tradedesk.domain.enums;

/** Direction of exposure. Lots are tracked per direction and never netted against each other. */
public enum PositionDirection {
    LONG,
    SHORT;

    public static PositionDirection of(OrderSide side) {
        return side == OrderSide.BUY ? LONG : SHORT;
    }

    public PositionDirection opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
