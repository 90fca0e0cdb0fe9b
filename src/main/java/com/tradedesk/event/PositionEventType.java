package com.tradedesk.event;

public enum PositionEventType {
    OPENED,
    INCREASED,
    REDUCED,
    FLIPPED,
    CLOSED
}
