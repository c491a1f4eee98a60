package com.marginledger.event;

public enum PositionEventType {
    OPENED,
    CLOSED
}
