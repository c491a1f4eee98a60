package com.marginledger.domain.enums;

public enum Direction {
    LONG,
    SHORT
}
