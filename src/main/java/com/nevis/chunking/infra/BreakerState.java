package com.nevis.chunking.infra;

public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
