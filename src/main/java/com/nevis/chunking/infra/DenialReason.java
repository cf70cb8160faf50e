package com.nevis.chunking.infra;

public enum DenialReason {
    GLOBAL_RATE,
    DOMAIN_RATE,
    BATCH_CALLS,
    BATCH_SHARE,
    DAILY_COST
}
