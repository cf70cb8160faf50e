package com.nevis.chunking.infra;

import java.time.LocalDate;

/**
 * Result of asking the {@link RateLimiter} for one completion call. A granted admission holds
 * a cost reservation until it is either recorded or released.
 */
public record Admission(
    boolean granted,
    DenialReason reason,
    String domain,
    String batchId,
    double reservedCost,
    LocalDate costDay
) {

    static Admission granted(String domain, String batchId, double reservedCost, LocalDate costDay) {
        return new Admission(true, null, domain, batchId, reservedCost, costDay);
    }

    static Admission denied(DenialReason reason, String domain, String batchId) {
        return new Admission(false, reason, domain, batchId, 0.0, null);
    }
}
