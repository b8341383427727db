package com.authplatform.validitysvc.domain.model;

/**
 * Result of a renewal attempt. Valid and stale are mutually exclusive;
 * both are false only for an invalid token, whose expiration is 0.
 */
public record RenewalOutcome(boolean valid, boolean stale, long expirationTs) {

    private static final RenewalOutcome INVALID = new RenewalOutcome(false, false, 0L);

    public static RenewalOutcome valid(long expirationTs) {
        return new RenewalOutcome(true, false, expirationTs);
    }

    public static RenewalOutcome stale(long expirationTs) {
        return new RenewalOutcome(false, true, expirationTs);
    }

    public static RenewalOutcome invalid() {
        return INVALID;
    }

    public boolean isInvalid() {
        return !valid && !stale;
    }
}
