package com.authplatform.validitysvc.domain.model;

/**
 * Owner of a renewal token and the owner's current validity state.
 */
public record TokenOwnership(String userId, long expirationTs, Long tokenUsedTs) {

    public boolean isConsumed() {
        return tokenUsedTs != null;
    }
}
