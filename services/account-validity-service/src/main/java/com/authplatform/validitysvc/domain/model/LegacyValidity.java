package com.authplatform.validitysvc.domain.model;

/**
 * Validity state the host still holds for an account that predates this service.
 */
public record LegacyValidity(
        String userId,
        long expirationTsMs,
        boolean emailSent,
        String renewalToken,
        Long tokenUsedTsMs
) {
}
