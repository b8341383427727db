package com.authplatform.validitysvc.infrastructure.logging;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record of a validity change.
 */
public record AuditEvent(
        String eventType,
        String userId,
        String correlationId,
        String description,
        Map<String, String> metadata,
        Instant timestamp
) {
    public static final String ACCOUNT_RENEWED = "ACCOUNT_RENEWED";
    public static final String TOKEN_STALE = "TOKEN_STALE";
    public static final String VALIDITY_SET = "VALIDITY_SET";
    public static final String RENEWAL_NOTICE_SENT = "RENEWAL_NOTICE_SENT";

    public static AuditEvent of(String eventType, String userId, String correlationId,
                                String description, Map<String, String> metadata) {
        return new AuditEvent(eventType, userId, correlationId, description, metadata, Instant.now());
    }
}
