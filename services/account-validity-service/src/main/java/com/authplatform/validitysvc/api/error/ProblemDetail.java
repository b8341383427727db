package com.authplatform.validitysvc.api.error;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * RFC 7807 problem body, extended with the correlation id and a stable error code.
 * The problem type and title are derived from the error code.
 */
public record ProblemDetail(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        Instant timestamp,
        String correlationId,
        String errorCode,
        Map<String, Object> extensions
) {
    static final String TYPE_BASE = "https://api.auth-platform.com/problems/";

    public static ProblemDetail forCode(String errorCode, int status, String detail,
                                        String instance, String correlationId) {
        return forCode(errorCode, status, detail, instance, correlationId, Map.of());
    }

    public static ProblemDetail forCode(String errorCode, int status, String detail,
                                        String instance, String correlationId,
                                        Map<String, Object> extensions) {
        String slug = errorCode.toLowerCase(Locale.ROOT).replace('_', '-');
        return new ProblemDetail(TYPE_BASE + slug, titleOf(errorCode), status, detail, instance,
                Instant.now(), correlationId, errorCode, extensions);
    }

    // MISSING_EXPIRATION -> "Missing expiration"
    static String titleOf(String errorCode) {
        String words = errorCode.replace('_', ' ').toLowerCase(Locale.ROOT);
        return words.isEmpty() ? words : Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}
