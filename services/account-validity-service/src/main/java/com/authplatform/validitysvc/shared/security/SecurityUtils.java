package com.authplatform.validitysvc.shared.security;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Masking of emails and renewal tokens for logs, plus correlation ID and MDC management.
 */
@Component
public class SecurityUtils {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String USER_ID_KEY = "userId";
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^(.{2})([^@]*)(@.+)$");
    private static final int TOKEN_VISIBLE_CHARS = 4;

    /**
     * Masks an email address by keeping first 2 characters before @ and masking the rest.
     * Example: john.doe@example.com -> jo***@example.com
     */
    public String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "***";
        }
        var matcher = EMAIL_PATTERN.matcher(email.trim().toLowerCase());
        if (matcher.matches()) {
            return matcher.group(1) + "***" + matcher.group(3);
        }
        return email.length() > 2 ? email.substring(0, 2) + "***" : "***";
    }

    /**
     * Keeps the first 4 characters of a renewal token.
     * Example: AbCdEfGh... -> AbCd***
     */
    public String maskToken(String token) {
        if (token == null || token.length() <= TOKEN_VISIBLE_CHARS) {
            return "***";
        }
        return token.substring(0, TOKEN_VISIBLE_CHARS) + "***";
    }

    public String getOrCreateCorrelationId(String provided) {
        if (provided != null && !provided.isBlank()) {
            return provided.trim();
        }
        return UUID.randomUUID().toString();
    }

    public void setMdcContext(String correlationId, String userId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
        if (userId != null) {
            MDC.put(USER_ID_KEY, userId);
        }
    }

    public void clearMdcContext() {
        MDC.remove(CORRELATION_ID_KEY);
        MDC.remove(USER_ID_KEY);
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }
}
