package com.authplatform.validitysvc.infrastructure.logging;

import com.authplatform.validitysvc.config.LoggingConfig;
import com.authplatform.validitysvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes audit events as single-line JSON to the application log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditLogger {

    private static final String SERVICE_ID = "account-validity-service";

    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;

    public void audit(String eventType, String userId, String description, Map<String, String> metadata) {
        record(AuditEvent.of(eventType, userId, securityUtils.getCurrentCorrelationId(), description, metadata));
    }

    public void record(AuditEvent event) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("eventType", event.eventType());
        entry.put("serviceId", SERVICE_ID);
        entry.put("userId", event.userId());
        entry.put("correlationId", event.correlationId());
        entry.put("description", LoggingConfig.maskSensitiveData(event.description()));
        if (event.metadata() != null && !event.metadata().isEmpty()) {
            entry.put("metadata", event.metadata());
        }
        entry.put("timestamp", event.timestamp().toString());

        try {
            log.info("[AUDIT] {}", objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("[AUDIT] type={} userId={} (unserializable: {})", event.eventType(), event.userId(), e.getMessage());
        }
    }
}
