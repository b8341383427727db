package com.authplatform.validitysvc.infrastructure.outbox;

import com.authplatform.validitysvc.domain.model.OutboxEvent;
import com.authplatform.validitysvc.infra.persistence.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Records validity events in the outbox table, inside the caller's transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    public static final String AGGREGATE_TYPE = "AccountValidity";
    public static final String ACCOUNT_RENEWED = "AccountRenewed";
    public static final String ACCOUNT_VALIDITY_SET = "AccountValiditySet";
    public static final String RENEWAL_NOTICE_SENT = "RenewalNoticeSent";

    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(String userId, String eventType, Map<String, Object> payload) {
        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox event: type={}, userId={}", eventType, userId, e);
            throw new IllegalStateException("Failed to serialize outbox event", e);
        }

        outboxRepository.save(OutboxEvent.forAccount(AGGREGATE_TYPE, userId, eventType, payloadJson));
        log.debug("Published outbox event: type={}, userId={}", eventType, userId);
    }
}
