package com.authplatform.validitysvc.infrastructure.messaging;

import com.authplatform.validitysvc.domain.renewal.RenewalService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Starts the validity period of accounts registered on user-service.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserRegisteredListener {

    private final RenewalService renewalService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = "${app.messaging.user-registered-topic:user-service.userregistered}",
            groupId = "${spring.kafka.consumer.group-id:account-validity-service}")
    public void onUserRegistered(String payload) throws JsonProcessingException {
        JsonNode event = objectMapper.readTree(payload);
        String userId = event.path("userId").asText(null);
        if (userId == null || userId.isBlank()) {
            log.warn("UserRegistered event without userId ignored");
            return;
        }
        renewalService.onRegistration(userId);
    }
}
