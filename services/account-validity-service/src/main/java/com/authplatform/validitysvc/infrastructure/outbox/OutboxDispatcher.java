package com.authplatform.validitysvc.infrastructure.outbox;

import com.authplatform.validitysvc.domain.model.OutboxEvent;
import com.authplatform.validitysvc.infra.persistence.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays outbox events to Kafka. Events are sent one by one and marked in the
 * polling transaction; a failed send is retried on later polls up to {@link #MAX_RETRIES}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxDispatcher {

    static final int BATCH_SIZE = 100;
    public static final int MAX_RETRIES = 5;
    static final String TOPIC_PREFIX = "account-validity-service.";
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxEventRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:1000}",
            initialDelayString = "${app.outbox.initial-delay-ms:0}")
    @Transactional
    public void dispatchEvents() {
        List<OutboxEvent> events = outboxRepository.findUnprocessedEvents(MAX_RETRIES, PageRequest.of(0, BATCH_SIZE));

        if (events.isEmpty()) {
            return;
        }

        log.debug("Dispatching {} outbox events", events.size());

        for (OutboxEvent event : events) {
            processEvent(event);
        }
    }

    static String topicFor(String eventType) {
        return TOPIC_PREFIX + eventType.toLowerCase(Locale.ROOT).replace("_", "-");
    }

    private void processEvent(OutboxEvent event) {
        String topic = topicFor(event.getEventType());
        try {
            kafkaTemplate.send(topic, event.getAggregateId(), event.getPayloadJson())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            event.markAsProcessed();
            log.debug("Event sent to Kafka: eventId={}, topic={}", event.getId(), topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            event.recordFailure("interrupted");
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to send event to Kafka: eventId={}, error={}", event.getId(), e.getMessage());
            event.recordFailure(e.getMessage());
        }
        outboxRepository.save(event);
    }
}
