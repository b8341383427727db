package com.authplatform.validitysvc.domain.validity;

import com.authplatform.validitysvc.config.GracefulShutdownConfig;
import com.authplatform.validitysvc.config.ValidityPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Gives every host account that predates this service a validity record.
 * Runs once after startup, one batch per transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ValidityBackfillService {

    private final ValidityStore store;
    private final ValidityPolicy policy;
    private final GracefulShutdownConfig shutdown;

    @Async
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!policy.populateUsers()) {
            log.info("Validity backfill disabled");
            return;
        }
        try {
            int total = backfill();
            log.info("Validity backfill complete: {} accounts handled", total);
        } catch (RuntimeException e) {
            log.error("Validity backfill aborted, it resumes on next startup", e);
        }
    }

    /**
     * @return number of missing accounts handled
     */
    public int backfill() {
        int batchSize = policy.bootstrapBatchSize();
        int total = 0;
        while (!shutdown.isShuttingDown()) {
            int handled = store.bootstrapMissing(batchSize);
            total += handled;
            if (handled < batchSize) {
                break;
            }
            log.debug("Validity backfill progress: {} accounts handled", total);
        }
        return total;
    }
}
