package com.authplatform.validitysvc.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Raises a flag when the context starts closing. Batch loops (expiry scan, backfill)
 * check it between batches and stop; the batch in flight completes.
 */
@Configuration
@Slf4j
public class GracefulShutdownConfig {

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Bean
    public ApplicationListener<ContextClosedEvent> gracefulShutdownListener() {
        return event -> {
            if (shuttingDown.compareAndSet(false, true)) {
                log.info("Received shutdown signal, batch jobs will stop after the current batch");
            }
        };
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
}
