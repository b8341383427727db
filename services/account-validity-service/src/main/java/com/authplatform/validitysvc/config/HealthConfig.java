package com.authplatform.validitysvc.config;

import com.authplatform.validitysvc.infra.persistence.OutboxEventRepository;
import com.authplatform.validitysvc.infrastructure.directory.UserServiceDirectoryClient;
import com.authplatform.validitysvc.infrastructure.outbox.OutboxDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

@Configuration
@RequiredArgsConstructor
public class HealthConfig {

    static final Status DEGRADED = new Status("DEGRADED", "Outbox events could not be relayed");
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final OutboxEventRepository outboxRepository;
    private final ObjectProvider<UserServiceDirectoryClient> directoryClient;

    @Bean
    public HealthIndicator validityStoreHealthIndicator() {
        return () -> {
            try (Connection conn = dataSource.getConnection()) {
                if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                    return Health.down().withDetail("reason", "connection invalid").build();
                }
                return Health.up()
                        .withDetail("database", conn.getMetaData().getDatabaseProductName())
                        .build();
            } catch (SQLException e) {
                return Health.down(e).build();
            }
        };
    }

    /**
     * Reports the relay backlog; events past their last retry need an operator.
     */
    @Bean
    public HealthIndicator outboxHealthIndicator() {
        return () -> {
            long pending = outboxRepository.countByProcessedAtIsNull();
            long exhausted = outboxRepository.countByProcessedAtIsNullAndRetryCountGreaterThanEqual(
                    OutboxDispatcher.MAX_RETRIES);
            Health.Builder builder = exhausted > 0 ? Health.status(DEGRADED) : Health.up();
            return builder
                    .withDetail("pendingEvents", pending)
                    .withDetail("exhaustedEvents", exhausted)
                    .build();
        };
    }

    /**
     * Host directory reachability, as seen by the client circuit breaker.
     */
    @Bean
    public HealthIndicator accountDirectoryHealthIndicator() {
        return () -> {
            UserServiceDirectoryClient client = directoryClient.getIfAvailable();
            if (client == null) {
                return Health.unknown().withDetail("reason", "no user-service client").build();
            }
            if (!client.isAvailable()) {
                return Health.down().withDetail("circuitBreaker", "OPEN").build();
            }
            return Health.up().build();
        };
    }
}
