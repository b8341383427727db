package com.authplatform.validitysvc.infrastructure.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.authplatform.validitysvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditLoggerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger logger = (Logger) LoggerFactory.getLogger(AuditLogger.class);
    private AuditLogger auditLogger;

    @BeforeEach
    void setUp() {
        appender.start();
        logger.addAppender(appender);
        auditLogger = new AuditLogger(new SecurityUtils(), objectMapper);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        MDC.clear();
    }

    @Test
    void writesOneJsonLinePerEvent() throws Exception {
        MDC.put("correlationId", "cid-1");

        auditLogger.audit(AuditEvent.ACCOUNT_RENEWED, "@alice:example.com", "Account renewed",
                Map.of("expirationTs", "42"));

        assertThat(appender.list).hasSize(1);
        String line = appender.list.get(0).getFormattedMessage();
        assertThat(line).startsWith("[AUDIT] ");
        JsonNode entry = objectMapper.readTree(line.substring("[AUDIT] ".length()));
        assertThat(entry.get("eventType").asText()).isEqualTo(AuditEvent.ACCOUNT_RENEWED);
        assertThat(entry.get("serviceId").asText()).isEqualTo("account-validity-service");
        assertThat(entry.get("userId").asText()).isEqualTo("@alice:example.com");
        assertThat(entry.get("metadata").get("expirationTs").asText()).isEqualTo("42");
        assertThat(entry.has("timestamp")).isTrue();
    }

    @Test
    void descriptionIsMasked() {
        auditLogger.audit(AuditEvent.RENEWAL_NOTICE_SENT, "@bob:example.com", "Notice sent to bob@example.com", Map.of());

        String line = appender.list.get(0).getFormattedMessage();
        assertThat(line).doesNotContain("bob@example.com").contains("[EMAIL_REDACTED]");
        assertThat(line).doesNotContain("\"metadata\"");
    }
}
