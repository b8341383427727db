package com.authplatform.validitysvc.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Configuration
public class LoggingConfig {

    private static final Set<String> FORBIDDEN_FIELDS = Set.of(
            "password", "secret", "apikey", "authorization", "bearer "
    );

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"
    );

    // token=<value> as it appears in renewal links
    private static final Pattern TOKEN_PARAM_PATTERN = Pattern.compile(
            "(token=)([A-Za-z0-9]{4})[A-Za-z0-9]*"
    );

    /**
     * Drops log lines carrying credentials outright.
     */
    @Bean
    public Filter<ILoggingEvent> sensitiveDataFilter() {
        return new Filter<>() {
            @Override
            public FilterReply decide(ILoggingEvent event) {
                String message = event.getFormattedMessage();
                if (message != null) {
                    String lower = message.toLowerCase(Locale.ROOT);
                    for (String field : FORBIDDEN_FIELDS) {
                        if (lower.contains(field)) {
                            return FilterReply.DENY;
                        }
                    }
                }
                return FilterReply.NEUTRAL;
            }
        };
    }

    /**
     * Redacts email addresses and shortens renewal tokens in free text.
     */
    public static String maskSensitiveData(String input) {
        if (input == null) return null;
        String masked = EMAIL_PATTERN.matcher(input).replaceAll("[EMAIL_REDACTED]");
        return TOKEN_PARAM_PATTERN.matcher(masked).replaceAll("$1$2***");
    }
}
