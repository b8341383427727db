package com.authplatform.validitysvc.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AccountValidityProperties.class)
@Slf4j
public class ValidityConfig {

    /**
     * Fails startup on missing or malformed settings.
     */
    @Bean
    public ValidityPolicy validityPolicy(AccountValidityProperties properties) {
        ValidityPolicy policy = ValidityPolicy.from(properties);
        log.info("Account validity enabled: periodMs={}, renewAtMs={}, sendLinks={}",
                policy.periodMs(), policy.renewAtMs(), policy.sendLinks());
        return policy;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
