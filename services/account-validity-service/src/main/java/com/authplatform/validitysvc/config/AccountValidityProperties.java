package com.authplatform.validitysvc.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Raw {@code app.account-validity.*} settings. Durations stay strings here and are
 * parsed into a {@link ValidityPolicy} at startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.account-validity")
public class AccountValidityProperties {

    /** Validity period granted on registration and on each renewal, e.g. "6w". */
    private String period;

    /** Notice window before expiration in which a renewal email is sent, e.g. "1w". */
    private String renewAt;

    /** Send clickable links (true) or 8-digit codes to type in (false). */
    private boolean sendLinks = true;

    private String renewEmailSubject = "Renew your %s account";

    private String appName = "Auth Platform";

    /** Base URL the renewal links point to. Required when sendLinks is true. */
    private String publicBaseUrl;

    private String mailFrom = "no-reply@auth-platform.com";

    private boolean populateUsers = true;

    private int bootstrapBatchSize = 100;

    private int scanBatchSize = 100;
}
