package com.authplatform.validitysvc.config;

import com.authplatform.validitysvc.shared.exception.MissingConfigException;
import com.authplatform.validitysvc.shared.util.DurationParser;

import java.util.IllegalFormatException;

/**
 * Validated account validity settings.
 *
 * @param periodMs          validity period in milliseconds
 * @param renewAtMs         notice window in milliseconds
 * @param sendLinks         whether notices carry a link token (else a manual code)
 * @param renewEmailSubject subject line, app name already substituted
 * @param publicBaseUrl     base URL for renewal links, ends with "/"
 * @param mailFrom          sender address of renewal notices
 */
public record ValidityPolicy(
        long periodMs,
        long renewAtMs,
        boolean sendLinks,
        String renewEmailSubject,
        String publicBaseUrl,
        String mailFrom,
        boolean populateUsers,
        int bootstrapBatchSize,
        int scanBatchSize
) {

    public static final String RENEW_PATH = "api/v1/account-validity/renew";

    public static ValidityPolicy from(AccountValidityProperties props) {
        if (props.getPeriod() == null || props.getPeriod().isBlank()) {
            throw new MissingConfigException("period");
        }
        if (props.getRenewAt() == null || props.getRenewAt().isBlank()) {
            throw new MissingConfigException("renew_at");
        }
        long period = DurationParser.parse(props.getPeriod());
        long renewAt = DurationParser.parse(props.getRenewAt());

        String baseUrl = props.getPublicBaseUrl();
        if (props.isSendLinks() && (baseUrl == null || baseUrl.isBlank())) {
            throw new MissingConfigException("public_baseurl");
        }
        if (baseUrl != null && !baseUrl.isBlank() && !baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }

        return new ValidityPolicy(
                period,
                renewAt,
                props.isSendLinks(),
                formatSubject(props.getRenewEmailSubject(), props.getAppName()),
                baseUrl,
                props.getMailFrom(),
                props.isPopulateUsers(),
                Math.max(1, props.getBootstrapBatchSize()),
                Math.max(1, props.getScanBatchSize())
        );
    }

    /**
     * Upper bound of the random offset subtracted from default expirations of migrated accounts.
     */
    public long expirationJitterMs() {
        return periodMs / 10;
    }

    public String renewalUrl(String token) {
        return publicBaseUrl + RENEW_PATH + "?token=" + token;
    }

    static String formatSubject(String subject, String appName) {
        // Fall back to the bare subject if substitution fails.
        try {
            return String.format(subject, appName);
        } catch (IllegalFormatException e) {
            return subject;
        }
    }
}
