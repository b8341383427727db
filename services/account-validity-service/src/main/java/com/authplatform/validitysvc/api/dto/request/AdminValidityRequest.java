package com.authplatform.validitysvc.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Operator override. Without {@code expiration_ts} the account gets now + period;
 * {@code enable_renewal_emails} defaults to true.
 */
public record AdminValidityRequest(
    @JsonProperty("user_id")
    @NotBlank(message = "user_id is required")
    String userId,

    @JsonProperty("expiration_ts")
    @PositiveOrZero(message = "expiration_ts must not be negative")
    Long expirationTs,

    @JsonProperty("enable_renewal_emails")
    Boolean enableRenewalEmails
) {
    public boolean renewalEmailsEnabled() {
        return enableRenewalEmails == null || enableRenewalEmails;
    }
}
