package com.authplatform.validitysvc.api.dto.response;

import com.authplatform.validitysvc.domain.model.RenewalOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RenewalResponse(
    boolean valid,
    boolean stale,
    @JsonProperty("expiration_ts") long expirationTs
) {
    public static RenewalResponse from(RenewalOutcome outcome) {
        return new RenewalResponse(outcome.valid(), outcome.stale(), outcome.expirationTs());
    }
}
