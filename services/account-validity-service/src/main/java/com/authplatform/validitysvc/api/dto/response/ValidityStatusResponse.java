package com.authplatform.validitysvc.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code expired} and {@code expiration_ts} are null for accounts that are not tracked.
 */
public record ValidityStatusResponse(
    @JsonProperty("user_id") String userId,
    Boolean expired,
    @JsonProperty("expiration_ts") Long expirationTs
) {}
