package com.authplatform.validitysvc.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AdminValidityResponse(@JsonProperty("expiration_ts") long expirationTs) {}
