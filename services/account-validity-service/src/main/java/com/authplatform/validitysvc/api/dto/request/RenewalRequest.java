package com.authplatform.validitysvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenewalRequest(
    @NotBlank(message = "Token is required")
    @Size(max = 64, message = "Invalid token format")
    String token
) {}
