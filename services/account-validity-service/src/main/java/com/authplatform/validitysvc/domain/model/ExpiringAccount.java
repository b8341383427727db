package com.authplatform.validitysvc.domain.model;

public record ExpiringAccount(String userId, Long expirationTs) {
}
