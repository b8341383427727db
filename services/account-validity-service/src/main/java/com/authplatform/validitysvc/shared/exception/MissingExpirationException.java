package com.authplatform.validitysvc.shared.exception;

public final class MissingExpirationException extends AccountValidityException {

    public MissingExpirationException() {
        super("Account has no expiration time");
    }

    @Override
    public String getErrorCode() {
        return "MISSING_EXPIRATION";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}
