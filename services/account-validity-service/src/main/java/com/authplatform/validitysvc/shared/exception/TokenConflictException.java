package com.authplatform.validitysvc.shared.exception;

public final class TokenConflictException extends AccountValidityException {

    public TokenConflictException(Throwable cause) {
        super("Renewal token is already in use", cause);
    }

    @Override
    public String getErrorCode() {
        return "TOKEN_CONFLICT";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
