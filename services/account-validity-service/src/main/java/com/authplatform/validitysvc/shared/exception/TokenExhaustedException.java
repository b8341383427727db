package com.authplatform.validitysvc.shared.exception;

public final class TokenExhaustedException extends AccountValidityException {

    private final int attempts;

    public TokenExhaustedException(int attempts) {
        super("Couldn't generate a unique renewal token after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String getErrorCode() {
        return "TOKEN_EXHAUSTED";
    }

    @Override
    public int getHttpStatus() {
        return 500;
    }
}
