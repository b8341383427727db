package com.authplatform.validitysvc.shared.exception;

public final class InvalidFormatException extends AccountValidityException {

    public InvalidFormatException(String value) {
        super("Invalid duration: '" + value + "'");
    }

    public InvalidFormatException(String value, Throwable cause) {
        super("Invalid duration: '" + value + "'", cause);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_FORMAT";
    }

    @Override
    public int getHttpStatus() {
        return 500;
    }
}
