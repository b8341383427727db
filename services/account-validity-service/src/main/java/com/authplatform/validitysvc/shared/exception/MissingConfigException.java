package com.authplatform.validitysvc.shared.exception;

public final class MissingConfigException extends AccountValidityException {

    private final String property;

    public MissingConfigException(String property) {
        super("'" + property + "' is required when using email account validity");
        this.property = property;
    }

    public String getProperty() {
        return property;
    }

    @Override
    public String getErrorCode() {
        return "MISSING_CONFIG";
    }

    @Override
    public int getHttpStatus() {
        return 500;
    }
}
