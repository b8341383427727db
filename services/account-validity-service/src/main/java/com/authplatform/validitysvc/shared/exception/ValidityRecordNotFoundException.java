package com.authplatform.validitysvc.shared.exception;

public final class ValidityRecordNotFoundException extends AccountValidityException {

    public ValidityRecordNotFoundException() {
        super("No account validity record matches the request");
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
