package com.authplatform.validitysvc.shared.exception;

/**
 * Base sealed exception for all Account Validity Service exceptions.
 */
public sealed abstract class AccountValidityException extends RuntimeException
        permits ValidityRecordNotFoundException, TokenConflictException, TokenExhaustedException,
                MissingExpirationException, InvalidFormatException, MissingConfigException {

    protected AccountValidityException(String message) {
        super(message);
    }

    protected AccountValidityException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
    public abstract int getHttpStatus();
}
