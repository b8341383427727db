package com.authplatform.validitysvc.shared.crypto;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Renewal token generation.
 * Link tokens are long enough to be globally unique; manual tokens are short digit
 * codes a user can type, unique only per account. Uniqueness itself is enforced by the store.
 */
@Component
public class RenewalTokenGenerator {

    public static final int LINK_TOKEN_LENGTH = 32;
    public static final int MANUAL_TOKEN_LENGTH = 8;

    private static final String LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
    private static final String DIGITS = "0123456789";

    private final SecureRandom secureRandom;

    public RenewalTokenGenerator() {
        this(new SecureRandom());
    }

    RenewalTokenGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Generates a 32-letter token for renewal links.
     */
    public String generateLinkToken() {
        return randomString(LETTERS, LINK_TOKEN_LENGTH);
    }

    /**
     * Generates an 8-digit token for manual entry.
     */
    public String generateManualToken() {
        return randomString(DIGITS, MANUAL_TOKEN_LENGTH);
    }

    private String randomString(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(secureRandom.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
