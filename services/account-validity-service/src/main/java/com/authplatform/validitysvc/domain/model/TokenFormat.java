package com.authplatform.validitysvc.domain.model;

import java.util.regex.Pattern;

public enum TokenFormat {
    /** High-entropy letter token, globally unique, sent as a link. */
    LINK,
    /** Short digit code, unique per account only, typed in by the user. */
    MANUAL;

    private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");

    public static TokenFormat of(String token) {
        if (token != null && DIGITS.matcher(token).matches()) {
            return MANUAL;
        }
        return LINK;
    }
}
