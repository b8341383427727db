package com.authplatform.validitysvc.api.view;

import com.authplatform.validitysvc.domain.model.RenewalOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * HTML shown after a renewal link is opened in a browser.
 */
@Component
public class RenewalPageRenderer {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private static final String PAGE = """
            <!DOCTYPE html>
            <html lang="en">
            <head><meta charset="utf-8"><title>%s</title></head>
            <body>
            <p>%s</p>
            </body>
            </html>
            """;

    public RenderedPage render(RenewalOutcome outcome) {
        if (outcome.valid()) {
            return new RenderedPage(HttpStatus.OK, PAGE.formatted("Account renewed",
                    "Your account has been successfully renewed and is valid until "
                            + formatDate(outcome.expirationTs()) + "."));
        }
        if (outcome.stale()) {
            return new RenderedPage(HttpStatus.OK, PAGE.formatted("Account already renewed",
                    "Your account is valid until " + formatDate(outcome.expirationTs()) + "."));
        }
        return new RenderedPage(HttpStatus.NOT_FOUND, PAGE.formatted("Invalid renewal link",
                "This renewal link is invalid or has been replaced by a newer one."));
    }

    static String formatDate(long expirationTs) {
        return DATE_FORMAT.format(Instant.ofEpochMilli(expirationTs));
    }

    public record RenderedPage(HttpStatus status, String html) {
    }
}
