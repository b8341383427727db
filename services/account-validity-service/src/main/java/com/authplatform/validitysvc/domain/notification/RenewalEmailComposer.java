package com.authplatform.validitysvc.domain.notification;

import com.authplatform.validitysvc.config.ValidityPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds the renewal notice. With links enabled the notice carries a renewal URL,
 * otherwise the 8-digit code the user enters while signed in.
 */
@Component
@RequiredArgsConstructor
public class RenewalEmailComposer {

    private static final DateTimeFormatter EXPIRATION_FORMAT =
            DateTimeFormatter.ofPattern("d MMMM uuuu, HH:mm 'UTC'", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private final ValidityPolicy policy;

    public RenewalEmail compose(String displayName, long expirationTs, String token) {
        String expiration = formatExpiration(expirationTs);
        String safeName = HtmlUtils.htmlEscape(displayName);

        String html;
        String text;
        if (policy.sendLinks()) {
            String url = policy.renewalUrl(token);
            html = """
                    <html>
                    <body>
                    <p>Hi %s,</p>
                    <p>Your account will expire on %s.</p>
                    <p>To keep using it, <a href="%s">renew your account</a>.</p>
                    </body>
                    </html>
                    """.formatted(safeName, expiration, HtmlUtils.htmlEscape(url));
            text = """
                    Hi %s,

                    Your account will expire on %s.

                    To keep using it, renew your account by opening this link:
                    %s
                    """.formatted(displayName, expiration, url);
        } else {
            html = """
                    <html>
                    <body>
                    <p>Hi %s,</p>
                    <p>Your account will expire on %s.</p>
                    <p>To keep using it, sign in and enter this renewal code: <strong>%s</strong></p>
                    </body>
                    </html>
                    """.formatted(safeName, expiration, token);
            text = """
                    Hi %s,

                    Your account will expire on %s.

                    To keep using it, sign in and enter this renewal code: %s
                    """.formatted(displayName, expiration, token);
        }
        return new RenewalEmail(policy.renewEmailSubject(), html, text);
    }

    static String formatExpiration(long expirationTs) {
        return EXPIRATION_FORMAT.format(Instant.ofEpochMilli(expirationTs));
    }
}
