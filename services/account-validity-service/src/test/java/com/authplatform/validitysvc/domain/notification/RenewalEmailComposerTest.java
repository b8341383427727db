package com.authplatform.validitysvc.domain.notification;

import com.authplatform.validitysvc.config.ValidityPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RenewalEmailComposerTest {

    private static ValidityPolicy policy(boolean sendLinks) {
        return new ValidityPolicy(3_628_800_000L, 604_800_000L, sendLinks, "Renew your Example account",
                "https://auth.example.com/", "no-reply@example.com", true, 100, 100);
    }

    @Test
    void linkNoticeCarriesRenewalUrlAndDate() {
        RenewalEmail email = new RenewalEmailComposer(policy(true))
                .compose("Alice", 0L, "linktokenlinktokenlinktokenlinkt");

        assertThat(email.subject()).isEqualTo("Renew your Example account");
        assertThat(email.textBody())
                .contains("1 January 1970, 00:00 UTC")
                .contains("https://auth.example.com/api/v1/account-validity/renew?token=linktokenlinktokenlinktokenlinkt");
        assertThat(email.htmlBody()).contains("href=\"https://auth.example.com/api/v1/account-validity/renew?token=");
    }

    @Test
    void displayNameIsEscapedInHtml() {
        RenewalEmail email = new RenewalEmailComposer(policy(true)).compose("<b>Eve</b>", 0L, "token");

        assertThat(email.htmlBody()).contains("&lt;b&gt;Eve&lt;/b&gt;").doesNotContain("<b>Eve</b>");
        assertThat(email.textBody()).contains("<b>Eve</b>");
    }

    @Test
    void codeNoticeHasNoLink() {
        RenewalEmail email = new RenewalEmailComposer(policy(false)).compose("Alice", 0L, "12345678");

        assertThat(email.textBody()).contains("12345678").doesNotContain("http");
        assertThat(email.htmlBody()).contains("<strong>12345678</strong>");
    }
}
