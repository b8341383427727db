package com.authplatform.validitysvc.property.domain;

import com.authplatform.validitysvc.domain.model.AccountValidity;
import com.authplatform.validitysvc.domain.model.TokenFormat;
import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Tag;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for the validity record.
 * Feature: account-validity
 */
@Tag("Feature: account-validity, Property 4: Single Active Token")
class AccountValidityPropertyTest {

    @Property(tries = 100)
    @Label("Property 4: a record holds at most one token")
    void recordHoldsAtMostOneToken(
            @ForAll("tokens") String first,
            @ForAll("tokens") String second) {

        AccountValidity validity = AccountValidity.builder().userId("u").expirationTsMs(1L).build();
        validity.assignToken(first);
        validity.assignToken(second);

        assertThat(validity.currentToken()).isEqualTo(second);
        assertThat(validity.getLongRenewalToken() == null || validity.getShortRenewalToken() == null).isTrue();
        if (TokenFormat.of(second) == TokenFormat.MANUAL) {
            assertThat(validity.getShortRenewalToken()).isEqualTo(second);
        } else {
            assertThat(validity.getLongRenewalToken()).isEqualTo(second);
        }
    }

    @Property(tries = 100)
    @Label("Property 1: an account is expired from its expiration instant on")
    void expiredFromExpirationInstant(
            @ForAll @LongRange(min = 1, max = 4_000_000_000_000L) long expirationTs,
            @ForAll @LongRange(min = -1_000_000, max = 1_000_000) long offset) {

        AccountValidity validity = AccountValidity.builder().userId("u").expirationTsMs(expirationTs).build();

        assertThat(validity.isExpiredAt(expirationTs + offset)).isEqualTo(offset >= 0);
    }

    @Example
    void clearingTokenRemovesBothColumns() {
        AccountValidity validity = AccountValidity.builder().userId("u").build();
        validity.assignToken("12345678");
        validity.assignToken(null);

        assertThat(validity.currentToken()).isNull();
        assertThat(validity.isTokenUsed()).isFalse();
    }

    @Provide
    Arbitrary<String> tokens() {
        return Arbitraries.oneOf(
                Arbitraries.strings().alpha().ofLength(32),
                Arbitraries.strings().numeric().ofLength(8)
        );
    }
}
