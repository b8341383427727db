package com.authplatform.validitysvc.domain.validity;

import com.authplatform.validitysvc.config.ValidityPolicy;
import com.authplatform.validitysvc.domain.model.AccountValidity;
import com.authplatform.validitysvc.domain.model.ExpiringAccount;
import com.authplatform.validitysvc.domain.model.LegacyValidity;
import com.authplatform.validitysvc.domain.model.TokenOwnership;
import com.authplatform.validitysvc.infra.persistence.AccountValidityRepository;
import com.authplatform.validitysvc.shared.exception.TokenConflictException;
import com.authplatform.validitysvc.shared.exception.ValidityRecordNotFoundException;
import com.authplatform.validitysvc.support.InMemoryAccountDirectory;
import com.authplatform.validitysvc.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import(ValidityStoreTest.StoreTestConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ValidityStoreTest {

    static final long T0 = 1_700_000_000_000L;
    static final long WEEK = 604_800_000L;
    static final long PERIOD = 6 * WEEK;

    @TestConfiguration
    static class StoreTestConfig {

        @Bean
        MutableClock clock() {
            return MutableClock.atMillis(T0);
        }

        @Bean
        InMemoryAccountDirectory accountDirectory() {
            return new InMemoryAccountDirectory();
        }

        @Bean
        ValidityPolicy validityPolicy() {
            return new ValidityPolicy(PERIOD, WEEK, true, "Renew your account",
                    "https://auth.example.com/", "no-reply@example.com", true, 2, 2);
        }

        @Bean
        ValidityStore validityStore(AccountValidityRepository repository, InMemoryAccountDirectory directory,
                                    ValidityPolicy policy, MutableClock clock,
                                    PlatformTransactionManager transactionManager) {
            return new ValidityStore(repository, directory, policy, clock,
                    new TransactionTemplate(transactionManager), new Random(42));
        }
    }

    @Autowired
    private ValidityStore store;

    @Autowired
    private AccountValidityRepository repository;

    @Autowired
    private InMemoryAccountDirectory directory;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        directory.clear();
    }

    @Test
    void expirationIsEmptyForUntrackedAccount() {
        assertThat(store.getExpiration("@nobody:example.com")).isEmpty();
    }

    @Test
    void upsertThenReadExpiration() {
        store.upsertValidity("@alice:example.com", T0 + PERIOD, false, null, null);

        assertThat(store.getExpiration("@alice:example.com")).contains(T0 + PERIOD);

        store.upsertValidity("@alice:example.com", T0 + 2 * PERIOD, true, null, null);

        assertThat(store.getExpiration("@alice:example.com")).contains(T0 + 2 * PERIOD);
        assertThat(repository.findById("@alice:example.com")).get()
                .extracting(AccountValidity::isEmailSent).isEqualTo(true);
    }

    @Test
    void linkTokenResolvesWithoutAccount() {
        store.upsertValidity("@alice:example.com", T0 + PERIOD, false, null, null);
        store.setToken("@alice:example.com", "AbCdEfGhIjKlMnOpQrStUvWxYzAbCdEf");

        TokenOwnership owner = store.resolveToken("AbCdEfGhIjKlMnOpQrStUvWxYzAbCdEf", null);

        assertThat(owner.userId()).isEqualTo("@alice:example.com");
        assertThat(owner.expirationTs()).isEqualTo(T0 + PERIOD);
        assertThat(owner.isConsumed()).isFalse();
    }

    @Test
    void newTokenReplacesPreviousOne() {
        store.upsertValidity("@alice:example.com", T0 + PERIOD, false, null, null);
        store.setToken("@alice:example.com", "firsttokenfirsttokenfirsttokenab");
        store.setToken("@alice:example.com", "secondtokensecondtokensecondtoke");

        assertThatThrownBy(() -> store.resolveToken("firsttokenfirsttokenfirsttokenab", null))
                .isInstanceOf(ValidityRecordNotFoundException.class);
        assertThat(store.getRenewalToken("@alice:example.com")).contains("secondtokensecondtokensecondtoke");
    }

    @Test
    void sameManualCodeIsAllowedForTwoAccounts() {
        store.upsertValidity("@alice:example.com", T0 + PERIOD, false, null, null);
        store.upsertValidity("@bob:example.com", T0 + PERIOD, false, null, null);

        store.setToken("@alice:example.com", "12345678");
        store.setToken("@bob:example.com", "12345678");

        assertThat(store.resolveToken("12345678", "@alice:example.com").userId()).isEqualTo("@alice:example.com");
        assertThat(store.resolveToken("12345678", "@bob:example.com").userId()).isEqualTo("@bob:example.com");
        assertThatThrownBy(() -> store.resolveToken("12345678", null))
                .isInstanceOf(ValidityRecordNotFoundException.class);
    }

    @Test
    void sameLinkTokenForTwoAccountsConflicts() {
        store.upsertValidity("@alice:example.com", T0 + PERIOD, false, null, null);
        store.upsertValidity("@bob:example.com", T0 + PERIOD, false, null, null);
        store.setToken("@alice:example.com", "sometoken");

        assertThatThrownBy(() -> store.setToken("@bob:example.com", "sometoken"))
                .isInstanceOf(TokenConflictException.class);
        assertThat(store.resolveToken("sometoken", null).userId()).isEqualTo("@alice:example.com");
    }

    @Test
    void settingTokenOnUntrackedAccountFails() {
        assertThatThrownBy(() -> store.setToken("@ghost:example.com", "sometoken"))
                .isInstanceOf(ValidityRecordNotFoundException.class);
    }

    @Test
    void tokenIsConsumedOnlyOnce() {
        store.upsertValidity("@alice:example.com", T0 + WEEK, true, null, null);
        store.setToken("@alice:example.com", "sometoken");

        boolean first = store.consumeToken("@alice:example.com", "sometoken", T0 + PERIOD, false, T0);
        boolean second = store.consumeToken("@alice:example.com", "sometoken", T0 + 2 * PERIOD, false, T0 + 1);

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        TokenOwnership owner = store.resolveToken("sometoken", null);
        assertThat(owner.isConsumed()).isTrue();
        assertThat(owner.tokenUsedTs()).isEqualTo(T0);
        assertThat(owner.expirationTs()).isEqualTo(T0 + PERIOD);
        assertThat(store.getExpiration("@alice:example.com")).contains(T0 + PERIOD);
        assertThat(repository.findById("@alice:example.com")).get()
                .extracting(AccountValidity::isEmailSent).isEqualTo(false);
    }

    @Test
    void defaultExpirationOverwritesExistingRecord() {
        store.upsertValidity("@alice:example.com", T0 + 10 * PERIOD, true, null, null);
        assertThat(store.getExpiration("@alice:example.com")).contains(T0 + 10 * PERIOD);

        long written = store.setDefaultExpiration("@alice:example.com");

        assertThat(written).isEqualTo(T0 + PERIOD);
        assertThat(store.getExpiration("@alice:example.com")).contains(T0 + PERIOD);
        assertThat(repository.findById("@alice:example.com")).get()
                .extracting(AccountValidity::isEmailSent).isEqualTo(false);
    }

    @Test
    void notifiedFlagIsWritten() {
        store.upsertValidity("@alice:example.com", T0 + PERIOD, false, null, null);

        store.setNotified("@alice:example.com", true);

        assertThat(repository.findById("@alice:example.com")).get()
                .extracting(AccountValidity::isEmailSent).isEqualTo(true);
        assertThatThrownBy(() -> store.setNotified("@ghost:example.com", true))
                .isInstanceOf(ValidityRecordNotFoundException.class);
    }

    @Test
    void expiringAccountsIncludeExpiredAndWindowOnly() {
        store.upsertValidity("@expired:example.com", T0 - 1, false, null, null);
        store.upsertValidity("@soon:example.com", T0 + WEEK, false, null, null);
        store.upsertValidity("@later:example.com", T0 + WEEK + 1, false, null, null);
        store.upsertValidity("@notified:example.com", T0 + 1, true, null, null);

        List<ExpiringAccount> expiring = store.listAccountsExpiringWithin(WEEK);

        assertThat(expiring).extracting(ExpiringAccount::userId)
                .containsExactly("@expired:example.com", "@soon:example.com");
    }

    @Test
    void expiringAccountsArePagedByAccountId() {
        for (String id : List.of("a", "b", "c", "d", "e")) {
            store.upsertValidity(id, T0 + 1, false, null, null);
        }

        List<ExpiringAccount> first = store.listAccountsExpiringWithin(WEEK, null, 2);
        List<ExpiringAccount> second = store.listAccountsExpiringWithin(WEEK, "b", 2);
        List<ExpiringAccount> last = store.listAccountsExpiringWithin(WEEK, "d", 2);

        assertThat(first).extracting(ExpiringAccount::userId).containsExactly("a", "b");
        assertThat(second).extracting(ExpiringAccount::userId).containsExactly("c", "d");
        assertThat(last).extracting(ExpiringAccount::userId).containsExactly("e");
        assertThat(store.listAccountsExpiringWithin(WEEK)).hasSize(5);
    }

    @Test
    void bootstrapAddsMissingAccountsWithJitteredExpiration() {
        directory.addAccount("a").addAccount("b").addAccount("c").addAccount("d").addAccount("e");
        store.upsertValidity("b", T0 + 3 * PERIOD, true, null, null);

        int firstPass = store.bootstrapMissing(2);
        int secondPass = store.bootstrapMissing(2);
        int lastPass = store.bootstrapMissing(2);

        assertThat(firstPass).isEqualTo(2);
        assertThat(secondPass).isEqualTo(2);
        assertThat(lastPass).isZero();
        assertThat(repository.findAll()).extracting(AccountValidity::getUserId)
                .containsExactlyInAnyOrder("a", "b", "c", "d", "e");
        assertThat(store.getExpiration("b")).contains(T0 + 3 * PERIOD);

        for (String id : List.of("a", "c", "d", "e")) {
            assertThat(store.getExpiration(id)).get()
                    .satisfies(exp -> assertThat(exp).isBetween(T0 + PERIOD - PERIOD / 10, T0 + PERIOD));
        }
    }

    @Test
    void bootstrapImportsLegacyState() {
        directory.addAccount("legacy").addAccount("fresh");
        directory.withLegacy(new LegacyValidity("legacy", T0 + 123, true, "legacytokenlegacytokenlegacytoke", T0 - 5));

        int inserted = store.bootstrapMissing(10);

        assertThat(inserted).isEqualTo(2);
        AccountValidity legacy = repository.findById("legacy").orElseThrow();
        assertThat(legacy.getExpirationTsMs()).isEqualTo(T0 + 123);
        assertThat(legacy.isEmailSent()).isTrue();
        assertThat(legacy.getLongRenewalToken()).isEqualTo("legacytokenlegacytokenlegacytoke");
        assertThat(legacy.getTokenUsedTsMs()).isEqualTo(T0 - 5);
        assertThat(repository.findById("fresh").orElseThrow().isEmailSent()).isFalse();
    }

    @Test
    void bootstrapLeavesAccountsRegisteredDuringThePassAlone() {
        directory.addAccount("a").addAccount("b");
        directory.onLegacyLookup(() ->
                store.upsertValidity("a", T0 + 10 * PERIOD, true, "registeredtokenregisteredtokenre", null));

        int handled = store.bootstrapMissing(10);

        assertThat(handled).isEqualTo(2);
        AccountValidity registered = repository.findById("a").orElseThrow();
        assertThat(registered.getExpirationTsMs()).isEqualTo(T0 + 10 * PERIOD);
        assertThat(registered.isEmailSent()).isTrue();
        assertThat(registered.getLongRenewalToken()).isEqualTo("registeredtokenregisteredtokenre");
        assertThat(store.getExpiration("a")).contains(T0 + 10 * PERIOD);
        assertThat(repository.findById("b")).isPresent();
    }

    @Test
    void builtRecordIsInsertedNeverMergedOverExistingRow() {
        store.upsertValidity("@alice:example.com", T0 + PERIOD, true, null, null);

        AccountValidity duplicate = AccountValidity.builder()
                .userId("@alice:example.com")
                .expirationTsMs(T0)
                .build();

        assertThat(duplicate.isNew()).isTrue();
        assertThatThrownBy(() -> repository.saveAndFlush(duplicate))
                .isInstanceOf(DataAccessException.class);
        AccountValidity kept = repository.findById("@alice:example.com").orElseThrow();
        assertThat(kept.isNew()).isFalse();
        assertThat(kept.getExpirationTsMs()).isEqualTo(T0 + PERIOD);
        assertThat(kept.isEmailSent()).isTrue();
    }

    @Test
    void defaultExpirationFollowsClock() {
        clock.advanceMillis(WEEK);
        try {
            assertThat(store.setDefaultExpiration("@late:example.com")).isEqualTo(T0 + WEEK + PERIOD);
        } finally {
            clock.advanceMillis(-WEEK);
        }
    }
}
