package com.authplatform.validitysvc.domain.validity;

import com.authplatform.validitysvc.config.ValidityPolicy;
import com.authplatform.validitysvc.domain.model.AccountValidity;
import com.authplatform.validitysvc.domain.model.ExpiringAccount;
import com.authplatform.validitysvc.domain.model.LegacyValidity;
import com.authplatform.validitysvc.domain.model.TokenFormat;
import com.authplatform.validitysvc.domain.model.TokenOwnership;
import com.authplatform.validitysvc.domain.port.AccountDirectory;
import com.authplatform.validitysvc.infra.persistence.AccountValidityRepository;
import com.authplatform.validitysvc.shared.exception.TokenConflictException;
import com.authplatform.validitysvc.shared.exception.ValidityRecordNotFoundException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Transactional record keeper for account validity.
 * <p>
 * Every public operation is one transaction. Token uniqueness is left to the database
 * constraints; violations surface as {@link TokenConflictException}. Expiration reads are
 * cached per account and invalidated once the writing transaction completes.
 */
@Service
@Slf4j
public class ValidityStore {

    private static final int EXPIRATION_CACHE_SIZE = 100_000;

    private final AccountValidityRepository repository;
    private final AccountDirectory directory;
    private final ValidityPolicy policy;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final Random random;
    private final Cache<String, Optional<Long>> expirationCache;

    @Autowired
    public ValidityStore(
            AccountValidityRepository repository,
            AccountDirectory directory,
            ValidityPolicy policy,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this(repository, directory, policy, clock, new TransactionTemplate(transactionManager), new SecureRandom());
    }

    ValidityStore(
            AccountValidityRepository repository,
            AccountDirectory directory,
            ValidityPolicy policy,
            Clock clock,
            TransactionTemplate transactionTemplate,
            Random random) {
        this.repository = repository;
        this.directory = directory;
        this.policy = policy;
        this.clock = clock;
        this.transactionTemplate = transactionTemplate;
        this.random = random;
        this.expirationCache = Caffeine.newBuilder()
                .maximumSize(EXPIRATION_CACHE_SIZE)
                .expireAfterAccess(Duration.ofMinutes(30))
                .build();
    }

    /**
     * Inserts or replaces the whole validity record of an account.
     *
     * @param token       token to keep on the record, or null to clear it
     * @param tokenUsedTs when the kept token was consumed, or null
     */
    @Transactional
    public void upsertValidity(String userId, long expirationTs, boolean emailSent, String token, Long tokenUsedTs) {
        AccountValidity validity = repository.findById(userId)
                .orElseGet(() -> AccountValidity.builder().userId(userId).build());
        validity.setExpirationTsMs(expirationTs);
        validity.setEmailSent(emailSent);
        validity.assignToken(token);
        validity.setTokenUsedTsMs(tokenUsedTs);
        try {
            repository.saveAndFlush(validity);
        } catch (DataIntegrityViolationException e) {
            if (token == null) {
                throw e;
            }
            throw new TokenConflictException(e);
        }
        invalidateExpiration(userId);
    }

    /**
     * Expiration of the account in milliseconds since epoch, empty if the account is not tracked.
     */
    public Optional<Long> getExpiration(String userId) {
        return expirationCache.get(userId, repository::findExpirationTsByUserId);
    }

    /**
     * Makes {@code token} the account's only token and marks it unused.
     *
     * @throws TokenConflictException          if the token is already taken
     * @throws ValidityRecordNotFoundException if the account is not tracked
     */
    @Transactional
    public void setToken(String userId, String token) {
        int updated;
        try {
            updated = TokenFormat.of(token) == TokenFormat.MANUAL
                    ? repository.updateShortRenewalToken(userId, token)
                    : repository.updateLongRenewalToken(userId, token);
        } catch (DataIntegrityViolationException e) {
            throw new TokenConflictException(e);
        }
        if (updated == 0) {
            throw new ValidityRecordNotFoundException();
        }
    }

    /**
     * Finds the account a token belongs to. Manual tokens are only unique per account,
     * so they resolve only together with the owning account id.
     *
     * @param userId if not null, the token must also belong to this account
     * @throws ValidityRecordNotFoundException if nothing matches
     */
    @Transactional(readOnly = true, noRollbackFor = ValidityRecordNotFoundException.class)
    public TokenOwnership resolveToken(String token, String userId) {
        Optional<AccountValidity> found;
        if (TokenFormat.of(token) == TokenFormat.MANUAL) {
            found = userId == null
                    ? Optional.empty()
                    : repository.findByShortRenewalTokenAndUserId(token, userId);
        } else {
            found = userId == null
                    ? repository.findByLongRenewalToken(token)
                    : repository.findByLongRenewalTokenAndUserId(token, userId);
        }
        return found
                .map(v -> new TokenOwnership(v.getUserId(), v.getExpirationTsMs(), v.getTokenUsedTsMs()))
                .orElseThrow(ValidityRecordNotFoundException::new);
    }

    /**
     * Consumes the account's token and moves its expiration in one conditional update.
     * Only the first of several concurrent callers wins.
     *
     * @return true if this call consumed the token, false if it was already consumed or replaced
     */
    @Transactional
    public boolean consumeToken(String userId, String token, long expirationTs, boolean emailSent, long tokenUsedTs) {
        int updated = TokenFormat.of(token) == TokenFormat.MANUAL
                ? repository.consumeShortRenewalToken(userId, token, expirationTs, emailSent, tokenUsedTs)
                : repository.consumeLongRenewalToken(userId, token, expirationTs, emailSent, tokenUsedTs);
        if (updated > 0) {
            invalidateExpiration(userId);
        }
        return updated > 0;
    }

    @Transactional
    public void setNotified(String userId, boolean emailSent) {
        if (repository.updateEmailSent(userId, emailSent) == 0) {
            throw new ValidityRecordNotFoundException();
        }
    }

    /**
     * Sets the expiration to now + period and clears the notified flag, creating the record
     * if needed. An existing expiration is overwritten.
     */
    @Transactional
    public long setDefaultExpiration(String userId) {
        long expirationTs = clock.millis() + policy.periodMs();
        AccountValidity validity = repository.findById(userId)
                .orElseGet(() -> AccountValidity.builder().userId(userId).build());
        validity.setExpirationTsMs(expirationTs);
        validity.setEmailSent(false);
        repository.save(validity);
        invalidateExpiration(userId);
        return expirationTs;
    }

    /**
     * Accounts not yet notified whose expiration is at most {@code windowMs} away,
     * including accounts that already expired.
     */
    public List<ExpiringAccount> listAccountsExpiringWithin(long windowMs) {
        List<ExpiringAccount> result = new ArrayList<>();
        forEachExpiringBatch(windowMs, policy.scanBatchSize(), result::addAll);
        return result;
    }

    /**
     * One keyset page of {@link #listAccountsExpiringWithin(long)}, ordered by account id.
     */
    @Transactional(readOnly = true)
    public List<ExpiringAccount> listAccountsExpiringWithin(long windowMs, String afterUserId, int limit) {
        long threshold = clock.millis() + windowMs;
        return toExpiring(repository.findExpiringAfter(threshold, afterUserId == null ? "" : afterUserId,
                PageRequest.of(0, limit)));
    }

    /**
     * Walks all expiring accounts page by page. The threshold is fixed for the whole walk.
     */
    public void forEachExpiringBatch(long windowMs, int batchSize, Consumer<List<ExpiringAccount>> consumer) {
        long threshold = clock.millis() + windowMs;
        String cursor = "";
        while (true) {
            List<ExpiringAccount> page = toExpiring(
                    repository.findExpiringAfter(threshold, cursor, PageRequest.of(0, batchSize)));
            if (page.isEmpty()) {
                return;
            }
            consumer.accept(page);
            if (page.size() < batchSize) {
                return;
            }
            cursor = page.get(page.size() - 1).userId();
        }
    }

    /**
     * Adds up to {@code batchSize} host accounts that have no record yet. Legacy state reported
     * by the host is imported as is; other accounts get now + period minus a random offset of
     * at most a tenth of the period, so their notices do not all go out at once.
     * <p>
     * Records are only ever inserted: an account that got a record after the directory walk,
     * for instance through registration, is left untouched.
     *
     * @return number of missing accounts handled by this pass, whether inserted or found
     *         registered meanwhile; fewer than {@code batchSize} means the backfill is done
     */
    public int bootstrapMissing(int batchSize) {
        List<String> missing = findMissingAccounts(batchSize);
        if (missing.isEmpty()) {
            return 0;
        }

        Map<String, LegacyValidity> legacy = directory.findLegacyValidity(missing);
        long defaultExpirationTs = clock.millis() + policy.periodMs();
        long maxJitter = policy.expirationJitterMs();

        Integer inserted = transactionTemplate.execute(status -> {
            Set<String> registered = new HashSet<>(repository.findExistingUserIds(missing));
            List<AccountValidity> rows = new ArrayList<>(missing.size());
            for (String userId : missing) {
                if (registered.contains(userId)) {
                    log.debug("Skipping backfill of userId={}, record created meanwhile", userId);
                    continue;
                }
                rows.add(newRecord(userId, legacy.get(userId), defaultExpirationTs, maxJitter));
            }
            repository.saveAll(rows);
            repository.flush();
            return rows.size();
        });
        missing.forEach(expirationCache::invalidate);
        log.debug("Backfill pass: {} missing, {} inserted", missing.size(), inserted);
        return missing.size();
    }

    private AccountValidity newRecord(String userId, LegacyValidity state, long defaultExpirationTs, long maxJitter) {
        if (state != null) {
            AccountValidity row = AccountValidity.builder()
                    .userId(userId)
                    .expirationTsMs(state.expirationTsMs())
                    .emailSent(state.emailSent())
                    .tokenUsedTsMs(state.tokenUsedTsMs())
                    .build();
            row.assignToken(state.renewalToken());
            return row;
        }
        long offset = maxJitter > 0 ? random.nextLong(maxJitter + 1) : 0L;
        return AccountValidity.builder()
                .userId(userId)
                .expirationTsMs(defaultExpirationTs - offset)
                .emailSent(false)
                .build();
    }

    @Transactional(readOnly = true)
    public Optional<String> getRenewalToken(String userId) {
        return repository.findById(userId).map(AccountValidity::currentToken);
    }

    private List<String> findMissingAccounts(int batchSize) {
        List<String> missing = new ArrayList<>(batchSize);
        String cursor = "";
        while (missing.size() < batchSize) {
            List<String> page = directory.listAccountIds(cursor, batchSize);
            if (page.isEmpty()) {
                break;
            }
            Set<String> existing = new HashSet<>(repository.findExistingUserIds(page));
            for (String userId : page) {
                if (!existing.contains(userId) && missing.size() < batchSize) {
                    missing.add(userId);
                }
            }
            if (page.size() < batchSize) {
                break;
            }
            cursor = page.get(page.size() - 1);
        }
        return missing;
    }

    private static List<ExpiringAccount> toExpiring(List<AccountValidity> rows) {
        return rows.stream()
                .map(row -> new ExpiringAccount(row.getUserId(), row.getExpirationTsMs()))
                .toList();
    }

    private void invalidateExpiration(String userId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    expirationCache.invalidate(userId);
                }
            });
        } else {
            expirationCache.invalidate(userId);
        }
    }
}
