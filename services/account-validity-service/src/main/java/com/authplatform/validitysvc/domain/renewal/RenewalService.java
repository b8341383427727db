package com.authplatform.validitysvc.domain.renewal;

import com.authplatform.validitysvc.config.ValidityPolicy;
import com.authplatform.validitysvc.domain.model.RenewalOutcome;
import com.authplatform.validitysvc.domain.model.TokenFormat;
import com.authplatform.validitysvc.domain.model.TokenOwnership;
import com.authplatform.validitysvc.domain.validity.ValidityStore;
import com.authplatform.validitysvc.infrastructure.logging.AuditEvent;
import com.authplatform.validitysvc.infrastructure.logging.AuditLogger;
import com.authplatform.validitysvc.infrastructure.metrics.ValidityMetrics;
import com.authplatform.validitysvc.infrastructure.outbox.OutboxPublisher;
import com.authplatform.validitysvc.shared.crypto.RenewalTokenGenerator;
import com.authplatform.validitysvc.shared.exception.TokenConflictException;
import com.authplatform.validitysvc.shared.exception.TokenExhaustedException;
import com.authplatform.validitysvc.shared.exception.ValidityRecordNotFoundException;
import com.authplatform.validitysvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Token issuance and renewal.
 * <p>
 * A token moves from unissued to active when issued and to consumed when redeemed;
 * a consumed token never becomes active again. Redeeming pushes the expiration to
 * now + period. Every successful change is recorded in the outbox.
 */
@Service
@Slf4j
public class RenewalService {

    static final int MAX_LINK_TOKEN_ATTEMPTS = 5;

    private final ValidityStore store;
    private final RenewalTokenGenerator tokenGenerator;
    private final ValidityPolicy policy;
    private final Clock clock;
    private final OutboxPublisher outboxPublisher;
    private final AuditLogger auditLogger;
    private final ValidityMetrics metrics;
    private final SecurityUtils securityUtils;

    public RenewalService(
            ValidityStore store,
            RenewalTokenGenerator tokenGenerator,
            ValidityPolicy policy,
            Clock clock,
            OutboxPublisher outboxPublisher,
            AuditLogger auditLogger,
            ValidityMetrics metrics,
            SecurityUtils securityUtils) {
        this.store = store;
        this.tokenGenerator = tokenGenerator;
        this.policy = policy;
        this.clock = clock;
        this.outboxPublisher = outboxPublisher;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.securityUtils = securityUtils;
    }

    /**
     * Issues a fresh token for the account, replacing any previous one.
     * Runs outside a surrounding transaction so each attempt commits on its own.
     *
     * @param useManualFormat issue an 8-digit code instead of a link token
     * @throws TokenExhaustedException if every link token attempt collided
     * @throws TokenConflictException  if a manual code collided
     */
    public String issueToken(String userId, boolean useManualFormat) {
        if (useManualFormat) {
            String code = tokenGenerator.generateManualToken();
            store.setToken(userId, code);
            return code;
        }

        for (int attempt = 1; attempt <= MAX_LINK_TOKEN_ATTEMPTS; attempt++) {
            String token = tokenGenerator.generateLinkToken();
            try {
                store.setToken(userId, token);
                return token;
            } catch (TokenConflictException e) {
                log.warn("Renewal token collision for userId={}, attempt {}/{}", userId, attempt, MAX_LINK_TOKEN_ATTEMPTS);
            }
        }
        throw new TokenExhaustedException(MAX_LINK_TOKEN_ATTEMPTS);
    }

    /**
     * Redeems a renewal token.
     *
     * @param authenticatedUserId account of the caller, or null for an anonymous link click;
     *                            manual codes are only accepted with an account
     */
    @Transactional
    public RenewalOutcome attemptRenewal(String token, String authenticatedUserId) {
        RenewalOutcome outcome = redeem(token, authenticatedUserId);
        metrics.recordRenewal(outcome);
        return outcome;
    }

    private RenewalOutcome redeem(String token, String authenticatedUserId) {
        if (token == null || token.isBlank()) {
            return RenewalOutcome.invalid();
        }
        if (TokenFormat.of(token) == TokenFormat.MANUAL && authenticatedUserId == null) {
            log.debug("Manual renewal code presented without an authenticated account");
            return RenewalOutcome.invalid();
        }

        TokenOwnership owner;
        try {
            owner = store.resolveToken(token, authenticatedUserId);
        } catch (ValidityRecordNotFoundException e) {
            log.debug("Unknown renewal token {}", securityUtils.maskToken(token));
            return RenewalOutcome.invalid();
        }

        if (owner.isConsumed()) {
            auditStale(owner);
            return RenewalOutcome.stale(owner.expirationTs());
        }

        long now = clock.millis();
        long newExpiration = now + policy.periodMs();
        if (!store.consumeToken(owner.userId(), token, newExpiration, false, now)) {
            // Another request consumed the token first.
            try {
                TokenOwnership winner = store.resolveToken(token, owner.userId());
                auditStale(winner);
                return RenewalOutcome.stale(winner.expirationTs());
            } catch (ValidityRecordNotFoundException e) {
                return RenewalOutcome.invalid();
            }
        }

        outboxPublisher.publish(owner.userId(), OutboxPublisher.ACCOUNT_RENEWED, Map.of(
                "userId", owner.userId(),
                "expirationTs", newExpiration,
                "source", "token"));
        auditLogger.audit(AuditEvent.ACCOUNT_RENEWED, owner.userId(), "Account renewed with a renewal token",
                Map.of("token", securityUtils.maskToken(token), "expirationTs", String.valueOf(newExpiration)));
        log.info("Account renewed: userId={}, expirationTs={}", owner.userId(), newExpiration);
        return RenewalOutcome.valid(newExpiration);
    }

    /**
     * Writes a new validity for the account.
     *
     * @param explicitExpiration new expiration, or null for now + period
     * @param keepToken          token left on the record, or null to drop it
     * @return the expiration written
     */
    @Transactional
    public long extend(String userId, Long explicitExpiration, boolean notified, String keepToken) {
        long now = clock.millis();
        long expirationTs = explicitExpiration != null ? explicitExpiration : now + policy.periodMs();
        store.upsertValidity(userId, expirationTs, notified, keepToken, now);
        return expirationTs;
    }

    /**
     * Operator override of an account's validity.
     *
     * @param enableRenewalEmails false marks the account as already notified, so no notice goes out
     */
    @Transactional
    public long setValidityFromAdmin(String userId, Long expirationTs, boolean enableRenewalEmails) {
        long written = extend(userId, expirationTs, !enableRenewalEmails, null);
        outboxPublisher.publish(userId, OutboxPublisher.ACCOUNT_VALIDITY_SET, Map.of(
                "userId", userId,
                "expirationTs", written,
                "renewalEmailsEnabled", enableRenewalEmails));
        auditLogger.audit(AuditEvent.VALIDITY_SET, userId, "Validity set by an administrator",
                Map.of("expirationTs", String.valueOf(written),
                        "renewalEmailsEnabled", String.valueOf(enableRenewalEmails)));
        return written;
    }

    /**
     * Starts the validity of a newly registered account.
     */
    @Transactional
    public long onRegistration(String userId) {
        long expirationTs = store.setDefaultExpiration(userId);
        outboxPublisher.publish(userId, OutboxPublisher.ACCOUNT_VALIDITY_SET, Map.of(
                "userId", userId,
                "expirationTs", expirationTs,
                "renewalEmailsEnabled", true));
        log.info("Validity started for new account: userId={}, expirationTs={}", userId, expirationTs);
        return expirationTs;
    }

    /**
     * Whether the account is expired; empty if it is not tracked.
     */
    public Optional<Boolean> isExpired(String userId) {
        long now = clock.millis();
        return store.getExpiration(userId).map(expirationTs -> now >= expirationTs);
    }

    private void auditStale(TokenOwnership owner) {
        auditLogger.audit(AuditEvent.TOKEN_STALE, owner.userId(), "Renewal token already used",
                Map.of("expirationTs", String.valueOf(owner.expirationTs())));
    }
}
