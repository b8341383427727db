package com.authplatform.validitysvc.domain.notification;

import com.authplatform.validitysvc.config.ValidityPolicy;
import com.authplatform.validitysvc.domain.port.AccountDirectory;
import com.authplatform.validitysvc.domain.port.MailTransport;
import com.authplatform.validitysvc.domain.renewal.RenewalService;
import com.authplatform.validitysvc.domain.validity.ValidityStore;
import com.authplatform.validitysvc.infrastructure.logging.AuditEvent;
import com.authplatform.validitysvc.infrastructure.logging.AuditLogger;
import com.authplatform.validitysvc.infrastructure.metrics.ValidityMetrics;
import com.authplatform.validitysvc.infrastructure.outbox.OutboxPublisher;
import com.authplatform.validitysvc.shared.exception.MissingExpirationException;
import com.authplatform.validitysvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;

/**
 * Sends renewal notices to every email address of an account.
 */
@Service
@Slf4j
public class RenewalNotificationService {

    private final AccountDirectory directory;
    private final MailTransport mailTransport;
    private final RenewalService renewalService;
    private final RenewalEmailComposer composer;
    private final ValidityStore store;
    private final ValidityPolicy policy;
    private final OutboxPublisher outboxPublisher;
    private final AuditLogger auditLogger;
    private final ValidityMetrics metrics;
    private final SecurityUtils securityUtils;
    private final TransactionTemplate transactionTemplate;

    public RenewalNotificationService(
            AccountDirectory directory,
            MailTransport mailTransport,
            RenewalService renewalService,
            RenewalEmailComposer composer,
            ValidityStore store,
            ValidityPolicy policy,
            OutboxPublisher outboxPublisher,
            AuditLogger auditLogger,
            ValidityMetrics metrics,
            SecurityUtils securityUtils,
            PlatformTransactionManager transactionManager) {
        this.directory = directory;
        this.mailTransport = mailTransport;
        this.renewalService = renewalService;
        this.composer = composer;
        this.store = store;
        this.policy = policy;
        this.outboxPublisher = outboxPublisher;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.securityUtils = securityUtils;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Sends a notice for the account's current expiration.
     *
     * @throws MissingExpirationException if the account is not tracked
     */
    public boolean sendRenewalEmailToUser(String userId) {
        long expirationTs = store.getExpiration(userId).orElseThrow(MissingExpirationException::new);
        return sendRenewalEmail(userId, expirationTs);
    }

    /**
     * Issues a fresh token and mails it to each address of the account, then marks the
     * account as notified. Accounts without an address are left untouched, so an
     * operator has to renew them.
     *
     * @return false if the account has no email address
     */
    public boolean sendRenewalEmail(String userId, long expirationTs) {
        List<String> addresses = directory.getEmailAddresses(userId);
        if (addresses.isEmpty()) {
            log.info("No email address for userId={}, renewal notice skipped", userId);
            return false;
        }

        String displayName = resolveDisplayName(userId);
        String token = renewalService.issueToken(userId, !policy.sendLinks());
        RenewalEmail email = composer.compose(displayName, expirationTs, token);

        int delivered = 0;
        for (String address : addresses) {
            if (deliver(userId, address, email)) {
                delivered++;
            }
        }

        int deliveredCount = delivered;
        transactionTemplate.executeWithoutResult(status -> {
            store.setNotified(userId, true);
            outboxPublisher.publish(userId, OutboxPublisher.RENEWAL_NOTICE_SENT, Map.of(
                    "userId", userId,
                    "expirationTs", expirationTs,
                    "recipients", addresses.size(),
                    "delivered", deliveredCount));
        });
        auditLogger.audit(AuditEvent.RENEWAL_NOTICE_SENT, userId, "Renewal notice sent",
                Map.of("recipients", String.valueOf(addresses.size()),
                        "delivered", String.valueOf(deliveredCount)));
        return true;
    }

    private boolean deliver(String userId, String address, RenewalEmail email) {
        try {
            if (mailTransport.send(address, email.subject(), email.htmlBody(), email.textBody())) {
                metrics.recordNoticeSent();
                return true;
            }
            log.warn("Renewal notice not accepted for {} (userId={})", securityUtils.maskEmail(address), userId);
        } catch (RuntimeException e) {
            log.warn("Renewal notice failed for {} (userId={}): {}",
                    securityUtils.maskEmail(address), userId, e.getMessage());
        }
        metrics.recordNoticeFailed();
        return false;
    }

    private String resolveDisplayName(String userId) {
        try {
            return directory.getDisplayName(userId)
                    .filter(name -> !name.isBlank())
                    .orElse(userId);
        } catch (RuntimeException e) {
            log.warn("Display name lookup failed for userId={}, using the account id: {}", userId, e.getMessage());
            return userId;
        }
    }
}
