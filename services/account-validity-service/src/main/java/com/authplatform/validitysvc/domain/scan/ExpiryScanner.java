package com.authplatform.validitysvc.domain.scan;

import com.authplatform.validitysvc.config.GracefulShutdownConfig;
import com.authplatform.validitysvc.config.ValidityPolicy;
import com.authplatform.validitysvc.domain.model.ExpiringAccount;
import com.authplatform.validitysvc.domain.notification.RenewalNotificationService;
import com.authplatform.validitysvc.domain.validity.ValidityStore;
import com.authplatform.validitysvc.infrastructure.metrics.ValidityMetrics;
import com.authplatform.validitysvc.shared.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Periodically notifies accounts whose expiration falls within the notice window.
 * One account failing does not stop the scan.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpiryScanner {

    private final ValidityStore store;
    private final RenewalNotificationService notificationService;
    private final ValidityPolicy policy;
    private final GracefulShutdownConfig shutdown;
    private final ValidityMetrics metrics;
    private final SecurityUtils securityUtils;

    @Scheduled(
            fixedDelayString = "${app.account-validity.scan-interval-ms:1800000}",
            initialDelayString = "${app.account-validity.scan-initial-delay-ms:60000}")
    public void scheduledScan() {
        securityUtils.setMdcContext(securityUtils.getOrCreateCorrelationId(null), null);
        try {
            ScanResult result = scan();
            log.info("Expiry scan finished: notified={}, skipped={}, failed={}",
                    result.notified(), result.skipped(), result.failed());
        } finally {
            securityUtils.clearMdcContext();
        }
    }

    public ScanResult scan() {
        long started = System.nanoTime();
        int notified = 0;
        int skipped = 0;
        int failed = 0;
        String cursor = "";

        while (!shutdown.isShuttingDown()) {
            List<ExpiringAccount> batch = store.listAccountsExpiringWithin(
                    policy.renewAtMs(), cursor, policy.scanBatchSize());
            for (ExpiringAccount account : batch) {
                if (account.expirationTs() == null) {
                    log.warn("Account {} has no expiration, skipped", account.userId());
                    skipped++;
                    continue;
                }
                try {
                    if (notificationService.sendRenewalEmail(account.userId(), account.expirationTs())) {
                        notified++;
                    } else {
                        skipped++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    metrics.recordScanFailure();
                    log.error("Renewal notice failed for userId={}", account.userId(), e);
                }
            }
            if (batch.size() < policy.scanBatchSize()) {
                break;
            }
            cursor = batch.get(batch.size() - 1).userId();
        }

        metrics.recordScan(Duration.ofNanos(System.nanoTime() - started));
        return new ScanResult(notified, skipped, failed);
    }

    public record ScanResult(int notified, int skipped, int failed) {
    }
}
