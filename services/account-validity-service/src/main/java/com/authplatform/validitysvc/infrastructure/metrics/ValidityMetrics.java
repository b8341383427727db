package com.authplatform.validitysvc.infrastructure.metrics;

import com.authplatform.validitysvc.domain.model.RenewalOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ValidityMetrics {

    private static final String SERVICE_TAG = "account-validity-service";

    private final Counter renewedCounter;
    private final Counter staleCounter;
    private final Counter invalidCounter;
    private final Counter noticeSentCounter;
    private final Counter noticeFailedCounter;
    private final Counter scanFailureCounter;
    private final Timer scanTimer;

    public ValidityMetrics(MeterRegistry registry) {
        this.renewedCounter = renewalCounter(registry, "valid");
        this.staleCounter = renewalCounter(registry, "stale");
        this.invalidCounter = renewalCounter(registry, "invalid");
        this.noticeSentCounter = Counter.builder("account.validity.notice.sent.total")
                .description("Renewal notices delivered, one per address")
                .tag("service", SERVICE_TAG)
                .register(registry);
        this.noticeFailedCounter = Counter.builder("account.validity.notice.failed.total")
                .description("Renewal notices the mail server did not accept")
                .tag("service", SERVICE_TAG)
                .register(registry);
        this.scanFailureCounter = Counter.builder("account.validity.scan.failures.total")
                .description("Accounts whose dispatch failed during a scan")
                .tag("service", SERVICE_TAG)
                .register(registry);
        this.scanTimer = Timer.builder("account.validity.scan.duration")
                .description("Expiry scan duration")
                .tag("service", SERVICE_TAG)
                .register(registry);
    }

    private static Counter renewalCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("account.validity.renewal.total")
                .description("Renewal attempts by outcome")
                .tag("service", SERVICE_TAG)
                .tag("outcome", outcome)
                .register(registry);
    }

    public void recordRenewal(RenewalOutcome outcome) {
        if (outcome.valid()) {
            renewedCounter.increment();
        } else if (outcome.stale()) {
            staleCounter.increment();
        } else {
            invalidCounter.increment();
        }
    }

    public void recordNoticeSent() {
        noticeSentCounter.increment();
    }

    public void recordNoticeFailed() {
        noticeFailedCounter.increment();
    }

    public void recordScanFailure() {
        scanFailureCounter.increment();
    }

    public void recordScan(Duration duration) {
        scanTimer.record(duration);
    }
}
