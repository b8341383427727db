package com.authplatform.validitysvc.domain.validity;

import com.authplatform.validitysvc.config.GracefulShutdownConfig;
import com.authplatform.validitysvc.config.ValidityPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ValidityBackfillServiceTest {

    @Mock
    private ValidityStore store;

    @Mock
    private GracefulShutdownConfig shutdown;

    private ValidityBackfillService service(boolean populateUsers) {
        ValidityPolicy policy = new ValidityPolicy(1000L, 100L, true, "Renew", "https://auth.example.com/",
                "no-reply@example.com", populateUsers, 100, 100);
        return new ValidityBackfillService(store, policy, shutdown);
    }

    @Test
    void runsBatchesUntilOneIsShort() {
        when(store.bootstrapMissing(100)).thenReturn(100, 100, 7);

        assertThat(service(true).backfill()).isEqualTo(207);
        verify(store, times(3)).bootstrapMissing(100);
    }

    @Test
    void stopsBetweenBatchesOnShutdown() {
        when(store.bootstrapMissing(100)).thenReturn(100);
        when(shutdown.isShuttingDown()).thenReturn(false, true);

        assertThat(service(true).backfill()).isEqualTo(100);
        verify(store, times(1)).bootstrapMissing(100);
    }

    @Test
    void disabledBackfillDoesNothing() {
        service(false).onApplicationReady();

        verifyNoInteractions(store);
    }
}
