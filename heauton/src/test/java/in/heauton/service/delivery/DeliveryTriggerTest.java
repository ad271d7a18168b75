package in.heauton.service.delivery;

import in.heauton.domain.common.ErrorKind;
import in.heauton.domain.common.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeliveryTriggerTest {

    @Mock
    private ScheduleStore scheduleStore;

    @Test
    void runOnce_crashingBatchIsContained() {
        when(scheduleStore.deliverDueQuotes()).thenThrow(new IllegalStateException("boom"));
        DeliveryTrigger trigger = new DeliveryTrigger(scheduleStore, Duration.ofMinutes(60));

        assertDoesNotThrow(trigger::runOnce);
    }

    @Test
    void runOnce_failedBatchIsOnlyLogged() {
        when(scheduleStore.deliverDueQuotes())
                .thenReturn(Result.failure(ErrorKind.PERSISTENCE_FAILURE, "db down"));
        DeliveryTrigger trigger = new DeliveryTrigger(scheduleStore, Duration.ofMinutes(60));

        assertDoesNotThrow(trigger::runOnce);
        verify(scheduleStore, times(1)).deliverDueQuotes();
    }

    @Test
    void start_runsImmediatelyAndStopShutsDown() {
        when(scheduleStore.deliverDueQuotes())
                .thenReturn(Result.success(new DeliveryReport(Instant.now(), List.of())));
        DeliveryTrigger trigger = new DeliveryTrigger(scheduleStore, Duration.ofMinutes(60));

        trigger.start();
        verify(scheduleStore, timeout(5_000).atLeastOnce()).deliverDueQuotes();
        trigger.stop();

        verify(scheduleStore, atLeastOnce()).deliverDueQuotes();
    }
}
