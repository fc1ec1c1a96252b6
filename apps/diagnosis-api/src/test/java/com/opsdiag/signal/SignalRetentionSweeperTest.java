package com.opsdiag.signal;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

import static com.opsdiag.testing.Fixtures.NOW;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalRetentionSweeperTest {

    @Test
    void evictsEverythingOlderThanTheRetention() {
        SignalRetentionSweeper sweeper = new SignalRetentionSweeper();
        sweeper.store = mock(SignalStore.class);
        sweeper.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        sweeper.retention = Duration.ofHours(24);
        when(sweeper.store.evictOlderThan(NOW.minus(Duration.ofHours(24)))).thenReturn(3);

        sweeper.sweep();

        verify(sweeper.store).evictOlderThan(NOW.minus(Duration.ofHours(24)));
    }
}
