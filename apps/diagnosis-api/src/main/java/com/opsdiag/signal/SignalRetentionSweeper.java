package com.opsdiag.signal;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class SignalRetentionSweeper {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.SignalRetentionSweeper");

    @Inject
    SignalStore store;

    @Inject
    Clock clock;

    @ConfigProperty(name = "engine.store.retention", defaultValue = "PT24H")
    Duration retention;

    @Scheduled(every = "{engine.store.sweep-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = store.evictOlderThan(cutoff);
        if (evicted > 0) {
            LOGGER.infov("[SWEEP] evicted={0} cutoff={1} remaining={2}", evicted, cutoff, store.size());
        } else {
            LOGGER.debugv("[SWEEP] nothing to evict cutoff={0}", cutoff);
        }
    }
}
