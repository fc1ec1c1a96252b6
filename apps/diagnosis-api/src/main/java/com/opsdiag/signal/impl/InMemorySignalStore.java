package com.opsdiag.signal.impl;

import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.model.TimeRange;
import com.opsdiag.signal.InvalidSignalException;
import com.opsdiag.signal.SignalStore;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class InMemorySignalStore implements SignalStore {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.SignalStore");

    private final ConcurrentHashMap<String, Signal> byId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<IndexKey, Signal>> byService =
            new ConcurrentHashMap<>();

    @Inject
    Clock clock;

    @ConfigProperty(name = "engine.store.clock-skew", defaultValue = "PT2M")
    Duration clockSkew;

    @PostConstruct
    void init() {
        LOGGER.infov("[INIT] InMemorySignalStore ready. clockSkew={0}", clockSkew);
    }

    @Override
    public void ingest(Signal signal) {
        try {
            validate(signal);
        } catch (InvalidSignalException e) {
            LOGGER.warnv(
                    "[INGEST-REJECT] id={0} service={1} reason={2}",
                    signal != null ? signal.id() : "<null>",
                    signal != null ? signal.service() : "<null>",
                    e.getMessage());
            throw e;
        }
        byId.compute(signal.id(), (id, previous) -> {
            if (previous != null) {
                unindex(previous);
            }
            byService.compute(signal.service(), (service, index) -> {
                ConcurrentSkipListMap<IndexKey, Signal> target = index != null ? index : new ConcurrentSkipListMap<>();
                target.put(IndexKey.of(signal), signal);
                return target;
            });
            return signal;
        });
    }

    @Override
    public Stream<Signal> query(String service, Set<SignalKind> kinds, TimeRange range) {
        if (service == null) {
            return Stream.empty();
        }
        ConcurrentSkipListMap<IndexKey, Signal> index = byService.get(service);
        if (index == null) {
            return Stream.empty();
        }
        List<Signal> snapshot = new ArrayList<>(slice(index, range).values());
        Set<SignalKind> filter = kinds == null ? Set.of() : kinds;
        return snapshot.stream()
                .filter(signal -> filter.isEmpty() || filter.contains(signal.kind()));
    }

    @Override
    public int evictOlderThan(Instant cutoff) {
        int evicted = 0;
        for (var index : byService.values()) {
            List<Signal> expired = new ArrayList<>(index.headMap(IndexKey.lowest(cutoff)).values());
            for (Signal signal : expired) {
                boolean[] removed = new boolean[1];
                byId.computeIfPresent(signal.id(), (id, current) -> {
                    if (current.timestamp().isBefore(cutoff)) {
                        unindex(current);
                        removed[0] = true;
                        return null;
                    }
                    return current;
                });
                if (removed[0]) {
                    evicted++;
                }
            }
        }
        for (String service : List.copyOf(byService.keySet())) {
            byService.computeIfPresent(service, (key, index) -> index.isEmpty() ? null : index);
        }
        return evicted;
    }

    @Override
    public int size() {
        return byId.size();
    }

    @Override
    public Map<String, Integer> countsByService() {
        Map<String, Integer> counts = new TreeMap<>();
        byService.forEach((service, index) -> {
            int size = index.size();
            if (size > 0) {
                counts.put(service, size);
            }
        });
        return counts;
    }

    private void validate(Signal signal) {
        if (signal == null) {
            throw new InvalidSignalException("signal is required");
        }
        if (isBlank(signal.id())) {
            throw new InvalidSignalException("signal id is required");
        }
        if (isBlank(signal.service())) {
            throw new InvalidSignalException("signal service is required");
        }
        if (signal.kind() == null) {
            throw new InvalidSignalException("unrecognized signal kind: null");
        }
        if (signal.severity() == null) {
            throw new InvalidSignalException("signal severity is required");
        }
        if (signal.timestamp() == null) {
            throw new InvalidSignalException("signal timestamp is required");
        }
        Instant latestAccepted = clock.instant().plus(clockSkew);
        if (signal.timestamp().isAfter(latestAccepted)) {
            throw new InvalidSignalException(
                    "signal timestamp " + signal.timestamp() + " is beyond the clock-skew tolerance (" + latestAccepted + ")");
        }
    }

    /** Empty indexes are only dropped under the service's map entry, the same place ingest inserts. */
    private void unindex(Signal signal) {
        ConcurrentSkipListMap<IndexKey, Signal> index = byService.get(signal.service());
        if (index != null) {
            index.remove(IndexKey.of(signal));
        }
    }

    private NavigableMap<IndexKey, Signal> slice(ConcurrentNavigableMap<IndexKey, Signal> index, TimeRange range) {
        if (range == null) {
            return index;
        }
        NavigableMap<IndexKey, Signal> view = index;
        if (range.from() != null) {
            view = view.tailMap(IndexKey.lowest(range.from()), true);
        }
        if (range.to() != null) {
            view = view.headMap(IndexKey.lowest(range.to().plusNanos(1)), false);
        }
        return view;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record IndexKey(Instant timestamp, String id) implements Comparable<IndexKey> {

        static IndexKey of(Signal signal) {
            return new IndexKey(signal.timestamp(), signal.id());
        }

        static IndexKey lowest(Instant timestamp) {
            return new IndexKey(timestamp, "");
        }

        @Override
        public int compareTo(IndexKey other) {
            int byTime = timestamp.compareTo(other.timestamp);
            return byTime != 0 ? byTime : id.compareTo(other.id);
        }
    }
}
