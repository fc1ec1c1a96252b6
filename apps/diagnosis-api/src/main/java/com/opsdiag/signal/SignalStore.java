package com.opsdiag.signal;

import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.model.TimeRange;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

public interface SignalStore {

    /**
     * Stores a signal. Re-ingesting an id replaces the previous signal (last write wins).
     *
     * @throws InvalidSignalException when the signal is malformed or dated beyond the clock-skew tolerance
     */
    void ingest(Signal signal);

    /**
     * Time-ordered signals of one service. An empty {@code kinds} set matches every kind.
     * Each call scans a copy of the current state, so the stream is unaffected by later
     * ingestion or eviction.
     */
    Stream<Signal> query(String service, Set<SignalKind> kinds, TimeRange range);

    int evictOlderThan(Instant cutoff);

    int size();

    Map<String, Integer> countsByService();
}
