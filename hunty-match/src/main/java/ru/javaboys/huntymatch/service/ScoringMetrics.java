package ru.javaboys.huntymatch.service;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the matching engine since start-up.
 */
@Component
public class ScoringMetrics {

    private final AtomicLong matches = new AtomicLong();
    private final AtomicLong matchFailures = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong oracleCalls = new AtomicLong();
    private final AtomicLong oracleFailures = new AtomicLong();
    private final AtomicLong totalMatchMillis = new AtomicLong();

    public void recordMatch(long millis) {
        matches.incrementAndGet();
        totalMatchMillis.addAndGet(millis);
    }

    public void recordMatchFailure() {
        matchFailures.incrementAndGet();
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordOracleCall() {
        oracleCalls.incrementAndGet();
    }

    public void recordOracleFailure() {
        oracleFailures.incrementAndGet();
    }

    public Snapshot snapshot() {
        long count = matches.get();
        long millis = totalMatchMillis.get();
        return new Snapshot(count, matchFailures.get(), cacheHits.get(), oracleCalls.get(), oracleFailures.get(),
                millis, count == 0 ? 0.0 : (double) millis / count);
    }

    @Value
    public static class Snapshot {
        long matches;
        long matchFailures;
        long cacheHits;
        long oracleCalls;
        long oracleFailures;
        long totalMatchMillis;
        double averageMatchMillis;
    }
}
