package com.aejis.core.store;

import com.aejis.core.model.JobResult;
import com.aejis.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent job results by job id.
 *
 * <p>Entries expire after the configured TTL and are removed by {@link #evictExpired()},
 * which runs on a fixed schedule. A hard cap on entries evicts the oldest first when a
 * new result arrives at capacity.
 */
@Component
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    private record Entry(JobResult result, Instant storedAt) {}

    private final ConcurrentHashMap<String, Entry> results = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    @Autowired
    public ResultStore(SandboxProperties properties) {
        this(properties.getResultTtl(), properties.getMaxResults(), Clock.systemUTC());
    }

    public ResultStore(Duration ttl, int maxEntries, Clock clock) {
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public void put(JobResult result) {
        if (results.size() >= maxEntries && !results.containsKey(result.jobId())) {
            evictOldest(results.size() - maxEntries + 1);
        }
        results.put(result.jobId(), new Entry(result, clock.instant()));
    }

    public Optional<JobResult> get(String jobId) {
        Entry entry = results.get(jobId);
        if (entry == null) {
            return Optional.empty();
        }
        if (expired(entry, clock.instant())) {
            results.remove(jobId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    public Optional<JobResult> remove(String jobId) {
        return Optional.ofNullable(results.remove(jobId)).map(Entry::result);
    }

    /** Live results, newest first. */
    public List<JobResult> recent() {
        Instant now = clock.instant();
        return results.values().stream()
                .filter(e -> !expired(e, now))
                .sorted(Comparator.comparing(Entry::storedAt).reversed())
                .map(Entry::result)
                .toList();
    }

    public int size() {
        return results.size();
    }

    @Scheduled(fixedDelayString = "${aejis.results.eviction-interval-ms:60000}")
    public int evictExpired() {
        Instant now = clock.instant();
        int before = results.size();
        results.entrySet().removeIf(e -> expired(e.getValue(), now));
        int evicted = before - results.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired results", evicted);
        }
        return evicted;
    }

    private boolean expired(Entry entry, Instant now) {
        return entry.storedAt().plus(ttl).isBefore(now);
    }

    private void evictOldest(int count) {
        results.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.comparing(Entry::storedAt)))
                .limit(count)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(results::remove);
        log.warn("ResultStore at capacity ({}), evicted {} oldest entries", maxEntries, count);
    }
}
