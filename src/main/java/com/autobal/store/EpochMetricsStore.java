package com.autobal.store;

import com.autobal.model.EpochKey;
import com.autobal.model.EpochMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory, thread-safe store for completed epoch metrics, keyed by {@link EpochKey}.
 *
 * <p>Re-analysing an epoch overwrites its previous record.
 */
@Repository
public class EpochMetricsStore {

    private static final Logger log = LoggerFactory.getLogger(EpochMetricsStore.class);

    private static final Comparator<EpochMetrics> BY_MJD_THEN_EPOCH =
            Comparator.comparingDouble(EpochMetrics::mjd).thenComparing(EpochMetrics::epoch);

    private final ConcurrentMap<EpochKey, EpochMetrics> store = new ConcurrentHashMap<>();

    public void save(EpochMetrics metrics) {
        EpochKey key = new EpochKey(metrics.sourceId(), metrics.epoch());
        EpochMetrics previous = store.put(key, metrics);
        if (previous != null) {
            log.debug("Replaced metrics: source={} epoch={}", metrics.sourceId(), metrics.epoch());
        } else {
            log.debug("Stored metrics: source={} epoch={}", metrics.sourceId(), metrics.epoch());
        }
    }

    /**
     * Metrics for one source with MJD inside the inclusive range, sorted by MJD then epoch label.
     */
    public List<EpochMetrics> query(String sourceId, double fromMjd, double toMjd) {
        return store.values().stream()
                .filter(m -> m.sourceId().equals(sourceId))
                .filter(m -> m.mjd() >= fromMjd && m.mjd() <= toMjd)
                .sorted(BY_MJD_THEN_EPOCH)
                .collect(Collectors.toList());
    }

    /**
     * All metrics for one source, sorted by MJD then epoch label.
     */
    public List<EpochMetrics> query(String sourceId) {
        return query(sourceId, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public Optional<EpochMetrics> find(String sourceId, String epoch) {
        return Optional.ofNullable(store.get(new EpochKey(sourceId, epoch)));
    }

    public int totalEpochs() {
        return store.size();
    }

    public List<String> knownSources() {
        return store.keySet().stream()
                .map(EpochKey::sourceId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Clears all data, primarily for testing.
     */
    public void clear() {
        store.clear();
    }
}
