package cockpit.jobs.service;

import cockpit.jobs.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory progress of running jobs.
 *
 * Only runs between {@link #begin} and {@link #discard} are tracked, so a
 * poller gets "not found" both before a run starts and after it finished.
 * Readers never take a lock; writers replace whole immutable snapshots.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Start tracking a run. Called on the QUEUED → RUNNING transition.
     */
    public void begin(String runId) {
        entries.putIfAbsent(runId, Entry.EMPTY);
    }

    /**
     * Record progress reported by the worker.
     *
     * @return true if the update was applied
     */
    public boolean update(String runId, String step, int percent, Instant timestamp) {
        return update(runId, step, percent, null, null, timestamp);
    }

    public boolean update(String runId, String step, int percent, Integer currentStep, Integer totalSteps,
            Instant timestamp) {
        try {
            Instant ts = timestamp != null ? timestamp : Instant.now();
            ProgressSnapshot next = new ProgressSnapshot(runId, clamp(percent), step, currentStep, totalSteps, ts);
            boolean[] applied = new boolean[1];
            entries.computeIfPresent(runId, (id, current) -> {
                ProgressSnapshot prev = current.snapshot;
                if (prev != null && prev.updatedAt() != null && ts.isBefore(prev.updatedAt())) {
                    return current;
                }
                applied[0] = true;
                return new Entry(next);
            });
            if (!applied[0]) {
                log.debug("Dropped progress update for run {} ({}%, {})", runId, percent, step);
            }
            return applied[0];
        } catch (RuntimeException e) {
            log.warn("Failed to apply progress update for run {}: {}", runId, e.toString());
            return false;
        }
    }

    /**
     * Latest snapshot, empty if the run is not tracked or has not reported yet.
     */
    public Optional<ProgressSnapshot> snapshot(String runId) {
        Entry entry = entries.get(runId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.snapshot);
    }

    /**
     * Snapshots for many runs in one pass. Runs without a snapshot are omitted.
     */
    public Map<String, ProgressSnapshot> snapshotAll(Collection<String> runIds) {
        Map<String, ProgressSnapshot> result = new LinkedHashMap<>();
        for (String runId : runIds) {
            try {
                Entry entry = runId == null ? null : entries.get(runId);
                if (entry != null && entry.snapshot != null) {
                    result.put(runId, entry.snapshot);
                }
            } catch (RuntimeException e) {
                log.warn("Skipping progress for run {}: {}", runId, e.toString());
            }
        }
        return result;
    }

    public boolean isTracked(String runId) {
        return entries.containsKey(runId);
    }

    /**
     * Stop tracking a run. Called on every terminal transition.
     */
    public void discard(String runId) {
        entries.remove(runId);
    }

    public int trackedCount() {
        return entries.size();
    }

    private static int clamp(int percent) {
        return Math.max(0, Math.min(100, percent));
    }

    /** Holder so a tracked run without progress can live in the map */
    private static final class Entry {
        static final Entry EMPTY = new Entry(null);

        final ProgressSnapshot snapshot;

        Entry(ProgressSnapshot snapshot) {
            this.snapshot = snapshot;
        }
    }
}
