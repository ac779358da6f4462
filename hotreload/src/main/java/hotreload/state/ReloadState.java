package hotreload.state;

import hotreload.metrics.ReloadMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe singleton tracking reload activity across the JVM.
 *
 * <p>Keeps the number of cycles in progress, the metrics and error of the
 * last finished cycle, and a bounded history (most recent first). Different
 * modules may reload concurrently, so status is derived from the in-flight
 * count rather than a single current cycle.
 *
 * @see ReloadHistoryEntry
 */
public final class ReloadState {

    /**
     * Reload execution status.
     */
    public enum Status {
        /** No cycle has run yet (or since reset) */
        IDLE,
        /** At least one cycle is executing */
        IN_PROGRESS,
        /** Last finished cycle completed successfully */
        SUCCESS,
        /** Last finished cycle failed */
        FAILED
    }

    private static final ReloadState INSTANCE = new ReloadState();
    private static final int DEFAULT_HISTORY_SIZE = 10;

    private final AtomicLong idSequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<ReloadHistoryEntry> history = new ArrayList<>();

    private volatile int maxHistorySize = DEFAULT_HISTORY_SIZE;
    private volatile int inFlight;
    private volatile Status lastStatus = Status.IDLE;
    private volatile ReloadMetrics lastMetrics;
    private volatile String lastError;

    private ReloadState() {}

    public static ReloadState getInstance() {
        return INSTANCE;
    }

    /**
     * Mark a reload cycle as started.
     *
     * @return the id assigned to the new cycle
     */
    public long reloadStarted() {
        lock.writeLock().lock();
        try {
            inFlight++;
            return idSequence.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reloadCompleted(long reloadId, String module, ReloadMetrics metrics) {
        lock.writeLock().lock();
        try {
            inFlight = Math.max(0, inFlight - 1);
            lastStatus = Status.SUCCESS;
            lastMetrics = metrics;
            lastError = null;
            addToHistory(ReloadHistoryEntry.success(reloadId, module, metrics));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reloadFailed(long reloadId, String module, Throwable error, ReloadMetrics partialMetrics) {
        lock.writeLock().lock();
        try {
            inFlight = Math.max(0, inFlight - 1);
            lastStatus = Status.FAILED;
            lastError = error != null ? error.getMessage() : "Unknown error";
            lastMetrics = partialMetrics;
            addToHistory(ReloadHistoryEntry.failure(reloadId, module, lastError, partialMetrics));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void addToHistory(ReloadHistoryEntry entry) {
        history.add(0, entry);
        while (history.size() > maxHistorySize) {
            history.remove(history.size() - 1);
        }
    }

    /**
     * Set the maximum number of history entries to keep.
     *
     * @param size the maximum history size, must be positive
     * @throws IllegalArgumentException if size is not positive
     */
    public void setMaxHistorySize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maxHistorySize must be positive: " + size);
        }
        lock.writeLock().lock();
        try {
            this.maxHistorySize = size;
            while (history.size() > maxHistorySize) {
                history.remove(history.size() - 1);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public Status getStatus() {
        return inFlight > 0 ? Status.IN_PROGRESS : lastStatus;
    }

    public ReloadMetrics getLastMetrics() {
        return lastMetrics;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Get an unmodifiable view of reload history (most recent first).
     */
    public List<ReloadHistoryEntry> getHistory() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(history));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Object> toMap() {
        lock.readLock().lock();
        try {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("status", getStatus().name());
            map.put("inFlight", inFlight);
            map.put("lastError", lastError);
            if (lastMetrics != null) {
                map.put("lastReload", lastMetrics.toMap());
            }
            return map;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reset state to IDLE. Primarily for testing.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            inFlight = 0;
            lastStatus = Status.IDLE;
            lastMetrics = null;
            lastError = null;
            history.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
