package com.pavan.orderedmap;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects operation statistics for an {@link OrderedMap}.
 * Thread-safe using atomic counters, so read operations running concurrently
 * under the shared lock can record hits and misses.
 */
public class OrderedMapStats {

    // Lookup counters
    private final AtomicLong totalGets;
    private final AtomicLong hits;
    private final AtomicLong misses;

    // Mutation counters
    private final AtomicLong inserts;
    private final AtomicLong updates;
    private final AtomicLong totalDeletes;
    private final AtomicLong successfulDeletes;
    private final AtomicLong clears;

    // Reordering counters
    private final AtomicLong totalMoves;
    private final AtomicLong successfulMoves;

    public OrderedMapStats() {
        this.totalGets = new AtomicLong(0);
        this.hits = new AtomicLong(0);
        this.misses = new AtomicLong(0);
        this.inserts = new AtomicLong(0);
        this.updates = new AtomicLong(0);
        this.totalDeletes = new AtomicLong(0);
        this.successfulDeletes = new AtomicLong(0);
        this.clears = new AtomicLong(0);
        this.totalMoves = new AtomicLong(0);
        this.successfulMoves = new AtomicLong(0);
    }

    void recordGet(boolean hit) {
        totalGets.incrementAndGet();
        if (hit) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
    }

    void recordPut(boolean inserted) {
        if (inserted) {
            inserts.incrementAndGet();
        } else {
            updates.incrementAndGet();
        }
    }

    void recordDelete(boolean existed) {
        totalDeletes.incrementAndGet();
        if (existed) {
            successfulDeletes.incrementAndGet();
        }
    }

    void recordMove(boolean moved) {
        totalMoves.incrementAndGet();
        if (moved) {
            successfulMoves.incrementAndGet();
        }
    }

    void recordClear() {
        clears.incrementAndGet();
    }

    public long getTotalGets() {
        return totalGets.get();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getTotalPuts() {
        return inserts.get() + updates.get();
    }

    public long getInserts() {
        return inserts.get();
    }

    public long getUpdates() {
        return updates.get();
    }

    public long getTotalDeletes() {
        return totalDeletes.get();
    }

    public long getSuccessfulDeletes() {
        return successfulDeletes.get();
    }

    public long getTotalMoves() {
        return totalMoves.get();
    }

    public long getSuccessfulMoves() {
        return successfulMoves.get();
    }

    public long getClears() {
        return clears.get();
    }

    public long getTotalOperations() {
        return totalGets.get() + getTotalPuts() + totalDeletes.get() + totalMoves.get() + clears.get();
    }

    public double getHitRate() {
        long hitCount = hits.get();
        long total = hitCount + misses.get();
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns a snapshot of current statistics.
     */
    public StatsSnapshot getSnapshot() {
        return new StatsSnapshot(
            totalGets.get(),
            hits.get(),
            misses.get(),
            inserts.get(),
            updates.get(),
            totalDeletes.get(),
            successfulDeletes.get(),
            totalMoves.get(),
            successfulMoves.get(),
            clears.get()
        );
    }

    /**
     * Resets all counters to zero.
     */
    public void reset() {
        totalGets.set(0);
        hits.set(0);
        misses.set(0);
        inserts.set(0);
        updates.set(0);
        totalDeletes.set(0);
        successfulDeletes.set(0);
        clears.set(0);
        totalMoves.set(0);
        successfulMoves.set(0);
    }

    @Override
    public String toString() {
        return String.format(
            "OrderedMapStats{gets=%d, hits=%d, misses=%d, hitRate=%.2f%%, inserts=%d, updates=%d, " +
            "deletes=%d/%d, moves=%d/%d, clears=%d}",
            totalGets.get(), hits.get(), misses.get(), getHitRate() * 100,
            inserts.get(), updates.get(),
            successfulDeletes.get(), totalDeletes.get(),
            successfulMoves.get(), totalMoves.get(),
            clears.get()
        );
    }

    /**
     * Immutable snapshot of statistics at a point in time.
     */
    public static class StatsSnapshot {
        public final long totalGets;
        public final long hits;
        public final long misses;
        public final long inserts;
        public final long updates;
        public final long totalDeletes;
        public final long successfulDeletes;
        public final long totalMoves;
        public final long successfulMoves;
        public final long clears;

        public StatsSnapshot(long totalGets, long hits, long misses, long inserts, long updates,
                             long totalDeletes, long successfulDeletes, long totalMoves,
                             long successfulMoves, long clears) {
            this.totalGets = totalGets;
            this.hits = hits;
            this.misses = misses;
            this.inserts = inserts;
            this.updates = updates;
            this.totalDeletes = totalDeletes;
            this.successfulDeletes = successfulDeletes;
            this.totalMoves = totalMoves;
            this.successfulMoves = successfulMoves;
            this.clears = clears;
        }

        public long getTotalOperations() {
            return totalGets + inserts + updates + totalDeletes + totalMoves + clears;
        }

        public double getHitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }

        @Override
        public String toString() {
            return String.format(
                "StatsSnapshot{operations=%d, hits=%d, misses=%d, hitRate=%.2f%%, moves=%d}",
                getTotalOperations(), hits, misses, getHitRate() * 100, successfulMoves
            );
        }
    }
}
