package tree.gst;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Locale;

/**
 * Collects optional construction statistics for {@link GeneralizedSuffixTree} without touching
 * the hot path when instrumentation is disabled.
 */
public final class SuffixTreeStats {

    private final IntArrayList resumePositions = new IntArrayList();
    private boolean collectStats;
    private long acceptedCount;
    private long rejectedCount;
    private long leafCount;
    private long splitCount;
    private long rescanCount;
    private long totalInsertTimeNanos;

    public SuffixTreeStats(boolean collectStats) {
        this.collectStats = collectStats;
    }

    public boolean isCollecting() {
        return collectStats;
    }

    public void setCollecting(boolean collectStats) {
        this.collectStats = collectStats;
        if (!collectStats) {
            reset();
        }
    }

    public void recordAccepted(int resumePosition, long durationNanos) {
        if (!collectStats) {
            return;
        }
        acceptedCount++;
        resumePositions.add(resumePosition);
        totalInsertTimeNanos += durationNanos;
    }

    public void recordRejected() {
        if (collectStats) {
            rejectedCount++;
        }
    }

    public void recordLeaf() {
        if (collectStats) {
            leafCount++;
        }
    }

    public void recordSplit() {
        if (collectStats) {
            splitCount++;
        }
    }

    // A missing suffix link forced the next active point to be recomputed from the root.
    public void recordRescan() {
        if (collectStats) {
            rescanCount++;
        }
    }

    public long acceptedCount() {
        return acceptedCount;
    }

    public long rejectedCount() {
        return rejectedCount;
    }

    public long leafCount() {
        return leafCount;
    }

    public long splitCount() {
        return splitCount;
    }

    public long rescanCount() {
        return rescanCount;
    }

    public long totalInsertTimeNanos() {
        return totalInsertTimeNanos;
    }

    /** Positions at which construction resumed after the fast-forward walk, one per accepted string. */
    public IntList resumePositions() {
        return IntLists.unmodifiable(resumePositions);
    }

    public double averageInsertTimeMillis() {
        if (acceptedCount == 0) {
            return 0.0;
        }
        return (totalInsertTimeNanos / 1_000_000.0) / acceptedCount;
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "accepted=%d rejected=%d leaves=%d splits=%d rescans=%d avgInsert=%.3f ms",
                acceptedCount, rejectedCount, leafCount, splitCount, rescanCount, averageInsertTimeMillis());
    }

    public void reset() {
        resumePositions.clear();
        acceptedCount = 0L;
        rejectedCount = 0L;
        leafCount = 0L;
        splitCount = 0L;
        rescanCount = 0L;
        totalInsertTimeNanos = 0L;
    }
}
