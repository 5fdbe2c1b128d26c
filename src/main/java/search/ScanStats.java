package search;

/**
 * Counters for a single scan session. Owned by exactly one cursor, so no synchronization;
 * a harness reads them after (or during) iteration to derive throughput and efficiency figures.
 */
public final class ScanStats {

    private final boolean collectStats;
    private long symbolsScanned;
    private long transitions;
    private long failSteps;
    private long matches;
    private long nodesVisited;

    public ScanStats(boolean collectStats) {
        this.collectStats = collectStats;
    }

    public boolean isCollecting() {
        return collectStats;
    }

    void recordSymbol() {
        if (collectStats) {
            symbolsScanned++;
        }
    }

    void recordTransition() {
        if (collectStats) {
            transitions++;
            nodesVisited++;
        }
    }

    void recordFailStep() {
        if (collectStats) {
            failSteps++;
            nodesVisited++;
        }
    }

    void recordMatches(int count) {
        if (collectStats) {
            matches += count;
        }
    }

    public long symbolsScanned() {
        return symbolsScanned;
    }

    // Goto transitions actually taken (symbols that extended a trie path).
    public long transitions() {
        return transitions;
    }

    public long failSteps() {
        return failSteps;
    }

    public long matches() {
        return matches;
    }

    public long nodesVisited() {
        return nodesVisited;
    }

    public double failStepsPerSymbol() {
        return symbolsScanned == 0 ? 0.0 : (double) failSteps / symbolsScanned;
    }

    public void reset() {
        symbolsScanned = 0;
        transitions = 0;
        failSteps = 0;
        matches = 0;
        nodesVisited = 0;
    }

    @Override
    public String toString() {
        return "ScanStats{symbols=" + symbolsScanned
                + ", transitions=" + transitions
                + ", failSteps=" + failSteps
                + ", matches=" + matches
                + ", nodesVisited=" + nodesVisited + '}';
    }
}
