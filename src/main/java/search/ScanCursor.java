package search;

import automaton.Automaton;

import java.util.Objects;

/**
 * The only mutable part of a scan: the current automaton state, the stream offset and the
 * counters. Symbols can be pushed in chunks of any size, so matches that straddle two buffers
 * (for example two reads from a socket) are still found, with offsets counted from the first
 * symbol ever fed.
 *
 * A cursor belongs to one thread; the automaton it reads is shared.
 */
public final class ScanCursor {

    private final Automaton automaton;
    private final SymbolNormalizer normalizer;
    private final ScanStats stats;
    private int state = Automaton.ROOT;
    private long position;

    public ScanCursor(Automaton automaton, boolean collectStats) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.normalizer = automaton.normalizer();
        this.stats = new ScanStats(collectStats);
    }

    /**
     * Consume one raw symbol and return how many patterns end at it. The matches themselves are
     * {@code automaton.outputAt(state(), 0 .. count - 1)}.
     */
    public int advance(int rawSymbol) {
        int symbol = normalizer.normalize(rawSymbol);
        stats.recordSymbol();

        int s = state;
        int next = automaton.transition(s, symbol);
        // Follow failure links until we find an edge or reach the root
        while (next == Automaton.NO_NODE && s != Automaton.ROOT) {
            s = automaton.fail(s);
            stats.recordFailStep();
            next = automaton.transition(s, symbol);
        }
        if (next != Automaton.NO_NODE) {
            s = next;
            stats.recordTransition();
        }
        state = s;
        position++;

        int count = automaton.outputCount(s);
        stats.recordMatches(count);
        return count;
    }

    /** Consume one symbol and hand every match ending at it to {@code listener}. */
    public int feed(int rawSymbol, MatchListener listener) {
        int count = advance(rawSymbol);
        for (int k = 0; k < count; k++) {
            emit(k, listener);
        }
        return count;
    }

    public long feed(CharSequence chunk, MatchListener listener) {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(listener, "listener");
        long found = 0;
        for (int i = 0; i < chunk.length(); i++) {
            found += feed(chunk.charAt(i), listener);
        }
        return found;
    }

    public long feed(byte[] chunk, int offset, int length, MatchListener listener) {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(listener, "listener");
        Objects.checkFromIndexSize(offset, length, chunk.length);
        long found = 0;
        for (int i = offset; i < offset + length; i++) {
            found += feed(chunk[i] & 0xff, listener);
        }
        return found;
    }

    // Match k (0-based) at the current state; only valid after advance returned more than k.
    Match matchAt(int k) {
        Pattern p = automaton.pattern(automaton.outputAt(state, k));
        return new Match(p, position - p.length());
    }

    private void emit(int k, MatchListener listener) {
        int id = automaton.outputAt(state, k);
        listener.onMatch(automaton.pattern(id), position - automaton.patternLength(id));
    }

    public int state() {
        return state;
    }

    // Number of symbols consumed so far; also the offset of the next symbol.
    public long position() {
        return position;
    }

    public ScanStats stats() {
        return stats;
    }

    public Automaton automaton() {
        return automaton;
    }

    // Back to the root at offset 0, counters cleared.
    public void reset() {
        state = Automaton.ROOT;
        position = 0L;
        stats.reset();
    }
}
