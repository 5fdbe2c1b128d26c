package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import search.Match;
import search.MatchListener;
import search.Pattern;
import search.ScanCursor;
import search.ScanSession;
import search.Symbols;
import search.SymbolNormalizer;
import trie.NodeArena;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.stream.Stream;

/**
 * A compiled, immutable Aho-Corasick automaton.
 *
 * Nothing in here is written after construction, so one instance can serve any number of
 * concurrent scans; each scan keeps its own state in a {@link ScanCursor}.
 * Use {@link trie.TrieBuilder} to build one.
 */
public final class Automaton {

    public static final int ROOT = NodeArena.ROOT;
    public static final int NO_NODE = NodeArena.NO_NODE;

    private final NodeArena nodes;
    private final List<Pattern> patterns;
    private final int[] patternLengths;
    // outputs(n) flattened, own pattern first, then inherited ones
    private final int[][] outputTable;
    private final AutomatonConfiguration config;
    private final SymbolNormalizer normalizer;
    private final AutomatonStats stats;

    Automaton(NodeArena nodes, List<Pattern> patterns, AutomatonConfiguration config) {
        if (!nodes.isSealed()) {
            throw new IllegalArgumentException("node arena must be sealed");
        }
        this.nodes = nodes;
        this.patterns = List.copyOf(patterns);
        this.config = Objects.requireNonNull(config, "config");
        this.normalizer = config.normalizer();

        this.patternLengths = new int[this.patterns.size()];
        for (Pattern p : this.patterns) {
            patternLengths[p.id] = p.length();
        }

        int n = nodes.size();
        this.outputTable = new int[n][];
        int maxDepth = 0;
        long totalOutputs = 0;
        int nonRootFail = 0;
        for (int node = 0; node < n; node++) {
            outputTable[node] = nodes.outputsOf(node);
            totalOutputs += outputTable[node].length;
            maxDepth = Math.max(maxDepth, nodes.depth(node));
            if (node != ROOT && nodes.fail(node) != ROOT) {
                nonRootFail++;
            }
        }
        this.stats = new AutomatonStats(n, nodes.edgeCount(), this.patterns.size(), maxDepth, totalOutputs, nonRootFail);
    }

    public int root() {
        return ROOT;
    }

    public int nodeCount() {
        return outputTable.length;
    }

    /** Goto function on an already normalized symbol; {@link #NO_NODE} if there is no edge. */
    public int transition(int node, int symbol) {
        return nodes.child(node, symbol);
    }

    public int fail(int node) {
        return nodes.fail(node);
    }

    public int depth(int node) {
        return nodes.depth(node);
    }

    public int outputCount(int node) {
        return outputTable[node].length;
    }

    public int outputAt(int node, int index) {
        return outputTable[node][index];
    }

    public IntList outputs(int node) {
        return IntLists.unmodifiable(IntArrayList.wrap(outputTable[node]));
    }

    public Pattern pattern(int id) {
        return patterns.get(id);
    }

    public int patternLength(int id) {
        return patternLengths[id];
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    public int patternCount() {
        return patterns.size();
    }

    public SymbolNormalizer normalizer() {
        return normalizer;
    }

    public AutomatonConfiguration config() {
        return config;
    }

    public AutomatonStats stats() {
        return stats;
    }

    // ======================
    // === Scanning API =====
    // ======================

    /** A fresh push-style cursor positioned at the root, offset 0. */
    public ScanCursor newCursor() {
        return new ScanCursor(this, config.collectStats());
    }

    public ScanSession scan(CharSequence text) {
        Objects.requireNonNull(text, "text");
        return scan(Symbols.of(text));
    }

    public ScanSession scan(byte[] data) {
        Objects.requireNonNull(data, "data");
        return scan(Symbols.of(data, 0, data.length));
    }

    public ScanSession scan(byte[] data, int offset, int length) {
        Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, length, data.length);
        return scan(Symbols.of(data, offset, length));
    }

    /**
     * Scan int-alphabet input such as {@link utilities.TokenAlphabet#encodeInput} output. Like
     * {@link trie.TrieBuilder#insert(int[], String)} this requires the IDENTITY normalizer.
     *
     * @throws IllegalStateException if the automaton was built with another normalizer
     */
    public ScanSession scan(int[] symbols) {
        Objects.requireNonNull(symbols, "symbols");
        if (normalizer != SymbolNormalizer.IDENTITY) {
            throw new IllegalStateException("int-alphabet input requires the IDENTITY normalizer");
        }
        return scan(Symbols.of(symbols));
    }

    public ScanSession scan(PrimitiveIterator.OfInt symbols) {
        Objects.requireNonNull(symbols, "symbols");
        return new ScanSession(newCursor(), symbols);
    }

    public Stream<Match> stream(CharSequence text) {
        return scan(text).stream();
    }

    public Stream<Match> stream(byte[] data) {
        return scan(data).stream();
    }

    public List<Match> findAll(CharSequence text) {
        return drain(scan(text));
    }

    public List<Match> findAll(byte[] data) {
        return drain(scan(data));
    }

    public List<Match> findAll(int[] symbols) {
        return drain(scan(symbols));
    }

    /** True as soon as any pattern occurs; stops reading input at the first match. */
    public boolean containsAny(CharSequence text) {
        return scan(text).hasNext();
    }

    public boolean containsAny(byte[] data) {
        return scan(data).hasNext();
    }

    /** Eager scan delivering every match to {@code listener}; returns the cursor for its counters. */
    public ScanCursor scan(CharSequence text, MatchListener listener) {
        ScanCursor cursor = newCursor();
        cursor.feed(text, listener);
        return cursor;
    }

    private static List<Match> drain(ScanSession session) {
        List<Match> out = new ArrayList<>();
        while (session.hasNext()) {
            out.add(session.next());
        }
        return out;
    }

    @Override
    public String toString() {
        return "Automaton" + stats;
    }
}
