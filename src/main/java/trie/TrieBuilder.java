package trie;

import automaton.Automaton;
import automaton.AutomatonCompiler;
import automaton.AutomatonConfiguration;
import automaton.EmptyPatternPolicy;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import search.Pattern;
import search.SymbolNormalizer;
import utilities.AcLogger;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inserts patterns into a shared prefix tree. Single use: {@link #compile()} hands the arena
 * over to the compiler and every later call on this builder throws IllegalStateException, so an
 * automaton can never be left with failure links that predate an insertion.
 */
public final class TrieBuilder {

    private final AutomatonConfiguration config;
    private final SymbolNormalizer normalizer;
    private final ObjectArrayList<Pattern> patterns = new ObjectArrayList<>();
    // terminal node -> id of the pattern that ends there; before compilation each node ends at most one
    private final Int2IntOpenHashMap terminalToPattern = new Int2IntOpenHashMap();
    private NodeArena arena;
    private int ignoredEmpty;

    public TrieBuilder() {
        this(AutomatonConfiguration.defaults());
    }

    public TrieBuilder(AutomatonConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.normalizer = config.normalizer();
        this.arena = new NodeArena(config.expectedNodes());
        this.terminalToPattern.defaultReturnValue(-1);
    }

    public AutomatonConfiguration config() {
        return config;
    }

    /** Insert a text pattern; every UTF-16 code unit is one symbol. */
    public Pattern insert(CharSequence pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return insertSymbols(Pattern.toSymbols(pattern), pattern.toString());
    }

    /** Insert a binary pattern; every byte is one symbol in 0..255. */
    public Pattern insert(byte[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return insertSymbols(Pattern.toSymbols(pattern), new String(pattern, StandardCharsets.ISO_8859_1));
    }

    /**
     * Insert a pattern over an arbitrary int alphabet, such as ids from a
     * {@link utilities.TokenAlphabet}. Such ids are not characters, so folding them would merge
     * unrelated symbols: this overload requires the {@link SymbolNormalizer#IDENTITY} normalizer.
     *
     * @return the pattern (the existing one if the symbols were inserted before), or null if the
     *         pattern is empty and the policy is {@link EmptyPatternPolicy#IGNORE}
     * @throws IllegalStateException if the builder is configured with another normalizer
     */
    public Pattern insert(int[] symbols, String label) {
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(label, "label");
        if (normalizer != SymbolNormalizer.IDENTITY) {
            throw new IllegalStateException("int-alphabet patterns require the IDENTITY normalizer");
        }
        return insertSymbols(symbols, label);
    }

    private Pattern insertSymbols(int[] symbols, String label) {
        NodeArena a = requireArena();

        if (symbols.length == 0) {
            if (config.emptyPatternPolicy() == EmptyPatternPolicy.REJECT) {
                throw new IllegalArgumentException("empty pattern");
            }
            ignoredEmpty++;
            AcLogger.warning("Ignoring empty pattern");
            return null;
        }

        int[] normalized = new int[symbols.length];
        for (int i = 0; i < symbols.length; i++) {
            normalized[i] = normalizer.normalize(symbols[i]);
            if (normalized[i] == NodeArena.RESERVED_SYMBOL) {
                throw new IllegalArgumentException("symbol at " + i + " is reserved: " + normalized[i]);
            }
        }

        // Follow existing path as far as possible
        int state = NodeArena.ROOT;
        int j = 0;
        while (j < normalized.length) {
            int next = a.child(state, normalized[j]);
            if (next == NodeArena.NO_NODE) {
                break;
            }
            state = next;
            j++;
        }

        // New nodes for the remaining suffix
        for (; j < normalized.length; j++) {
            state = a.addChild(state, normalized[j]);
        }

        int existing = terminalToPattern.get(state);
        if (existing >= 0) {
            return patterns.get(existing);
        }
        Pattern p = new Pattern(patterns.size(), normalized, label);
        patterns.add(p);
        terminalToPattern.put(state, p.id);
        a.addOutput(state, p.id);
        return p;
    }

    public void insertAll(Iterable<? extends CharSequence> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        for (CharSequence p : patterns) {
            insert(p);
        }
    }

    public int patternCount() {
        return patterns.size();
    }

    public int nodeCount() {
        return requireArena().size();
    }

    public int ignoredEmptyPatterns() {
        return ignoredEmpty;
    }

    public boolean isCompiled() {
        return arena == null;
    }

    /** Compute failure links and freeze. May be called once; the builder is spent afterwards. */
    public Automaton compile() {
        return AutomatonCompiler.compile(this);
    }

    /**
     * Hand the arena and the pattern table to the caller and mark this builder spent.
     * Used by {@link AutomatonCompiler}.
     */
    public Detached detach() {
        NodeArena a = requireArena();
        Detached detached = new Detached(a, Collections.unmodifiableList(new ObjectArrayList<>(patterns)), config);
        arena = null;
        return detached;
    }

    private NodeArena requireArena() {
        if (arena == null) {
            throw new IllegalStateException("TrieBuilder already compiled");
        }
        return arena;
    }

    public record Detached(NodeArena arena, List<Pattern> patterns, AutomatonConfiguration config) {
    }
}
