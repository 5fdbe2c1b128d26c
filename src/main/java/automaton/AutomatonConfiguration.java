package automaton;

import search.SymbolNormalizer;

import java.util.Objects;

// Immutable configuration for building Aho-Corasick automata.
public final class AutomatonConfiguration {

    private static final AutomatonConfiguration DEFAULTS = builder().build();

    private final SymbolNormalizer normalizer;
    private final EmptyPatternPolicy emptyPatternPolicy;
    private final int expectedNodes;
    private final boolean collectStats;

    private AutomatonConfiguration(Builder builder) {
        this.normalizer = Objects.requireNonNull(builder.normalizer, "normalizer");
        this.emptyPatternPolicy = Objects.requireNonNull(builder.emptyPatternPolicy, "emptyPatternPolicy");
        this.expectedNodes = builder.expectedNodes;
        this.collectStats = builder.collectStats;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static AutomatonConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (expectedNodes <= 0) {
            throw new IllegalArgumentException("expectedNodes must be positive");
        }
    }

    public SymbolNormalizer normalizer() { return normalizer; }
    public EmptyPatternPolicy emptyPatternPolicy() { return emptyPatternPolicy; }
    public int expectedNodes() { return expectedNodes; }
    public boolean collectStats() { return collectStats; }

    public Builder toBuilder() {
        return builder()
                .normalizer(normalizer)
                .emptyPatternPolicy(emptyPatternPolicy)
                .expectedNodes(expectedNodes)
                .collectStats(collectStats);
    }

    public static final class Builder {
        private SymbolNormalizer normalizer = SymbolNormalizer.IDENTITY;
        private EmptyPatternPolicy emptyPatternPolicy = EmptyPatternPolicy.IGNORE;
        private int expectedNodes = 16;
        private boolean collectStats = true;

        private Builder() {
        }

        public Builder normalizer(SymbolNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder emptyPatternPolicy(EmptyPatternPolicy emptyPatternPolicy) {
            this.emptyPatternPolicy = (emptyPatternPolicy == null) ? EmptyPatternPolicy.IGNORE : emptyPatternPolicy;
            return this;
        }

        public Builder expectedNodes(int expectedNodes) {
            this.expectedNodes = expectedNodes;
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public AutomatonConfiguration build() {
            return new AutomatonConfiguration(this);
        }
    }
}
