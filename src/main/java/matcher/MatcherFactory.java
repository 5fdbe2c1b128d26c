package matcher;

import automaton.AutomatonConfiguration;

import java.util.EnumSet;
import java.util.Objects;

/**
 * Central place to construct matchers for a harness (the automaton and the literal baseline).
 */
public final class MatcherFactory {

    private MatcherFactory() {}

    public enum MatcherType {
        AHO_CORASICK("Aho-Corasick", "ac"),
        LITERAL("LiteralScan", "literal");

        private final String displayName;
        private final String label;

        MatcherType(String displayName, String label) {
            this.displayName = displayName;
            this.label = label;
        }

        public String displayName() { return displayName; }
        public String label() { return label; }

        public static MatcherType fromString(String value) {
            return EnumSet.allOf(MatcherType.class).stream()
                    .filter(type -> type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown matcher type: " + value));
        }
    }

    public static IPatternMatcher create(MatcherType type, Iterable<? extends CharSequence> patterns) {
        return create(type, patterns, AutomatonConfiguration.defaults());
    }

    public static IPatternMatcher create(MatcherType type,
                                         Iterable<? extends CharSequence> patterns,
                                         AutomatonConfiguration config) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(config, "config");
        switch (type) {
            case AHO_CORASICK:
                return AhoCorasickMatcher.of(patterns, config);
            case LITERAL:
                return new LiteralScanMatcher(patterns, config.normalizer(), config.emptyPatternPolicy());
            default:
                throw new IllegalArgumentException("Unsupported matcher type: " + type);
        }
    }
}
