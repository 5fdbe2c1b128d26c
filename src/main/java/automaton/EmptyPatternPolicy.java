package automaton;

// What TrieBuilder does with a pattern that has no symbols.
public enum EmptyPatternPolicy {
    // Log a warning and skip it; insert returns null.
    IGNORE,
    // Throw IllegalArgumentException.
    REJECT
}
