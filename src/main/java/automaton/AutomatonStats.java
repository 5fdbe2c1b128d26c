package automaton;

// Shape of a compiled automaton, computed once at compile time.
public record AutomatonStats(int nodeCount,
                             long edgeCount,
                             int patternCount,
                             int maxDepth,
                             long totalOutputs,       // sum of |outputs(n)| over all nodes, after propagation
                             int nonRootFailLinks) {  // nodes other than the root whose failure link is not the root
}
