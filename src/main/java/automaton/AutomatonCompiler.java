package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import search.Pattern;
import trie.NodeArena;
import trie.TrieBuilder;
import utilities.AcLogger;

import java.util.List;
import java.util.Objects;

/**
 * Turns a finished trie into an Aho-Corasick automaton.
 *
 * Failure links are computed breadth-first: by the time a node is dequeued, the failure links
 * of every shallower node are final, so the upward walk for each child only visits nodes whose
 * links are already correct. After a child's link is fixed its output set absorbs the output
 * set of its failure target, which (being shallower) is already closed under the failure
 * relation. A single union per node is therefore enough to close every output set.
 */
public final class AutomatonCompiler {

    private AutomatonCompiler() {}

    public static Automaton compile(TrieBuilder builder) {
        Objects.requireNonNull(builder, "builder");
        TrieBuilder.Detached detached = builder.detach();
        NodeArena arena = detached.arena();
        List<Pattern> patterns = detached.patterns();

        computeFailureLinks(arena);
        arena.seal();

        Automaton automaton = new Automaton(arena, patterns, detached.config());
        if (AcLogger.isDebugEnabled()) {
            AcLogger.debug("Compiled automaton: " + automaton.stats());
        }
        return automaton;
    }

    static void computeFailureLinks(NodeArena arena) {
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue(Math.max(1, arena.size()));

        // Nodes at depth 1 fail to the root
        arena.forEachChild(NodeArena.ROOT, (symbol, child) -> {
            arena.setFail(child, NodeArena.ROOT);
            queue.enqueue(child);
        });

        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            int nodeFail = arena.fail(node);

            arena.forEachChild(node, (symbol, child) -> {
                int f = nodeFail;
                int target = arena.child(f, symbol);
                while (target == NodeArena.NO_NODE && f != NodeArena.ROOT) {
                    f = arena.fail(f);
                    target = arena.child(f, symbol);
                }
                int childFail = (target == NodeArena.NO_NODE) ? NodeArena.ROOT : target;
                arena.setFail(child, childFail);
                arena.unionOutputs(child, childFail);
                queue.enqueue(child);
            });
        }
    }
}
