package trie;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Column store for trie nodes. A node is nothing but an index into these columns; children,
 * failure links and outputs all refer to other nodes by index, so the back-edges that failure
 * links introduce never create object cycles.
 *
 * Child storage is adaptive:
 *
 *   - The first child of a node lives inline in two int columns (key, child) and costs no
 *     allocation. Most trie nodes built from natural-language or rule patterns have one child.
 *
 *   - A second distinct child promotes the node to an Int2IntOpenHashMap; the inline child is
 *     moved into the map once and from then on only the map is used.
 *
 * Once {@link #seal()} is called every mutator throws, and the arena may be read from any
 * number of threads.
 */
public final class NodeArena {

    public static final int ROOT = 0;
    public static final int NO_NODE = -1;

    // Marks an empty inline slot, so it can never label an edge.
    public static final int RESERVED_SYMBOL = Integer.MIN_VALUE;

    private static final int NO_KEY = RESERVED_SYMBOL;
    private static final int[] NO_OUTPUTS = new int[0];

    private final IntArrayList inlineKey;
    private final IntArrayList inlineChild;
    private final ObjectArrayList<Int2IntOpenHashMap> childMaps;
    private final IntArrayList fail;
    private final IntArrayList depth;
    private final ObjectArrayList<IntLinkedOpenHashSet> outputs;

    private long edgeCount;
    private boolean sealed;

    @FunctionalInterface
    public interface ChildVisitor {
        void visit(int symbol, int child);
    }

    public NodeArena(int expectedNodes) {
        if (expectedNodes <= 0) {
            throw new IllegalArgumentException("expectedNodes must be positive");
        }
        this.inlineKey = new IntArrayList(expectedNodes);
        this.inlineChild = new IntArrayList(expectedNodes);
        this.childMaps = new ObjectArrayList<>(expectedNodes);
        this.fail = new IntArrayList(expectedNodes);
        this.depth = new IntArrayList(expectedNodes);
        this.outputs = new ObjectArrayList<>(expectedNodes);
        appendNode(0); // root
    }

    public int size() {
        return fail.size();
    }

    public long edgeCount() {
        return edgeCount;
    }

    public boolean isSealed() {
        return sealed;
    }

    // Forbid further mutation and drop unused capacity.
    public void seal() {
        if (sealed) {
            return;
        }
        sealed = true;
        inlineKey.trim();
        inlineChild.trim();
        childMaps.trim();
        fail.trim();
        depth.trim();
        outputs.trim();
        for (int i = 0; i < childMaps.size(); i++) {
            Int2IntOpenHashMap m = childMaps.get(i);
            if (m != null) {
                m.trim();
            }
        }
    }

    /** Child of {@code node} on {@code symbol}, or {@link #NO_NODE}. */
    public int child(int node, int symbol) {
        Int2IntOpenHashMap m = childMaps.get(node);
        if (m != null) {
            return m.get(symbol);
        }
        return inlineKey.getInt(node) == symbol ? inlineChild.getInt(node) : NO_NODE;
    }

    /** Append a fresh node as the child of {@code parent} on {@code symbol} and return its index. */
    public int addChild(int parent, int symbol) {
        ensureMutable();
        if (symbol == NO_KEY) {
            throw new IllegalArgumentException("symbol " + symbol + " is reserved");
        }
        if (child(parent, symbol) != NO_NODE) {
            throw new IllegalStateException("node " + parent + " already has a child on " + symbol);
        }
        int node = appendNode(depth.getInt(parent) + 1);

        Int2IntOpenHashMap m = childMaps.get(parent);
        if (m != null) {
            m.put(symbol, node);
        } else if (inlineChild.getInt(parent) == NO_NODE) {
            inlineKey.set(parent, symbol);
            inlineChild.set(parent, node);
        } else {
            // Need to promote to a map
            m = new Int2IntOpenHashMap(4);
            m.defaultReturnValue(NO_NODE);
            m.put(inlineKey.getInt(parent), inlineChild.getInt(parent));
            m.put(symbol, node);
            childMaps.set(parent, m);
            inlineKey.set(parent, NO_KEY);
            inlineChild.set(parent, NO_NODE);
        }
        edgeCount++;
        return node;
    }

    public int childCount(int node) {
        Int2IntOpenHashMap m = childMaps.get(node);
        if (m != null) {
            return m.size();
        }
        return inlineChild.getInt(node) == NO_NODE ? 0 : 1;
    }

    // Callers do not need to know if the node uses the inline slot or a map.
    public void forEachChild(int node, ChildVisitor visitor) {
        Int2IntOpenHashMap m = childMaps.get(node);
        if (m != null) {
            for (Int2IntMap.Entry e : m.int2IntEntrySet()) {
                visitor.visit(e.getIntKey(), e.getIntValue());
            }
        } else if (inlineChild.getInt(node) != NO_NODE) {
            visitor.visit(inlineKey.getInt(node), inlineChild.getInt(node));
        }
    }

    public int fail(int node) {
        return fail.getInt(node);
    }

    public void setFail(int node, int target) {
        ensureMutable();
        checkNode(target);
        fail.set(node, target);
    }

    public int depth(int node) {
        return depth.getInt(node);
    }

    /** Add a pattern id to the node's output set; returns false if it was already there. */
    public boolean addOutput(int node, int patternId) {
        ensureMutable();
        IntLinkedOpenHashSet set = outputs.get(node);
        if (set == null) {
            set = new IntLinkedOpenHashSet(2);
            outputs.set(node, set);
        }
        return set.add(patternId);
    }

    /** outputs(target) = outputs(target) ∪ outputs(source), keeping target's own entries first. */
    public void unionOutputs(int target, int source) {
        ensureMutable();
        IntLinkedOpenHashSet from = outputs.get(source);
        if (from == null || from.isEmpty() || target == source) {
            return;
        }
        IntLinkedOpenHashSet into = outputs.get(target);
        if (into == null) {
            into = new IntLinkedOpenHashSet(from.size());
            outputs.set(target, into);
        }
        into.addAll(from);
    }

    public int outputCount(int node) {
        IntLinkedOpenHashSet set = outputs.get(node);
        return set == null ? 0 : set.size();
    }

    public boolean hasOutput(int node, int patternId) {
        IntLinkedOpenHashSet set = outputs.get(node);
        return set != null && set.contains(patternId);
    }

    // Snapshot of the output set in insertion order.
    public int[] outputsOf(int node) {
        IntLinkedOpenHashSet set = outputs.get(node);
        return (set == null || set.isEmpty()) ? NO_OUTPUTS : set.toIntArray();
    }

    private int appendNode(int nodeDepth) {
        int index = fail.size();
        inlineKey.add(NO_KEY);
        inlineChild.add(NO_NODE);
        childMaps.add(null);
        fail.add(ROOT);
        depth.add(nodeDepth);
        outputs.add(null);
        return index;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= size()) {
            throw new IndexOutOfBoundsException("node " + node + " out of range [0, " + size() + ")");
        }
    }

    private void ensureMutable() {
        if (sealed) {
            throw new IllegalStateException("NodeArena is sealed");
        }
    }
}
