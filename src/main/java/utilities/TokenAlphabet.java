package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;
import java.util.Objects;

/**
 * Maps arbitrary tokens (words, log fields, opcodes...) to dense int symbols so that token
 * sequences can be matched with the same automaton as characters or bytes.
 */
public class TokenAlphabet<T> {
    // Never assigned to a token, so it never has a trie edge and always falls back to the root.
    public static final int UNKNOWN = -1;

    int nextId = 0;
    float loadFactor = 0.75f;

    // Primitive map to avoid boxing and reduce overhead
    private final Object2IntOpenHashMap<T> tokenToId;

    public TokenAlphabet(int capacity) {
        // Pre-size to the expected alphabet size to avoid rehashing.
        this.tokenToId = new Object2IntOpenHashMap<>(Math.max(1, capacity), loadFactor);
        this.tokenToId.defaultReturnValue(UNKNOWN);
    }

    public int getSize() {
        return tokenToId.size();
    }

    // Insert-on-miss mapping; use for pattern tokens.
    public int getId(T token) {
        Objects.requireNonNull(token, "token");
        int id = tokenToId.getInt(token);
        if (id == UNKNOWN) {
            id = nextId++;
            tokenToId.put(token, id);
        }
        return id;
    }

    // Lookup only; tokens never seen in a pattern map to UNKNOWN. Use for scanned input.
    public int lookup(T token) {
        return tokenToId.getInt(token);
    }

    public int[] encodePattern(List<? extends T> tokens) {
        int[] out = new int[tokens.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getId(tokens.get(i));
        }
        return out;
    }

    public int[] encodeInput(List<? extends T> tokens) {
        int[] out = new int[tokens.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = lookup(tokens.get(i));
        }
        return out;
    }
}
