package search;

import java.util.Arrays;
import java.util.Objects;

public final class Pattern {
    public final int id;
    public final String patternTxt;
    private final int[] symbols;

    public Pattern(int id, int[] symbols, String patternTxt) {
        if (id < 0) throw new IllegalArgumentException("id must be >= 0");
        Objects.requireNonNull(symbols, "symbols");
        if (symbols.length == 0) throw new IllegalArgumentException("symbols must be non-empty");
        this.id = id;
        this.symbols = symbols.clone();
        this.patternTxt = Objects.requireNonNull(patternTxt, "patternTxt");
    }

    public int id() {
        return id;
    }

    public String text() {
        return patternTxt;
    }

    // Length in symbols, which is also the length of every match of this pattern.
    public int length() {
        return symbols.length;
    }

    public int symbolAt(int index) {
        return symbols[index];
    }

    public int[] symbols() {
        return symbols.clone();
    }

    // Symbols as UTF-16 code units; only meaningful for char-alphabet patterns.
    public static int[] toSymbols(CharSequence s) {
        int[] out = new int[s.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = s.charAt(i);
        }
        return out;
    }

    // Unsigned byte values 0..255.
    public static int[] toSymbols(byte[] bytes) {
        int[] out = new int[bytes.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = bytes[i] & 0xff;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        Pattern other = (Pattern) o;
        return id == other.id && Arrays.equals(symbols, other.symbols);
    }

    @Override
    public int hashCode() {
        return 31 * id + Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        return "Pattern{id=" + id + ", text='" + patternTxt + "'}";
    }
}
