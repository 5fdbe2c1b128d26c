package search;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

// Adapters from common inputs to the int symbol stream the scanner consumes.
public final class Symbols {

    private Symbols() {}

    // UTF-16 code units, read lazily.
    public static PrimitiveIterator.OfInt of(CharSequence text) {
        return new PrimitiveIterator.OfInt() {
            private int i = 0;

            @Override
            public boolean hasNext() {
                return i < text.length();
            }

            @Override
            public int nextInt() {
                if (!hasNext()) throw new NoSuchElementException("No more characters");
                return text.charAt(i++);
            }
        };
    }

    // Unsigned bytes 0..255 of data[offset, offset + length).
    public static PrimitiveIterator.OfInt of(byte[] data, int offset, int length) {
        int end = offset + length;
        return new PrimitiveIterator.OfInt() {
            private int i = offset;

            @Override
            public boolean hasNext() {
                return i < end;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) throw new NoSuchElementException("No more bytes");
                return data[i++] & 0xff;
            }
        };
    }

    public static PrimitiveIterator.OfInt of(int[] symbols) {
        return new PrimitiveIterator.OfInt() {
            private int i = 0;

            @Override
            public boolean hasNext() {
                return i < symbols.length;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) throw new NoSuchElementException("No more symbols");
                return symbols[i++];
            }
        };
    }
}
