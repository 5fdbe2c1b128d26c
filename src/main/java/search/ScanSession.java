package search;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy match sequence for one pass over one input. Input is only pulled when the caller asks
 * for the next match, so abandoning the iterator abandons the scan.
 */
public final class ScanSession implements Iterator<Match> {

    private final ScanCursor cursor;
    private final PrimitiveIterator.OfInt source;
    private int pendingIndex = 0;
    private int pendingCount = 0;

    public ScanSession(ScanCursor cursor, PrimitiveIterator.OfInt source) {
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public boolean hasNext() {
        while (pendingIndex >= pendingCount) {
            if (!source.hasNext()) {
                return false;
            }
            pendingCount = cursor.advance(source.nextInt());
            pendingIndex = 0;
        }
        return true;
    }

    @Override
    public Match next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more matches");
        }
        return cursor.matchAt(pendingIndex++);
    }

    // Remaining matches as a sequential stream backed by this session.
    public Stream<Match> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public ScanStats stats() {
        return cursor.stats();
    }

    // Symbols consumed so far.
    public long position() {
        return cursor.position();
    }
}
