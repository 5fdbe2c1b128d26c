package search;

// Push-style receiver for matches produced by a ScanCursor.
@FunctionalInterface
public interface MatchListener {

    void onMatch(Pattern pattern, long start);
}
