package search;

// One occurrence of a pattern; start is the offset of its first symbol in the scanned stream.
public record Match(Pattern pattern, long start) {

    public int patternId() {
        return pattern.id;
    }

    // Exclusive end offset.
    public long end() {
        return start + pattern.length();
    }

    @Override
    public String toString() {
        return "(" + start + ",\"" + pattern.patternTxt + "\")";
    }
}
