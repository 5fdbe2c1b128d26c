package matcher;

import automaton.EmptyPatternPolicy;
import search.Match;
import search.Pattern;
import search.ScanStats;
import search.SymbolNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;

// Baseline that looks for every pattern separately with java.util.regex; cost grows with the pattern count.
public class LiteralScanMatcher implements IPatternMatcher {

    private final SymbolNormalizer normalizer;
    private final List<Pattern> patterns = new ArrayList<>();
    private final List<java.util.regex.Pattern> compiled = new ArrayList<>();

    public LiteralScanMatcher(Iterable<? extends CharSequence> patterns) {
        this(patterns, SymbolNormalizer.IDENTITY);
    }

    public LiteralScanMatcher(Iterable<? extends CharSequence> patterns, SymbolNormalizer normalizer) {
        this(patterns, normalizer, EmptyPatternPolicy.IGNORE);
    }

    public LiteralScanMatcher(Iterable<? extends CharSequence> patterns,
                              SymbolNormalizer normalizer,
                              EmptyPatternPolicy emptyPatternPolicy) {
        Objects.requireNonNull(patterns, "patterns");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        Objects.requireNonNull(emptyPatternPolicy, "emptyPatternPolicy");

        // Same id assignment and empty-pattern handling as TrieBuilder: first insertion wins.
        Map<String, String> distinct = new LinkedHashMap<>();
        for (CharSequence p : patterns) {
            if (p.length() == 0) {
                if (emptyPatternPolicy == EmptyPatternPolicy.REJECT) {
                    throw new IllegalArgumentException("empty pattern");
                }
                continue;
            }
            distinct.putIfAbsent(normalize(p), p.toString());
        }
        for (Map.Entry<String, String> e : distinct.entrySet()) {
            Pattern p = new Pattern(this.patterns.size(), Pattern.toSymbols(e.getKey()), e.getValue());
            this.patterns.add(p);
            this.compiled.add(java.util.regex.Pattern.compile(e.getKey(), java.util.regex.Pattern.LITERAL));
        }
    }

    @Override
    public ArrayList<Match> report(CharSequence text) {
        String normalized = normalize(text);
        ArrayList<Match> positions = new ArrayList<>();

        for (int i = 0; i < compiled.size(); i++) {
            Matcher matcher = compiled.get(i).matcher(normalized);
            // Restart one past the previous start so overlapping occurrences are reported too.
            int from = 0;
            while (from <= normalized.length() && matcher.find(from)) {
                positions.add(new Match(patterns.get(i), matcher.start()));
                from = matcher.start() + 1;
            }
        }
        positions.sort(Comparator.comparingLong(Match::end).thenComparingInt(m -> -m.pattern().length()));
        return positions;
    }

    @Override
    public boolean exists(CharSequence text) {
        String normalized = normalize(text);
        for (java.util.regex.Pattern p : compiled) {
            if (p.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int patternCount() {
        return patterns.size();
    }

    @Override
    public ScanStats getLatestStats() {
        return null;
    }

    // Char-wise normalization; keeps a 1:1 offset mapping with the input.
    private String normalize(CharSequence s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            sb.append((char) normalizer.normalize(s.charAt(i)));
        }
        return sb.toString();
    }
}
