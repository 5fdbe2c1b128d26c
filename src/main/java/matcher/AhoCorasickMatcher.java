package matcher;

import automaton.Automaton;
import automaton.AutomatonConfiguration;
import search.Match;
import search.ScanSession;
import search.ScanStats;
import trie.TrieBuilder;

import java.util.ArrayList;
import java.util.Objects;

// IPatternMatcher over a compiled automaton. The automaton is shared; only latestStats is per instance.
public final class AhoCorasickMatcher implements IPatternMatcher {

    private final Automaton automaton;
    private volatile ScanStats latestStats;

    public AhoCorasickMatcher(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
    }

    public static AhoCorasickMatcher of(Iterable<? extends CharSequence> patterns, AutomatonConfiguration config) {
        TrieBuilder builder = new TrieBuilder(config);
        builder.insertAll(patterns);
        return new AhoCorasickMatcher(builder.compile());
    }

    public Automaton automaton() {
        return automaton;
    }

    @Override
    public ArrayList<Match> report(CharSequence text) {
        ScanSession session = automaton.scan(text);
        ArrayList<Match> positions = new ArrayList<>();
        while (session.hasNext()) {
            positions.add(session.next());
        }
        latestStats = session.stats();
        return positions;
    }

    @Override
    public boolean exists(CharSequence text) {
        ScanSession session = automaton.scan(text);
        boolean found = session.hasNext();
        latestStats = session.stats();
        return found;
    }

    @Override
    public int patternCount() {
        return automaton.patternCount();
    }

    @Override
    public ScanStats getLatestStats() {
        return latestStats;
    }
}
