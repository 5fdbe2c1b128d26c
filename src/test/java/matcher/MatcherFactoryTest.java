package matcher;

import automaton.AutomatonConfiguration;
import automaton.EmptyPatternPolicy;
import datagenerators.Generator;
import org.junit.jupiter.api.Test;
import search.Match;
import search.SymbolNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MatcherFactoryTest {

    private static List<String> render(List<Match> matches) {
        return matches.stream().map(m -> m.start() + ":" + m.pattern().text()).sorted().collect(Collectors.toList());
    }

    @Test
    public void typesParseFromLabelsAndNames() {
        assertEquals(MatcherFactory.MatcherType.AHO_CORASICK, MatcherFactory.MatcherType.fromString("ac"));
        assertEquals(MatcherFactory.MatcherType.LITERAL, MatcherFactory.MatcherType.fromString("LITERAL"));
        assertThrows(IllegalArgumentException.class, () -> MatcherFactory.MatcherType.fromString("wu-manber"));
    }

    @Test
    public void automatonAgreesWithLiteralBaseline() {
        String text = Generator.generateZipf(20_000, 'a', 'f', 1.2, 21L);
        List<String> patterns = new ArrayList<>(Generator.samplePatterns(text, 300, 1, 7, 8L));
        patterns.add("zzz"); // never occurs
        patterns.add("");    // skipped by both

        IPatternMatcher ac = MatcherFactory.create(MatcherFactory.MatcherType.AHO_CORASICK, patterns);
        IPatternMatcher literal = MatcherFactory.create(MatcherFactory.MatcherType.LITERAL, patterns);

        assertEquals(literal.patternCount(), ac.patternCount());
        assertEquals(render(literal.report(text)), render(ac.report(text)));
        assertTrue(ac.exists(text));
        assertTrue(literal.exists(text));
    }

    @Test
    public void baselineHonoursTheNormalizer() {
        AutomatonConfiguration config = AutomatonConfiguration.builder()
                .normalizer(SymbolNormalizer.ASCII_LOWERCASE)
                .build();
        List<String> patterns = List.of("Cash", "SHEW", "ew");
        IPatternMatcher ac = MatcherFactory.create(MatcherFactory.MatcherType.AHO_CORASICK, patterns, config);
        IPatternMatcher literal = MatcherFactory.create(MatcherFactory.MatcherType.LITERAL, patterns, config);

        assertEquals(List.of("0:Cash", "2:SHEW", "4:ew"), render(ac.report("CasHEW")));
        assertEquals(render(ac.report("CasHEW")), render(literal.report("CasHEW")));
    }

    @Test
    public void bothMatchersRejectEmptyPatternsWhenConfigured() {
        AutomatonConfiguration config = AutomatonConfiguration.builder()
                .emptyPatternPolicy(EmptyPatternPolicy.REJECT)
                .build();
        List<String> patterns = List.of("abc", "");
        assertThrows(IllegalArgumentException.class,
                () -> MatcherFactory.create(MatcherFactory.MatcherType.AHO_CORASICK, patterns, config));
        assertThrows(IllegalArgumentException.class,
                () -> MatcherFactory.create(MatcherFactory.MatcherType.LITERAL, patterns, config));

        IPatternMatcher literal = MatcherFactory.create(MatcherFactory.MatcherType.LITERAL, List.of("abc", ""));
        assertEquals(1, literal.patternCount());
    }

    @Test
    public void latestStatsFollowTheLastCall() {
        IPatternMatcher ac = MatcherFactory.create(MatcherFactory.MatcherType.AHO_CORASICK, List.of("needle"));
        assertNull(ac.getLatestStats());

        assertFalse(ac.exists("haystack"));
        assertEquals(8, ac.getLatestStats().symbolsScanned());

        ArrayList<Match> found = ac.report("a needle, another needle");
        assertEquals(2, found.size());
        assertEquals(2, ac.getLatestStats().matches());

        assertNull(MatcherFactory.create(MatcherFactory.MatcherType.LITERAL, List.of("x")).getLatestStats());
    }
}
