package automaton;

import datagenerators.Generator;
import org.junit.jupiter.api.Test;
import search.Match;
import search.ScanSession;
import search.ScanStats;
import trie.TrieBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ScanScalingTest {

    private static Automaton compile(List<String> patterns) {
        TrieBuilder builder = new TrieBuilder(AutomatonConfiguration.builder().expectedNodes(4_096).build());
        builder.insertAll(patterns);
        return builder.compile();
    }

    private static ScanStats drain(ScanSession session) {
        while (session.hasNext()) {
            session.next();
        }
        return session.stats();
    }

    @Test
    public void workIsLinearInInputLength() {
        String text = Generator.generateZipf(400_000, 'a', 'e', 1.1, 11L);
        List<String> patterns = Generator.samplePatterns(text, 500, 2, 12, 5L);
        Automaton automaton = compile(patterns);

        ScanStats small = drain(automaton.scan(text.substring(0, 100_000)));
        ScanStats large = drain(automaton.scan(text));

        assertEquals(100_000, small.symbolsScanned());
        assertEquals(400_000, large.symbolsScanned());
        // every failure step undoes at least one earlier transition
        assertTrue(small.transitions() + small.failSteps() <= 2L * small.symbolsScanned());
        assertTrue(large.transitions() + large.failSteps() <= 2L * large.symbolsScanned());
        // four times the input costs about four times the work, independent of the pattern set
        double ratio = (double) large.nodesVisited() / small.nodesVisited();
        assertTrue(ratio > 3.0 && ratio < 5.0, "ratio " + ratio);
    }

    @Test
    public void workDoesNotGrowWithPatternCount() {
        String text = Generator.generateUniform(100_000, 'a', 'c', 3L);
        Automaton few = compile(Generator.samplePatterns(text, 5, 3, 8, 1L));
        Automaton many = compile(Generator.samplePatterns(text, 2_000, 3, 8, 1L));

        ScanStats fewStats = drain(few.scan(text));
        ScanStats manyStats = drain(many.scan(text));

        assertTrue(fewStats.nodesVisited() <= 2L * text.length());
        assertTrue(manyStats.nodesVisited() <= 2L * text.length());
    }

    @Test
    public void concurrentScansShareOneAutomaton() throws Exception {
        String text = Generator.generateUniform(50_000, 'a', 'd', 9L);
        Automaton automaton = compile(Generator.samplePatterns(text, 200, 2, 6, 4L));
        List<Match> expected = automaton.findAll(text);
        assertFalse(expected.isEmpty());

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<Match>>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> automaton.findAll(text)));
            }
            for (Future<List<Match>> f : futures) {
                assertEquals(expected, f.get(60, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
