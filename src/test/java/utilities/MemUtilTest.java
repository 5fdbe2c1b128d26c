package utilities;

import automaton.Automaton;
import org.junit.jupiter.api.Test;
import trie.TrieBuilder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MemUtilTest {

    private static Automaton build(List<String> patterns) {
        TrieBuilder builder = new TrieBuilder();
        builder.insertAll(patterns);
        return builder.compile();
    }

    @Test
    public void footprintGrowsWithTheTrie() {
        MemUtil mem = new MemUtil();
        long small = mem.totalBytes(build(List.of("a")));
        long large = mem.totalBytes(build(List.of("alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta")));
        assertTrue(small > 0);
        assertTrue(large > small);
    }

    @Test
    public void reportNamesTheTotals() {
        String report = new MemUtil().jolMemoryReport(true, build(List.of("he", "she", "his", "hers")));
        assertTrue(report.contains("=== Automaton total ==="));
        assertTrue(report.contains("Nodes             : 10"));
        assertTrue(report.contains("--- Class footprint ---"));
    }
}
