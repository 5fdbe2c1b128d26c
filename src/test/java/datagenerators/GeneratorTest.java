package datagenerators;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GeneratorTest {

    @Test
    public void zipfTextIsReproducibleAndInDomain() {
        String a = Generator.generateZipf(5_000, 'a', 'h', 1.0, 99L);
        String b = Generator.generateZipf(5_000, 'a', 'h', 1.0, 99L);
        assertEquals(a, b);
        assertEquals(5_000, a.length());
        assertTrue(a.chars().allMatch(c -> c >= 'a' && c < 'h'));
        // rank 1 is the most frequent symbol
        long as = a.chars().filter(c -> c == 'a').count();
        long gs = a.chars().filter(c -> c == 'g').count();
        assertTrue(as > gs);
    }

    @Test
    public void uniformTextStaysInDomain() {
        String s = Generator.generateUniform(1_000, 'x', 'z', 1L);
        assertTrue(s.chars().allMatch(c -> c == 'x' || c == 'y'));
        assertThrows(IllegalArgumentException.class, () -> Generator.generateUniform(10, 'z', 'a', 1L));
    }

    @Test
    public void sampledPatternsOccurInTheText() {
        String text = Generator.generateUniform(2_000, 'a', 'e', 5L);
        List<String> patterns = Generator.samplePatterns(text, 50, 2, 9, 6L);
        assertEquals(50, patterns.size());
        for (String p : patterns) {
            assertTrue(p.length() >= 2 && p.length() <= 9);
            assertTrue(text.contains(p));
        }
    }
}
