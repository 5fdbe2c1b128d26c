package utilities;

import automaton.Automaton;
import automaton.AutomatonConfiguration;
import org.junit.jupiter.api.Test;
import search.Match;
import search.SymbolNormalizer;
import trie.TrieBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenAlphabetTest {

    @Test
    public void idsAreDenseAndStable() {
        TokenAlphabet<String> alphabet = new TokenAlphabet<>(8);
        assertEquals(0, alphabet.getId("quick"));
        assertEquals(1, alphabet.getId("brown"));
        assertEquals(0, alphabet.getId("quick"));
        assertEquals(2, alphabet.getSize());
        assertEquals(TokenAlphabet.UNKNOWN, alphabet.lookup("fox"));
        assertEquals(2, alphabet.getSize());
    }

    @Test
    public void wordLevelPatternsMatchTokenStreams() {
        TokenAlphabet<String> alphabet = new TokenAlphabet<>(16);
        TrieBuilder builder = new TrieBuilder();
        List<String> first = List.of("quick", "brown");
        List<String> second = List.of("brown", "fox");
        builder.insert(alphabet.encodePattern(first), String.join(" ", first));
        builder.insert(alphabet.encodePattern(second), String.join(" ", second));
        Automaton automaton = builder.compile();

        List<String> input = Arrays.asList("the quick brown fox jumps over the quick brown dog".split(" "));
        List<Match> matches = automaton.findAll(alphabet.encodeInput(input));

        assertEquals(3, matches.size());
        assertEquals("quick brown", matches.get(0).pattern().text());
        assertEquals(1, matches.get(0).start());
        assertEquals("brown fox", matches.get(1).pattern().text());
        assertEquals(2, matches.get(1).start());
        assertEquals(7, matches.get(2).start());
        // the input pass must not grow the alphabet
        assertEquals(3, alphabet.getSize());
    }

    @Test
    public void tokenIdsAreNeverCaseFolded() {
        TokenAlphabet<String> alphabet = new TokenAlphabet<>(128);
        List<String> words = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            words.add("w" + i);
        }
        alphabet.encodePattern(words);
        // ids 65 and 97 would collide under ASCII lowercasing
        assertEquals(65, alphabet.lookup("w65"));
        assertEquals(97, alphabet.lookup("w97"));

        TrieBuilder folding = new TrieBuilder(AutomatonConfiguration.builder()
                .normalizer(SymbolNormalizer.ASCII_LOWERCASE)
                .build());
        assertThrows(IllegalStateException.class,
                () -> folding.insert(alphabet.encodePattern(List.of("w65")), "w65"));

        TrieBuilder builder = new TrieBuilder();
        builder.insert(alphabet.encodePattern(List.of("w65")), "w65");
        Automaton automaton = builder.compile();
        assertTrue(automaton.findAll(alphabet.encodeInput(List.of("w97"))).isEmpty());
        assertEquals(1, automaton.findAll(alphabet.encodeInput(List.of("w65"))).size());
    }
}
