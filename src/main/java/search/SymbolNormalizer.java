package search;

import java.util.function.IntUnaryOperator;

/**
 * Transform applied to every symbol, both when a pattern is inserted and when input is scanned.
 * Patterns and input must go through the same normalizer or they silently stop matching, which
 * is why the automaton carries its normalizer instead of leaving it to the caller.
 */
@FunctionalInterface
public interface SymbolNormalizer extends IntUnaryOperator {

    SymbolNormalizer IDENTITY = symbol -> symbol;

    // Folds 'A'..'Z' only; every other symbol (including bytes >= 0x80) is left alone.
    SymbolNormalizer ASCII_LOWERCASE = symbol -> (symbol >= 'A' && symbol <= 'Z') ? symbol + ('a' - 'A') : symbol;

    /**
     * {@link Character#toLowerCase(int)} on each symbol. Text is inserted and scanned one UTF-16
     * code unit at a time, so surrogate halves pass through unchanged and supplementary-plane
     * uppercase letters (Deseret, for example) are never folded. Callers who need that should
     * lowercase whole strings ({@link String#toLowerCase}) before inserting and scanning.
     */
    SymbolNormalizer UNICODE_LOWERCASE = Character::toLowerCase;

    int normalize(int symbol);

    @Override
    default int applyAsInt(int symbol) {
        return normalize(symbol);
    }
}
