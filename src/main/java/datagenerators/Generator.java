package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

// Synthetic texts and pattern sets for scale tests of the automaton.
public class Generator {

    public static String generateUniform(int length, int min_domain, int max_domain, long seed) {
        if (min_domain < Character.MIN_VALUE) throw new IllegalArgumentException("min_domain < 0");
        if (max_domain - 1 > Character.MAX_VALUE) throw new IllegalArgumentException("max_domain - 1 exceeds Character.MAX_VALUE");
        if (max_domain <= min_domain) throw new IllegalArgumentException("max_domain must be greater than min_domain");

        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) (min_domain + rng.nextInt(max_domain - min_domain));
        }
        return new String(chars);
    }

    public static String generateZipf(int length,
                                      int min_domain,
                                      int max_domain,
                                      double exponent,
                                      long seed) {
        if (min_domain < Character.MIN_VALUE) {
            throw new IllegalArgumentException("min_domain < Character.MIN_VALUE");
        }
        // We want codes in the half open interval [min_domain, max_domain)
        int alphabetSize = max_domain - min_domain;
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("max_domain must be greater than min_domain");
        }
        if (max_domain - 1 > Character.MAX_VALUE) {
            throw new IllegalArgumentException("max_domain - 1 exceeds Character.MAX_VALUE");
        }

        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();                 // 1 .. alphabetSize
            chars[i] = (char) (min_domain + (rank - 1));
        }
        return new String(chars);
    }

    // Random substrings of text, so every pattern occurs at least once.
    public static List<String> samplePatterns(String text, int count, int minLen, int maxLen, long seed) {
        if (minLen <= 0 || maxLen < minLen) throw new IllegalArgumentException("need 0 < minLen <= maxLen");
        if (maxLen > text.length()) throw new IllegalArgumentException("maxLen exceeds text length");

        RandomGenerator rng = new Well19937c(seed);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int len = minLen + rng.nextInt(maxLen - minLen + 1);
            int start = rng.nextInt(text.length() - len + 1);
            out.add(text.substring(start, start + len));
        }
        return out;
    }
}
