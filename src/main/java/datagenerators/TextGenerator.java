package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Seeded text generators used to exercise suffix tree construction. Every generator draws
 * characters from {@code [firstChar, firstChar + alphabetSize)}, so a terminator outside that
 * range is guaranteed not to occur.
 */
public final class TextGenerator {

    private TextGenerator() {
    }

    public static String generateUniform(int length, char firstChar, int alphabetSize, long seed) {
        checkArguments(length, firstChar, alphabetSize);
        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) (firstChar + rng.nextInt(alphabetSize));
        }
        return new String(chars);
    }

    public static String generateZipf(int length, char firstChar, int alphabetSize, double exponent, long seed) {
        checkArguments(length, firstChar, alphabetSize);
        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();
            chars[i] = (char) (firstChar + (rank - 1));
        }
        return new String(chars);
    }

    /**
     * {@code unit} repeated until {@code length} characters. Highly repetitive input drives the
     * tree as deep as it gets, which is what the iterative traversals are for.
     */
    public static String generatePeriodic(int length, String unit) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (unit == null || unit.isEmpty()) {
            throw new IllegalArgumentException("unit cannot be empty");
        }
        StringBuilder sb = new StringBuilder(length);
        while (sb.length() < length) {
            sb.append(unit, 0, Math.min(unit.length(), length - sb.length()));
        }
        return sb.toString();
    }

    private static void checkArguments(int length, char firstChar, int alphabetSize) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabetSize must be positive");
        }
        if (firstChar + alphabetSize - 1 > Character.MAX_VALUE) {
            throw new IllegalArgumentException("alphabet exceeds Character.MAX_VALUE");
        }
    }
}
