package datagenerators;

import alphabet.DnaAlphabet;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.MathArrays;

public class DnaGenerator {

    /**
     * Random A/C/G/T sequence of exactly {@code length} symbols whose G+C share is
     * {@code floor(length * gcPercentage / 100)} symbols. Composition is fixed up front and the
     * positions are then shuffled, so the GC content is exact rather than expected.
     */
    public static String generateRandomDna(int length, double gcPercentage, long seed) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (gcPercentage < 0.0 || gcPercentage > 100.0) {
            throw new IllegalArgumentException("gcPercentage must be in [0, 100]");
        }

        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);

        int numGc = (int) Math.floor(length * gcPercentage / 100.0);
        int numAt = length - numGc;

        int[] codes = new int[length];
        int i = 0;
        // odd remainders go to the second symbol of each pair
        i = fill(codes, i, numGc / 2, DnaAlphabet.G);
        i = fill(codes, i, numGc - numGc / 2, DnaAlphabet.C);
        i = fill(codes, i, numAt / 2, DnaAlphabet.A);
        fill(codes, i, numAt - numAt / 2, DnaAlphabet.T);

        MathArrays.shuffle(codes, rng);

        char[] chars = new char[length];
        for (int k = 0; k < length; k++) {
            chars[k] = DnaAlphabet.symbol(codes[k]);
        }
        return new String(chars);
    }

    public static String generateRandomDna(int length, double gcPercentage) {
        return generateRandomDna(length, gcPercentage, System.nanoTime());
    }

    public static String generateRandomDna(int length) {
        return generateRandomDna(length, 50.0);
    }

    private static int fill(int[] codes, int from, int count, int code) {
        for (int k = 0; k < count; k++) {
            codes[from + k] = code;
        }
        return from + count;
    }
}
