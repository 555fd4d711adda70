package alphabet;

import java.util.Arrays;
import java.util.Locale;

/**
 * The fixed nucleotide alphabet {A, C, G, T, N} shared by both automata.
 * Codes are dense (A=0 .. N=4) so transition rows and trie slots can be plain arrays.
 * Lookups are case-insensitive; every other character maps to {@link #INVALID}.
 */
public final class DnaAlphabet {

    public static final int SIZE = 5;

    public static final int A = 0;
    public static final int C = 1;
    public static final int G = 2;
    public static final int T = 3;
    public static final int N = 4;

    // distinguishes "not a nucleotide" from every valid code
    public static final int INVALID = -1;

    public static final char WILDCARD = 'N';

    private static final char[] SYMBOLS = {'A', 'C', 'G', 'T', 'N'};

    private static final int[] CODES = new int[128];

    static {
        Arrays.fill(CODES, INVALID);
        for (int code = 0; code < SYMBOLS.length; code++) {
            char upper = SYMBOLS[code];
            CODES[upper] = code;
            CODES[Character.toLowerCase(upper)] = code;
        }
    }

    private DnaAlphabet() {}

    public static int code(char c) {
        return c < CODES.length ? CODES[c] : INVALID;
    }

    public static char symbol(int code) {
        if (code < 0 || code >= SIZE) {
            throw new IllegalArgumentException("No symbol for code " + code);
        }
        return SYMBOLS[code];
    }

    public static boolean isSymbol(char c) {
        return code(c) != INVALID;
    }

    public static boolean isWildcard(char c) {
        return code(c) == N;
    }

    // Canonical (upper) case; characters outside the alphabet are kept as they are.
    public static String normalize(CharSequence s) {
        return s.toString().toUpperCase(Locale.ROOT);
    }

    public static char[] symbols() {
        return SYMBOLS.clone();
    }
}
