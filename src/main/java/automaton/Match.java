package automaton;

/**
 * One exact occurrence of a pattern in a scanned text.
 *
 * @param position  0-based start offset in the scanned text
 * @param length    pattern length
 * @param patternId index of the pattern in the automaton (always 0 for a single-pattern automaton)
 * @param pattern   the normalized pattern text
 * @param score     1.0 for every exact match
 */
public record Match(int position, int length, int patternId, String pattern, double score) {

    public static final double EXACT_SCORE = 1.0;

    public static Match exact(int position, int patternId, String pattern) {
        return new Match(position, pattern.length(), patternId, pattern, EXACT_SCORE);
    }

    // Exclusive end offset.
    public int end() {
        return position + length;
    }
}
