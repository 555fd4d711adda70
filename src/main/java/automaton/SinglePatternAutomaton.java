package automaton;

import alphabet.DnaAlphabet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Deterministic matcher for one DNA pattern.
 *
 * <p>States are {@code 0..m}: 0 is the initial state and {@code m} the accepting one. The KMP
 * failure function is computed once and then folded into a dense transition table with one row
 * per state and one column per alphabet symbol, so scanning does a single array lookup per text
 * symbol.</p>
 *
 * <p>A text {@code N} satisfies any pattern symbol, so after one the scan may track several states
 * at once (the longest ones only, since a state implies all of its borders). Text without
 * {@code N} keeps a single state and takes the table path. A text symbol outside the alphabet
 * sends the automaton back to state 0. Instances are immutable and can be scanned
 * concurrently.</p>
 */
public final class SinglePatternAutomaton implements IPatternAutomaton {

    private final String pattern;
    private final int m;
    // alphabet code per pattern position, INVALID for characters outside the alphabet
    private final int[] codes;
    private final int[] failure;
    // row-major: transitions[state * SIZE + code]
    private final int[] transitions;

    private SinglePatternAutomaton(String pattern) {
        this.pattern = pattern;
        this.m = pattern.length();
        this.codes = new int[m];
        for (int i = 0; i < m; i++) {
            codes[i] = DnaAlphabet.code(pattern.charAt(i));
        }
        this.failure = prefixFunction(pattern);
        this.transitions = buildTransitions();
    }

    public static SinglePatternAutomaton build(CharSequence pattern) {
        return build(pattern, BuildListener.LOGGING);
    }

    public static SinglePatternAutomaton build(CharSequence pattern, BuildListener listener) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(listener, "listener");
        if (pattern.length() == 0) {
            throw new EmptyPatternException();
        }
        SinglePatternAutomaton automaton = new SinglePatternAutomaton(DnaAlphabet.normalize(pattern));
        listener.onBuilt(String.format(Locale.ROOT, "DFA initialized for pattern: %s (%d bp, %d states)",
                automaton.pattern, automaton.m, automaton.stateCount()));
        return automaton;
    }

    // failure[i] = length of the longest proper prefix of pattern[0..i] that is also a suffix of it
    static int[] prefixFunction(String p) {
        int[] pi = new int[p.length()];
        int k = 0;
        for (int i = 1; i < p.length(); ++i) {
            while (k > 0 && p.charAt(k) != p.charAt(i)) k = pi[k - 1];
            if (p.charAt(k) == p.charAt(i)) ++k;
            pi[i] = k;
        }
        return pi;
    }

    private int[] buildTransitions() {
        int[] table = new int[(m + 1) * DnaAlphabet.SIZE];
        for (int state = 0; state <= m; state++) {
            for (int c = 0; c < DnaAlphabet.SIZE; c++) {
                int next;
                if (state < m && (c == DnaAlphabet.N || c == codes[state])) {
                    next = state + 1;
                } else {
                    next = fold(state, c);
                }
                table[state * DnaAlphabet.SIZE + c] = next;
            }
        }
        return table;
    }

    // Next state on a mismatch: slide through shorter borders until one can be extended by c.
    // The accepting state m folds from failure[m-1], which lets overlapping occurrences continue.
    private int fold(int state, int c) {
        int j = state > 0 ? failure[state - 1] : 0;
        while (j > 0 && c != DnaAlphabet.N && codes[j] != c) {
            j = failure[j - 1];
        }
        if (c == DnaAlphabet.N || codes[j] == c) {
            return j + 1;
        }
        return 0;
    }

    @Override
    public List<Match> match(CharSequence text) {
        List<Match> matches = new ArrayList<>();
        scan(text, matches::add);
        return matches;
    }

    @Override
    public int scan(CharSequence text, Consumer<Match> sink) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sink, "sink");
        int emitted = 0;
        // live states; one unless a text N left several alignments open
        IntArrayList states = IntArrayList.of(0);
        IntArrayList next = new IntArrayList();
        IntOpenHashSet members = new IntOpenHashSet();
        for (int i = 0, n = text.length(); i < n; i++) {
            int c = DnaAlphabet.code(text.charAt(i));
            if (c == DnaAlphabet.INVALID) {
                states.clear();
                states.add(0);
                continue;
            }
            if (c != DnaAlphabet.N && states.size() == 1) {
                int state = transitions[states.getInt(0) * DnaAlphabet.SIZE + c];
                states.set(0, state);
                if (state == m) {
                    sink.accept(Match.exact(i - m + 1, 0, pattern));
                    emitted++;
                }
                continue;
            }

            next.clear();
            members.clear();
            for (int k = 0; k < states.size(); k++) {
                int state = states.getInt(k);
                if (c == DnaAlphabet.N) {
                    // every border of the matched prefix can be extended by the wildcard
                    for (int b = state; ; b = failure[b - 1]) {
                        if (b < m && members.add(b + 1)) {
                            next.add(b + 1);
                        }
                        if (b == 0) {
                            break;
                        }
                    }
                } else {
                    int target = transitions[state * DnaAlphabet.SIZE + c];
                    if (members.add(target)) {
                        next.add(target);
                    }
                }
            }
            keepLongest(next, members);
            IntArrayList swap = states;
            states = next;
            next = swap;
            if (states.contains(m)) {
                sink.accept(Match.exact(i - m + 1, 0, pattern));
                emitted++;
            }
        }
        return emitted;
    }

    // Drops states that are a proper border of another live state; the longer one implies them.
    private void keepLongest(IntArrayList states, IntOpenHashSet covered) {
        if (states.size() < 2) {
            return;
        }
        covered.clear();
        for (int k = 0; k < states.size(); k++) {
            int b = states.getInt(k);
            while (b > 0) {
                b = failure[b - 1];
                if (!covered.add(b)) {
                    break;
                }
            }
        }
        int kept = 0;
        for (int k = 0; k < states.size(); k++) {
            int state = states.getInt(k);
            if (!covered.contains(state)) {
                states.set(kept++, state);
            }
        }
        states.size(kept);
    }

    public int nextState(int state, char symbol) {
        if (state < 0 || state > m) {
            throw new IllegalArgumentException("state " + state + " outside [0, " + m + "]");
        }
        int c = DnaAlphabet.code(symbol);
        return c == DnaAlphabet.INVALID ? 0 : transitions[state * DnaAlphabet.SIZE + c];
    }

    public int[] failureFunction() {
        return failure.clone();
    }

    public String pattern() {
        return pattern;
    }

    public int length() {
        return m;
    }

    public int stateCount() {
        return m + 1;
    }

    @Override
    public int patternCount() {
        return 1;
    }
}
