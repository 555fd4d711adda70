package automaton;

import alphabet.DnaAlphabet;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Aho-Corasick matcher for a set of DNA patterns.
 *
 * <p>Trie nodes live in an arena addressed by int index; node 0 is the root. Each node owns
 * {@link #SLOTS} child slots (one per alphabet code plus one shared slot for pattern characters
 * outside the alphabet), a failure link stored as a plain index and the ids of every pattern
 * ending at the node or anywhere along its failure chain.</p>
 *
 * <p>A text {@code N} stands for any symbol, including a pattern character outside the alphabet.
 * After one, the scan keeps every trie node the text could have reached, pruned to those not on
 * another's failure chain, until the readings converge again. A text symbol outside the alphabet
 * returns the scan to the root.</p>
 */
public final class MultiPatternAutomaton implements IPatternAutomaton {

    static final int ROOT = 0;
    // the root is never anyone's child, so its index doubles as "no edge"
    private static final int NONE = 0;
    private static final int OTHER = DnaAlphabet.SIZE;
    static final int SLOTS = DnaAlphabet.SIZE + 1;

    private static final Comparator<Match> BY_POSITION =
            Comparator.comparingInt(Match::position).thenComparingInt(Match::patternId);

    private final String[] patterns;
    private final int[] children;
    private final int[] failure;
    private final int[][] outputs;
    private final int nodeCount;

    private MultiPatternAutomaton(String[] patterns) {
        this.patterns = patterns;

        IntArrayList childArena = new IntArrayList();
        List<IntArrayList> terminals = new ArrayList<>();
        appendNode(childArena, terminals);
        int nodes = 1;
        for (int id = 0; id < patterns.length; id++) {
            String p = patterns[id];
            if (p.isEmpty()) {
                continue;
            }
            int node = ROOT;
            for (int i = 0; i < p.length(); i++) {
                int slot = slot(p.charAt(i));
                int next = childArena.getInt(node * SLOTS + slot);
                if (next == NONE) {
                    next = nodes++;
                    appendNode(childArena, terminals);
                    childArena.set(node * SLOTS + slot, next);
                }
                node = next;
            }
            terminals.get(node).add(id);
        }

        this.nodeCount = nodes;
        this.children = childArena.toIntArray();
        this.failure = new int[nodeCount];
        this.outputs = new int[nodeCount][];
        linkFailures(terminals);
    }

    public static MultiPatternAutomaton build(List<? extends CharSequence> patterns) {
        return build(patterns, BuildListener.LOGGING);
    }

    public static MultiPatternAutomaton build(List<? extends CharSequence> patterns, BuildListener listener) {
        Objects.requireNonNull(patterns, "patterns");
        Objects.requireNonNull(listener, "listener");
        if (patterns.isEmpty()) {
            throw new EmptyPatternSetException();
        }
        String[] normalized = new String[patterns.size()];
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] = DnaAlphabet.normalize(Objects.requireNonNull(patterns.get(i), "pattern " + i));
        }
        MultiPatternAutomaton automaton = new MultiPatternAutomaton(normalized);
        listener.onBuilt(String.format(Locale.ROOT, "Aho-Corasick initialized with %d patterns (%d trie nodes)",
                normalized.length, automaton.nodeCount));
        return automaton;
    }

    private static void appendNode(IntArrayList childArena, List<IntArrayList> terminals) {
        for (int s = 0; s < SLOTS; s++) {
            childArena.add(NONE);
        }
        terminals.add(new IntArrayList(1));
    }

    private static int slot(char c) {
        int code = DnaAlphabet.code(c);
        return code == DnaAlphabet.INVALID ? OTHER : code;
    }

    // Breadth-first, so a node's failure target (always shallower) is finished before the node.
    private void linkFailures(List<IntArrayList> terminals) {
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        failure[ROOT] = ROOT;
        outputs[ROOT] = terminals.get(ROOT).toIntArray();
        queue.enqueue(ROOT);

        while (!queue.isEmpty()) {
            int parent = queue.dequeueInt();
            for (int s = 0; s < SLOTS; s++) {
                int child = children[parent * SLOTS + s];
                if (child == NONE) {
                    continue;
                }
                int target = ROOT;
                if (parent != ROOT) {
                    int f = failure[parent];
                    while (f != ROOT && children[f * SLOTS + s] == NONE) {
                        f = failure[f];
                    }
                    int candidate = children[f * SLOTS + s];
                    if (candidate != NONE) {
                        target = candidate;
                    }
                }
                failure[child] = target;
                outputs[child] = concat(terminals.get(child), outputs[target]);
                queue.enqueue(child);
            }
        }
    }

    private static int[] concat(IntArrayList own, int[] inherited) {
        int[] merged = new int[own.size() + inherited.length];
        own.getElements(0, merged, 0, own.size());
        System.arraycopy(inherited, 0, merged, own.size(), inherited.length);
        return merged;
    }

    // Deterministic transition on a non-wildcard code.
    private int step(int node, int code) {
        while (true) {
            int next = children[node * SLOTS + code];
            if (next != NONE) {
                return next;
            }
            if (node == ROOT) {
                return ROOT;
            }
            node = failure[node];
        }
    }

    // A text N extends every suffix of the matched path, so every child along the failure chain is live.
    private void expandWildcard(int node, IntArrayList next, IntOpenHashSet members, IntOpenHashSet visited) {
        for (int v = node; visited.add(v); v = failure[v]) {
            int base = v * SLOTS;
            for (int s = 0; s < SLOTS; s++) {
                int child = children[base + s];
                if (child != NONE && members.add(child)) {
                    next.add(child);
                }
            }
            if (v == ROOT) {
                return;
            }
        }
    }

    // Drops nodes lying on another live node's failure chain; their outputs are already reported through it.
    private void keepMaximal(IntArrayList nodes, IntOpenHashSet covered) {
        if (nodes.size() < 2) {
            return;
        }
        covered.clear();
        for (int k = 0; k < nodes.size(); k++) {
            int v = nodes.getInt(k);
            while (v != ROOT) {
                v = failure[v];
                if (!covered.add(v)) {
                    break;
                }
            }
        }
        int kept = 0;
        for (int k = 0; k < nodes.size(); k++) {
            int v = nodes.getInt(k);
            if (!covered.contains(v)) {
                nodes.set(kept++, v);
            }
        }
        nodes.size(kept);
    }

    @Override
    public List<Match> match(CharSequence text) {
        List<Match> matches = new ArrayList<>();
        scan(text, matches::add);
        matches.sort(BY_POSITION);
        return matches;
    }

    @Override
    public int scan(CharSequence text, Consumer<Match> sink) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sink, "sink");
        int emitted = 0;
        // live trie nodes; a single node unless a wildcard left several readings of the text open
        IntArrayList active = IntArrayList.of(ROOT);
        IntArrayList next = new IntArrayList();
        IntOpenHashSet members = new IntOpenHashSet();
        IntOpenHashSet visited = new IntOpenHashSet();
        IntOpenHashSet reported = new IntOpenHashSet();

        for (int i = 0, n = text.length(); i < n; i++) {
            int code = DnaAlphabet.code(text.charAt(i));
            if (code == DnaAlphabet.INVALID) {
                active.clear();
                active.add(ROOT);
                continue;
            }
            if (code != DnaAlphabet.N && active.size() == 1) {
                int node = step(active.getInt(0), code);
                active.set(0, node);
                emitted += emit(node, i, sink, null);
                continue;
            }

            next.clear();
            members.clear();
            visited.clear();
            for (int k = 0; k < active.size(); k++) {
                int node = active.getInt(k);
                if (code == DnaAlphabet.N) {
                    expandWildcard(node, next, members, visited);
                } else {
                    int target = step(node, code);
                    if (members.add(target)) {
                        next.add(target);
                    }
                }
            }
            if (next.isEmpty()) {
                next.add(ROOT);
            }
            keepMaximal(next, visited);
            IntArrayList swap = active;
            active = next;
            next = swap;

            reported.clear();
            for (int k = 0; k < active.size(); k++) {
                emitted += emit(active.getInt(k), i, sink, active.size() > 1 ? reported : null);
            }
        }
        return emitted;
    }

    // Reports every pattern ending at the node; ids already in reported are skipped.
    private int emit(int node, int end, Consumer<Match> sink, IntOpenHashSet reported) {
        int count = 0;
        for (int id : outputs[node]) {
            if (reported != null && !reported.add(id)) {
                continue;
            }
            String p = patterns[id];
            sink.accept(Match.exact(end - p.length() + 1, id, p));
            count++;
        }
        return count;
    }

    public List<String> patterns() {
        return List.of(patterns);
    }

    @Override
    public int patternCount() {
        return patterns.length;
    }

    public int nodeCount() {
        return nodeCount;
    }
}
