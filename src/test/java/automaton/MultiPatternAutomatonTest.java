package automaton;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MultiPatternAutomatonTest {

    private static MultiPatternAutomaton ac(String... patterns) {
        return MultiPatternAutomaton.build(List.of(patterns), BuildListener.SILENT);
    }

    private static final Comparator<Match> BY_POSITION_THEN_ID =
            Comparator.comparingInt(Match::position).thenComparingInt(Match::patternId);

    private static boolean wildcardMatchAt(String pattern, String text, int i) {
        for (int j = 0; j < pattern.length(); j++) {
            char t = text.charAt(i + j);
            if (t != 'N' && t != pattern.charAt(j)) {
                return false;
            }
        }
        return true;
    }

    private static List<String> hits(List<Match> matches) {
        return matches.stream().map(m -> m.position() + ":" + m.patternId()).collect(Collectors.toList());
    }

    @Test
    void findsNestedPatterns() {
        List<Match> matches = ac("ACG", "CG").match("ACG");
        assertEquals(List.of("0:0", "1:1"), hits(matches));
        assertEquals("CG", matches.get(1).pattern());
        assertEquals(2, matches.get(1).length());
    }

    @Test
    void scanEmitsByEndOffsetAndMatchSortsByPosition() {
        MultiPatternAutomaton automaton = ac("ACGT", "CG");
        List<Match> streamed = new ArrayList<>();
        int emitted = automaton.scan("ACGT", streamed::add);
        assertEquals(2, emitted);
        assertEquals(List.of("1:1", "0:0"), hits(streamed));
        assertEquals(List.of("0:0", "1:1"), hits(automaton.match("ACGT")));
    }

    @Test
    void duplicatePatternsReportEveryId() {
        assertEquals(List.of("1:0", "1:1"), hits(ac("GA", "GA").match("TGA")));
    }

    @Test
    void emptyPatternKeepsItsIdButNeverMatches() {
        MultiPatternAutomaton automaton = ac("", "AC");
        assertEquals(2, automaton.patternCount());
        assertEquals(List.of("0:1", "2:1"), hits(automaton.match("ACAC")));
    }

    @Test
    void rejectsEmptyPatternList() {
        assertThrows(EmptyPatternSetException.class, () -> MultiPatternAutomaton.build(List.of()));
        assertThrows(NullPointerException.class, () -> MultiPatternAutomaton.build(null));
    }

    @Test
    void sharesPrefixesInTrie() {
        assertEquals(5, ac("ACG", "ACT").nodeCount());
        assertEquals(1, ac("").nodeCount());
    }

    @Test
    void textWildcardMatchesAnySymbol() {
        assertEquals(List.of("0:0"), hits(ac("ACG").match("ANG")));
        assertEquals(List.of("0:0"), hits(ac("ACG").match("NNN")));
    }

    @Test
    void textWildcardMatchesLiteralAndOrdinaryBranches() {
        assertEquals(List.of("0:0", "0:1"), hits(ac("ANG", "ACG").match("ANG")));
        assertEquals(List.of("0:1"), hits(ac("ANG", "ACG").match("ACG")));
    }

    @Test
    void leadingTextWildcardReachesEveryFirstSymbol() {
        assertEquals(List.of("0:0", "0:1"), hits(ac("ACG", "CCG").match("NCG")));
    }

    @Test
    void textWildcardFollowsFailureLinks() {
        // the N completes GAT and, through the failure link of GA, the AC starting at the A
        assertEquals(List.of("0:0", "1:1"), hits(ac("GAT", "AC").match("GAN")));
        assertEquals(List.of("0:0", "1:1", "2:1"), hits(ac("GAT", "AC").match("GANC")));
    }

    @Test
    void overlappingReadingsReportEachMatchOnce() {
        List<Match> matches = ac("AA", "A").match("NN");
        assertEquals(List.of("0:0", "0:1", "1:1"), hits(matches));
    }

    @Test
    void patternCharacterOutsideAlphabetOnlyMatchesWildcard() {
        MultiPatternAutomaton automaton = ac("GCR");
        assertEquals(List.of("0:0"), hits(automaton.match("GCN")));
        assertTrue(automaton.match("GCA").isEmpty());
    }

    @Test
    void symbolOutsideAlphabetResetsScan() {
        MultiPatternAutomaton automaton = ac("ACG", "CG");
        assertTrue(automaton.match("ACXG").isEmpty());
        assertEquals(List.of("4:0", "5:1"), hits(automaton.match("AC-GACG")));
    }

    @Test
    void normalizesCase() {
        MultiPatternAutomaton automaton = ac("gaattc", "GgAtCc");
        assertEquals(List.of("GAATTC", "GGATCC"), automaton.patterns());
        assertEquals(List.of("2:0", "10:1"), hits(automaton.match("ttgaattcaaggatcc")));
    }

    @Test
    void agreesWithNaiveSearchOnRandomText() {
        Random random = new Random(11);
        char[] symbols = {'A', 'C', 'G', 'T'};
        for (int round = 0; round < 100; round++) {
            List<String> patterns = new ArrayList<>();
            int k = 1 + random.nextInt(5);
            for (int p = 0; p < k; p++) {
                StringBuilder sb = new StringBuilder();
                int m = 1 + random.nextInt(4);
                for (int i = 0; i < m; i++) {
                    sb.append(symbols[random.nextInt(3)]);
                }
                patterns.add(sb.toString());
            }
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < 200; i++) {
                text.append(symbols[random.nextInt(3)]);
            }
            String t = text.toString();

            List<Match> expected = new ArrayList<>();
            for (int id = 0; id < patterns.size(); id++) {
                String p = patterns.get(id);
                for (int i = 0; i + p.length() <= t.length(); i++) {
                    if (t.startsWith(p, i)) {
                        expected.add(Match.exact(i, id, p));
                    }
                }
            }
            expected.sort(BY_POSITION_THEN_ID);
            List<Match> actual = new ArrayList<>(MultiPatternAutomaton.build(patterns, BuildListener.SILENT).match(t));
            actual.sort(BY_POSITION_THEN_ID);
            assertEquals(expected, actual, "patterns " + patterns);
        }
    }

    @Test
    void agreesWithSinglePatternMatchersOnTextWithWildcards() {
        Random random = new Random(31);
        char[] symbols = {'A', 'C', 'G', 'N'};
        for (int round = 0; round < 200; round++) {
            List<String> patterns = new ArrayList<>();
            int k = 1 + random.nextInt(5);
            for (int p = 0; p < k; p++) {
                StringBuilder sb = new StringBuilder();
                int m = 1 + random.nextInt(5);
                for (int i = 0; i < m; i++) {
                    sb.append(random.nextInt(10) == 0 ? 'N' : symbols[random.nextInt(3)]);
                }
                patterns.add(sb.toString());
            }
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < 150; i++) {
                text.append(symbols[random.nextInt(4)]);
            }
            String t = text.toString();

            List<Match> union = new ArrayList<>();
            List<Match> naive = new ArrayList<>();
            for (int id = 0; id < patterns.size(); id++) {
                String p = patterns.get(id);
                for (Match single : SinglePatternAutomaton.build(p, BuildListener.SILENT).match(t)) {
                    union.add(Match.exact(single.position(), id, p));
                }
                for (int i = 0; i + p.length() <= t.length(); i++) {
                    if (wildcardMatchAt(p, t, i)) {
                        naive.add(Match.exact(i, id, p));
                    }
                }
            }
            union.sort(BY_POSITION_THEN_ID);
            naive.sort(BY_POSITION_THEN_ID);
            List<Match> actual = MultiPatternAutomaton.build(patterns, BuildListener.SILENT).match(t);
            assertEquals(naive, actual, "patterns " + patterns + " text " + t);
            assertEquals(union, actual, "patterns " + patterns + " text " + t);
        }
    }

    @Test
    void builtAutomatonCanBeReused() {
        MultiPatternAutomaton automaton = ac("ACG", "CCG", "CG", "GNA");
        String text = "NCGNATACGXCCGNNA";
        List<Match> first = automaton.match(text);
        assertEquals(List.of("0:0", "0:1", "1:2", "2:3", "6:0", "7:2",
                "10:1", "11:2", "12:3", "13:2", "13:3"), hits(first));
        assertEquals(first, automaton.match(text));

        List<Match> other = automaton.match("TTCG");
        assertEquals(List.of("2:2"), hits(other));
        List<Match> streamed = new ArrayList<>();
        assertEquals(first.size(), automaton.scan(text, streamed::add));
        streamed.sort(BY_POSITION_THEN_ID);
        assertEquals(first, streamed);
    }

    @Test
    void notifiesBuildListener() {
        List<String> messages = new ArrayList<>();
        MultiPatternAutomaton.build(List.of("ACG", "ACT"), messages::add);
        assertEquals(List.of("Aho-Corasick initialized with 2 patterns (5 trie nodes)"), messages);
    }
}
