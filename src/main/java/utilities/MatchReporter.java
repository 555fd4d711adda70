package utilities;

import automaton.Match;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tabular rendering of matches for the console and for CSV export.
 */
public final class MatchReporter {
    private MatchReporter() {}

    public static final List<String> CSV_HEADER = List.of("sequence_id", "position", "end", "length", "pattern_id", "pattern", "score");

    // Aligned text table; the "matched" column shows the text slice, which differs from the pattern where the text has N.
    public static String toTable(List<Match> matches, CharSequence text) {
        int patternWidth = "Pattern".length();
        for (Match m : matches) {
            patternWidth = Math.max(patternWidth, m.pattern().length());
        }
        String rowFormat = "%-10s %-10s %-7s %-" + patternWidth + "s  %s%n";

        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, rowFormat, "Position", "End", "Length", "Pattern", "Matched"));
        for (Match m : matches) {
            String matched = text.subSequence(m.position(), m.end()).toString();
            sb.append(String.format(Locale.ROOT, rowFormat,
                    m.position(), m.end(), m.length(), m.pattern(), matched));
        }
        sb.append(String.format(Locale.ROOT, "%d match(es)%n", matches.size()));
        return sb.toString();
    }

    // CSV rows without the header, one per match, tagged with the id of the scanned sequence.
    public static List<List<Object>> toCsvRows(String sequenceId, List<Match> matches) {
        List<List<Object>> rows = new ArrayList<>(matches.size());
        for (Match m : matches) {
            List<Object> row = new ArrayList<>(CSV_HEADER.size());
            row.add(sequenceId);
            row.add(m.position());
            row.add(m.end());
            row.add(m.length());
            row.add(m.patternId());
            row.add(m.pattern());
            row.add(m.score());
            rows.add(row);
        }
        return rows;
    }
}
