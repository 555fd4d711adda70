package automaton;

import java.util.List;
import java.util.function.Consumer;

public interface IPatternAutomaton {

    // All matches in ascending start position; overlapping occurrences are all reported.
    List<Match> match(CharSequence text);

    // Streams matches to the sink as they are found and returns how many were emitted.
    int scan(CharSequence text, Consumer<Match> sink);

    int patternCount();
}
