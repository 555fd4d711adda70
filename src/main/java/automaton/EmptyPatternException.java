package automaton;

// Thrown when a single-pattern automaton is requested for a zero-length pattern.
public class EmptyPatternException extends IllegalArgumentException {

    public EmptyPatternException() {
        super("pattern must contain at least one symbol");
    }
}
