package automaton;

// Thrown when a multi-pattern automaton is requested for an empty pattern list.
public class EmptyPatternSetException extends IllegalArgumentException {

    public EmptyPatternSetException() {
        super("pattern list must contain at least one pattern");
    }
}
