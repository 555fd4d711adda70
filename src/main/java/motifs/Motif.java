package motifs;

/**
 * A named reference motif.
 *
 * <p>{@code position} and {@code gcContent} are only known for promoter-like motifs;
 * {@code cutPosition} and {@code overhang} only for restriction sites. Missing values are null.</p>
 */
public record Motif(String name,
                    MotifCategory category,
                    String sequence,
                    String organism,
                    String function,
                    String position,
                    Double gcContent,
                    Integer cutPosition,
                    String overhang,
                    String description) {
}
