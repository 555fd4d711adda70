package motifs;

import java.util.EnumSet;

public enum MotifCategory {
    PROMOTERS("promoters"),
    RESTRICTIONS("restrictions"),
    CPG_SITES("cpg_sites");

    private final String token;

    MotifCategory(String token) { this.token = token; }

    public String token() { return token; }

    public static MotifCategory fromString(String value) {
        return EnumSet.allOf(MotifCategory.class).stream()
                .filter(category -> category.token.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown motif category: " + value));
    }
}
