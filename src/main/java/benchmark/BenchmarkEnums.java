package benchmark;

public final class BenchmarkEnums {
    private BenchmarkEnums() {}

    public enum Algorithm {
        DFA("DFA", "dfa"),
        AHO_CORASICK("Aho-Corasick", "aho_corasick");

        private final String displayName;
        private final String csvLabel;

        Algorithm(String displayName, String csvLabel) {
            this.displayName = displayName;
            this.csvLabel = csvLabel;
        }

        public String displayName() { return displayName; }
        public String csvLabel() { return csvLabel; }
    }
}
