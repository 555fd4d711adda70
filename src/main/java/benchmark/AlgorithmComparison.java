package benchmark;

import benchmark.BenchmarkEnums.Algorithm;

// speedup = Aho-Corasick average / DFA average; above 1 the DFA was faster.
public record AlgorithmComparison(BenchmarkResult dfa, BenchmarkResult ahoCorasick, double speedup) {

    public Algorithm faster() {
        return speedup > 1.0 ? Algorithm.DFA : Algorithm.AHO_CORASICK;
    }
}
