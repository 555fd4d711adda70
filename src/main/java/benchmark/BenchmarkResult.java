package benchmark;

import benchmark.BenchmarkEnums.Algorithm;

// Timing of repeated scans of one text; all times in milliseconds.
public record BenchmarkResult(Algorithm algorithm,
                              double minMs,
                              double maxMs,
                              double avgMs,
                              double totalMs,
                              int matches,
                              int textSize,
                              int patternCount) {
}
