package utilities;

import benchmark.AlgorithmComparison;
import benchmark.BenchmarkResult;
import benchmark.PerformanceAnalyzer;
import benchmark.ScalabilityPoint;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Console and CSV reporting for benchmark results.
 */
public final class BenchmarkReporter {
    private BenchmarkReporter() {}

    public static void printScalability(PrintStream out, String pattern, List<ScalabilityPoint> points) {
        out.printf(Locale.ROOT, "Scalability of DFA scan for pattern %s%n", pattern);
        out.println(PerformanceAnalyzer.generateReport(points));
        PerformanceAnalyzer.ComplexityEstimate estimate = PerformanceAnalyzer.calculateComplexity(points);
        out.printf(Locale.ROOT, "Estimated complexity: %s (confidence %.1f)%n  %s%n",
                estimate.estimatedComplexity(), estimate.confidence(), estimate.evidence());
        PerformanceAnalyzer.summaryStats(points).ifPresent(stats -> out.printf(Locale.ROOT,
                "Runs: %d  min=%.4f ms  max=%.4f ms  avg=%.4f ms  total matches=%d%n",
                stats.numTests(), stats.minTimeMs(), stats.maxTimeMs(), stats.avgTimeMs(), stats.totalMatches()));
    }

    public static void printComparison(PrintStream out, AlgorithmComparison comparison) {
        for (BenchmarkResult r : List.of(comparison.dfa(), comparison.ahoCorasick())) {
            out.printf(Locale.ROOT,
                    "  %s -> patterns=%d, text=%d bp, avg=%.4f ms, min=%.4f ms, max=%.4f ms, matches=%d%n",
                    r.algorithm().displayName(), r.patternCount(), r.textSize(), r.avgMs(), r.minMs(), r.maxMs(), r.matches());
        }
        out.printf(Locale.ROOT, "  Speedup (Aho-Corasick / DFA): %.3f -> faster: %s%n",
                comparison.speedup(), comparison.faster().displayName());
    }

    public static Path writeCsv(Path csvPath, String pattern, List<ScalabilityPoint> points) throws IOException {
        List<List<Object>> csvRows = new ArrayList<>();
        csvRows.add(List.of("pattern", "text_size", "time_ms", "matches"));
        for (ScalabilityPoint p : points) {
            csvRows.add(List.of(pattern, p.textSize(), p.timeMs(), p.matches()));
        }
        CsvUtil.writeRows(csvPath, csvRows);
        return csvPath;
    }

    public static Path writeComparisonCsv(Path csvPath, AlgorithmComparison comparison) throws IOException {
        List<List<Object>> csvRows = new ArrayList<>();
        csvRows.add(List.of("algorithm", "patterns", "text_size", "min_ms", "max_ms", "avg_ms", "total_ms", "matches"));
        for (BenchmarkResult r : List.of(comparison.dfa(), comparison.ahoCorasick())) {
            csvRows.add(List.of(r.algorithm().csvLabel(), r.patternCount(), r.textSize(),
                    r.minMs(), r.maxMs(), r.avgMs(), r.totalMs(), r.matches()));
        }
        CsvUtil.writeRows(csvPath, csvRows);
        return csvPath;
    }
}
