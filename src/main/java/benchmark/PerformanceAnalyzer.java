package benchmark;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks scalability measurements against the linear-time expectation of the automata.
 * Consecutive points are compared pairwise: for O(n) scanning a text k times larger should
 * take roughly k times longer.
 */
public final class PerformanceAnalyzer {
    private PerformanceAnalyzer() {}

    public static final double LINEAR_TOLERANCE = 0.2;

    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(60);

    public record RatioCheck(double sizeRatio, double timeRatio, double difference, boolean linear) {}

    public record LinearityAnalysis(boolean linear, List<RatioCheck> ratios, double tolerance, String explanation) {}

    public record ComplexityEstimate(String estimatedComplexity, double confidence, double growthRate, String evidence) {}

    public record SummaryStats(double minTimeMs,
                               double maxTimeMs,
                               double avgTimeMs,
                               int minSize,
                               int maxSize,
                               long totalMatches,
                               int numTests) {}

    public static LinearityAnalysis checkLinearTime(List<ScalabilityPoint> points) {
        if (points.size() < 2) {
            return new LinearityAnalysis(false, List.of(), LINEAR_TOLERANCE, "Need at least 2 data points");
        }
        List<RatioCheck> ratios = new ArrayList<>(points.size() - 1);
        boolean allLinear = true;
        for (int i = 0; i + 1 < points.size(); i++) {
            ScalabilityPoint curr = points.get(i);
            ScalabilityPoint next = points.get(i + 1);
            double sizeRatio = next.textSize() / (double) curr.textSize();
            double timeRatio = next.timeMs() / curr.timeMs();
            double difference = Math.abs(sizeRatio - timeRatio) / sizeRatio;
            // NaN (0 ms on both sides) never counts as linear
            boolean linear = difference <= LINEAR_TOLERANCE;
            ratios.add(new RatioCheck(sizeRatio, timeRatio, difference, linear));
            allLinear &= linear;
        }
        String explanation = allLinear
                ? "DFA exhibits O(n) behavior: time scales linearly with input size"
                : "Deviation from O(n): check for non-linear bottlenecks";
        return new LinearityAnalysis(allLinear, List.copyOf(ratios), LINEAR_TOLERANCE, explanation);
    }

    public static ComplexityEstimate calculateComplexity(List<ScalabilityPoint> points) {
        if (points.size() < 2) {
            return new ComplexityEstimate("Unknown", 0.0, Double.NaN, "Need at least 2 data points");
        }
        SummaryStatistics growth = new SummaryStatistics();
        for (int i = 0; i + 1 < points.size(); i++) {
            ScalabilityPoint curr = points.get(i);
            ScalabilityPoint next = points.get(i + 1);
            double sizeRatio = next.textSize() / (double) curr.textSize();
            double timeRatio = next.timeMs() / curr.timeMs();
            growth.addValue(timeRatio / sizeRatio);
        }
        double avgGrowth = growth.getMean();

        String complexity;
        double confidence;
        if (avgGrowth < 1.1) {
            complexity = "O(n)";
            confidence = 0.9;
        } else if (avgGrowth < 1.2) {
            complexity = "O(n log n)";
            confidence = 0.7;
        } else if (avgGrowth < 1.5) {
            complexity = "O(n√n)";
            confidence = 0.5;
        } else {
            complexity = "O(n²) or worse";
            confidence = 0.6;
        }
        String evidence = String.format(Locale.ROOT,
                "Average growth rate: %.2fx (closer to 1.0 = more linear)", avgGrowth);
        return new ComplexityEstimate(complexity, confidence, avgGrowth, evidence);
    }

    public static Optional<SummaryStats> summaryStats(List<ScalabilityPoint> points) {
        if (points.isEmpty()) {
            return Optional.empty();
        }
        SummaryStatistics times = new SummaryStatistics();
        int minSize = Integer.MAX_VALUE;
        int maxSize = Integer.MIN_VALUE;
        long totalMatches = 0;
        for (ScalabilityPoint p : points) {
            times.addValue(p.timeMs());
            minSize = Math.min(minSize, p.textSize());
            maxSize = Math.max(maxSize, p.textSize());
            totalMatches += p.matches();
        }
        return Optional.of(new SummaryStats(times.getMin(), times.getMax(), times.getMean(),
                minSize, maxSize, totalMatches, points.size()));
    }

    public static String generateReport(List<ScalabilityPoint> points) {
        StringBuilder sb = new StringBuilder();
        line(sb, RULE);
        line(sb, "BENCHMARK RESULTS");
        line(sb, RULE);
        line(sb, "");
        line(sb, String.format(Locale.ROOT, "%-15s %-15s %-15s", "Text Size", "Time (ms)", "Matches"));
        line(sb, THIN_RULE);
        for (ScalabilityPoint p : points) {
            line(sb, String.format(Locale.ROOT, "%-15s %-15.4f %-15d", formatSize(p.textSize()), p.timeMs(), p.matches()));
        }
        line(sb, "");
        line(sb, RULE);

        LinearityAnalysis analysis = checkLinearTime(points);
        line(sb, "ANALYSIS");
        line(sb, THIN_RULE);
        line(sb, analysis.explanation());
        line(sb, "");
        if (!analysis.ratios().isEmpty()) {
            line(sb, "Size-Time Ratio Analysis:");
            for (RatioCheck ratio : analysis.ratios()) {
                line(sb, String.format(Locale.ROOT, "  [%s] Input %.0fx larger -> Time %.2fx longer (diff: %.1f%%)",
                        ratio.linear() ? "ok" : "!!", ratio.sizeRatio(), ratio.timeRatio(), ratio.difference() * 100));
            }
        }
        line(sb, "");
        sb.append(RULE);
        return sb.toString();
    }

    static String formatSize(int size) {
        if (size >= 1_000_000) {
            return String.format(Locale.ROOT, "%.1f MB", size / 1_000_000.0);
        }
        if (size >= 1_000) {
            return String.format(Locale.ROOT, "%.1f KB", size / 1_000.0);
        }
        return size + " bp";
    }

    private static void line(StringBuilder sb, String s) {
        sb.append(s).append('\n');
    }
}
