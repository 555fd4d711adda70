package benchmark;

import automaton.IPatternAutomaton;
import automaton.MultiPatternAutomaton;
import automaton.SinglePatternAutomaton;
import benchmark.BenchmarkEnums.Algorithm;
import datagenerators.DnaGenerator;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import utilities.DnaLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Times repeated scans of prebuilt automata. Construction is excluded from every measurement;
 * only {@code match} calls are timed.
 */
public class BenchmarkRunner {

    private final BenchmarkConfiguration config;

    public BenchmarkRunner() {
        this(BenchmarkConfiguration.defaults());
    }

    public BenchmarkRunner(BenchmarkConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public BenchmarkConfiguration config() {
        return config;
    }

    public BenchmarkResult benchmarkDfa(String pattern, CharSequence text) {
        return benchmarkDfa(pattern, text, config.iterations());
    }

    public BenchmarkResult benchmarkDfa(String pattern, CharSequence text, int iterations) {
        SinglePatternAutomaton dfa = SinglePatternAutomaton.build(pattern, config.buildListener());
        return time(Algorithm.DFA, dfa, text, iterations);
    }

    public BenchmarkResult benchmarkAhoCorasick(List<String> patterns, CharSequence text) {
        return benchmarkAhoCorasick(patterns, text, config.iterations());
    }

    public BenchmarkResult benchmarkAhoCorasick(List<String> patterns, CharSequence text, int iterations) {
        MultiPatternAutomaton ac = MultiPatternAutomaton.build(patterns, config.buildListener());
        return time(Algorithm.AHO_CORASICK, ac, text, iterations);
    }

    private static BenchmarkResult time(Algorithm algorithm, IPatternAutomaton automaton, CharSequence text, int iterations) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        DescriptiveStatistics times = new DescriptiveStatistics(iterations);
        int matches = 0;
        for (int i = 0; i < iterations; i++) {
            long start = System.nanoTime();
            matches = automaton.match(text).size();
            long elapsed = System.nanoTime() - start;
            times.addValue(elapsed / 1_000_000.0);
        }
        DnaLogger.debug(String.format(Locale.ROOT, "%s: %d iterations over %d bp, avg %.4f ms",
                algorithm.displayName(), iterations, text.length(), times.getMean()));
        return new BenchmarkResult(algorithm,
                times.getMin(),
                times.getMax(),
                times.getMean(),
                times.getSum(),
                matches,
                text.length(),
                automaton.patternCount());
    }

    // DFA scan time over synthetic texts of each configured size.
    public List<ScalabilityPoint> benchmarkScalability(String pattern) {
        List<ScalabilityPoint> points = new ArrayList<>(config.scalabilitySizes().size());
        int round = 0;
        for (int size : config.scalabilitySizes()) {
            String text = DnaGenerator.generateRandomDna(size, config.gcPercentage(), config.seed() + round++);
            BenchmarkResult bench = benchmarkDfa(pattern, text, config.scalabilityIterations());
            points.add(new ScalabilityPoint(size, bench.avgMs(), bench.matches()));
            DnaLogger.info(String.format(Locale.ROOT, "Size: %8d bp -> Time: %.4f ms | Matches: %d",
                    size, bench.avgMs(), bench.matches()));
        }
        return points;
    }

    public AlgorithmComparison compareAlgorithms(String pattern, List<String> patterns, CharSequence text) {
        BenchmarkResult dfa = benchmarkDfa(pattern, text);
        BenchmarkResult ac = benchmarkAhoCorasick(patterns, text);
        double speedup = dfa.avgMs() > 0.0 ? ac.avgMs() / dfa.avgMs() : Double.POSITIVE_INFINITY;
        return new AlgorithmComparison(dfa, ac, speedup);
    }
}
