import automaton.BuildListener;
import automaton.IPatternAutomaton;
import automaton.Match;
import automaton.MultiPatternAutomaton;
import automaton.SinglePatternAutomaton;
import benchmark.AlgorithmComparison;
import benchmark.BenchmarkConfiguration;
import benchmark.BenchmarkRunner;
import benchmark.ScalabilityPoint;
import datagenerators.DnaGenerator;
import motifs.Motif;
import motifs.MotifCategory;
import motifs.MotifDatabase;
import sequences.FastaReader;
import sequences.FastaRecord;
import sequences.SequenceHandler;
import utilities.BenchmarkReporter;
import utilities.CsvUtil;
import utilities.DnaLogger;
import utilities.MatchReporter;
import utilities.MemUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Command-line front-end for the pattern matchers.
 *
 * <pre>
 *   search    --pattern ACG (--text ACGT... | --fasta genes.fa) [--csv out.csv]
 *   multi     --patterns ACG,TGC (--text ... | --fasta ...) [--csv out.csv]
 *   motif     --name EcoRI (--text ... | --fasta ...) [--csv out.csv]
 *   motifs
 *   benchmark --pattern ATGC [--sizes 1000,10000] [--gc 50] [--seed 42] [--iterations 2] [--csv out.csv]
 *   compare   --pattern ACG --patterns ACG,TGC,GCC [--length 100000] [--gc 50] [--seed 42] [--iterations 3] [--csv out.csv]
 *   memory    (--pattern ACG | --patterns ACG,TGC) [--footprint true]
 * </pre>
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final int DEFAULT_COMPARE_LENGTH = 100_000;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }
        try {
            switch (options.command) {
                case "search" -> search(options, out);
                case "multi" -> multi(options, out);
                case "motif" -> motif(options, out);
                case "motifs" -> listMotifs(out);
                case "benchmark" -> benchmark(options, out);
                case "compare" -> compare(options, out);
                case "memory" -> memory(options, out);
                default -> {
                    err.println("Unknown command: " + options.command);
                    err.println(usage());
                    return EXIT_USAGE;
                }
            }
            return EXIT_OK;
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        } catch (IOException | RuntimeException e) {
            DnaLogger.error("Command " + options.command + " failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static String usage() {
        return "Usage: Main <search|multi|motif|motifs|benchmark|compare|memory> [--key value ...]";
    }

    private static void search(CliOptions options, PrintStream out) throws IOException {
        SinglePatternAutomaton dfa = SinglePatternAutomaton.build(options.require("pattern"));
        scanAll(dfa, options, out);
    }

    private static void multi(CliOptions options, PrintStream out) throws IOException {
        MultiPatternAutomaton ac = MultiPatternAutomaton.build(options.requireList("patterns"));
        scanAll(ac, options, out);
    }

    private static void motif(CliOptions options, PrintStream out) throws IOException {
        String name = options.require("name");
        Motif motif = MotifDatabase.getMotifInfo(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown motif: " + name));
        out.printf(Locale.ROOT, "Motif %s (%s): %s - %s%n",
                motif.name(), motif.category().token(), motif.sequence(), motif.function());
        scanAll(SinglePatternAutomaton.build(motif.sequence()), options, out);
    }

    private static void listMotifs(PrintStream out) {
        for (Map.Entry<MotifCategory, Map<String, Motif>> category : MotifDatabase.getAllMotifs().entrySet()) {
            out.println(category.getKey().token() + ":");
            for (Motif motif : category.getValue().values()) {
                out.printf(Locale.ROOT, "  %-18s %-12s %s%n", motif.name(), motif.sequence(), motif.description());
            }
        }
    }

    private static void scanAll(IPatternAutomaton automaton, CliOptions options, PrintStream out) throws IOException {
        List<FastaRecord> records = inputs(options);
        List<List<Object>> csvRows = new ArrayList<>();
        csvRows.add(new ArrayList<>(MatchReporter.CSV_HEADER));
        for (FastaRecord record : records) {
            List<Match> matches = automaton.match(record.sequence());
            out.printf(Locale.ROOT, ">%s (%d bp, GC %.2f%%)%n",
                    record.id(), record.length(), SequenceHandler.calculateGcContent(record.sequence()));
            out.print(MatchReporter.toTable(matches, record.sequence()));
            csvRows.addAll(MatchReporter.toCsvRows(record.id(), matches));
        }
        if (options.has("csv")) {
            Path csv = Path.of(options.get("csv"));
            CsvUtil.writeRows(csv, csvRows);
            out.println("Matches written to " + csv);
        }
    }

    private static List<FastaRecord> inputs(CliOptions options) throws IOException {
        if (options.has("fasta")) {
            return FastaReader.load(Path.of(options.get("fasta")));
        }
        String text = options.require("text");
        if (!SequenceHandler.validateSequence(text)) {
            DnaLogger.warning("Input text contains symbols outside A/C/G/T/N; they reset the scan");
        }
        return List.of(new FastaRecord("input", "command line text", text.toUpperCase(Locale.ROOT)));
    }

    private static void benchmark(CliOptions options, PrintStream out) throws IOException {
        String pattern = options.require("pattern");
        BenchmarkRunner runner = new BenchmarkRunner(benchmarkConfiguration(options));
        List<ScalabilityPoint> points = runner.benchmarkScalability(pattern);
        BenchmarkReporter.printScalability(out, pattern, points);
        if (options.has("csv")) {
            out.println("Benchmark written to " + BenchmarkReporter.writeCsv(Path.of(options.get("csv")), pattern, points));
        }
    }

    private static void compare(CliOptions options, PrintStream out) throws IOException {
        BenchmarkConfiguration config = benchmarkConfiguration(options);
        int length = options.getInt("length", DEFAULT_COMPARE_LENGTH);
        String text = DnaGenerator.generateRandomDna(length, config.gcPercentage(), config.seed());
        AlgorithmComparison comparison = new BenchmarkRunner(config)
                .compareAlgorithms(options.require("pattern"), options.requireList("patterns"), text);
        BenchmarkReporter.printComparison(out, comparison);
        if (options.has("csv")) {
            out.println("Comparison written to " + BenchmarkReporter.writeComparisonCsv(Path.of(options.get("csv")), comparison));
        }
    }

    private static void memory(CliOptions options, PrintStream out) {
        IPatternAutomaton automaton = options.has("patterns")
                ? MultiPatternAutomaton.build(options.requireList("patterns"))
                : SinglePatternAutomaton.build(options.require("pattern"));
        boolean footprint = Boolean.parseBoolean(options.getOrDefault("footprint", "false"));
        out.print(new MemUtil().jolMemoryReport(false, footprint, automaton));
    }

    private static BenchmarkConfiguration benchmarkConfiguration(CliOptions options) {
        BenchmarkConfiguration.Builder builder = BenchmarkConfiguration.builder()
                .gcPercentage(Double.parseDouble(options.getOrDefault("gc", "50")))
                .seed(Long.parseLong(options.getOrDefault("seed", "42")))
                .buildListener(BuildListener.LOGGING);
        if (options.has("iterations")) {
            int iterations = options.getInt("iterations", 3);
            builder.iterations(iterations).scalabilityIterations(iterations);
        }
        if (options.has("sizes")) {
            builder.scalabilitySizes(options.requireList("sizes").stream()
                    .map(Integer::parseInt)
                    .collect(Collectors.toList()));
        }
        return builder.build();
    }

    // Bad command line, as opposed to a failure while running a well-formed command.
    static final class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }

    static final class CliOptions {
        private static final Set<String> KNOWN = Set.of(
                "pattern", "patterns", "text", "fasta", "name", "csv",
                "sizes", "gc", "seed", "iterations", "length", "footprint");

        final String command;
        private final Map<String, String> values;

        private CliOptions(String command, Map<String, String> values) {
            this.command = command;
            this.values = values;
        }

        static CliOptions parse(String[] args) {
            if (args.length == 0 || args[0].startsWith("--")) {
                throw new UsageException("Missing command");
            }
            Map<String, String> values = new HashMap<>();
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new UsageException("Unexpected argument " + arg);
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    if (i + 1 >= args.length) {
                        throw new UsageException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                if (!KNOWN.contains(key)) {
                    throw new UsageException("Unknown option --" + key);
                }
                values.put(key, value);
            }
            return new CliOptions(args[0], values);
        }

        boolean has(String key) {
            return values.containsKey(key);
        }

        String get(String key) {
            return values.get(key);
        }

        String getOrDefault(String key, String fallback) {
            return values.getOrDefault(key, fallback);
        }

        int getInt(String key, int fallback) {
            return has(key) ? Integer.parseInt(get(key)) : fallback;
        }

        String require(String key) {
            String value = values.get(key);
            if (value == null) {
                throw new UsageException("Missing required option --" + key);
            }
            return value;
        }

        // Comma-separated values; blanks around commas are dropped, empty items are kept.
        List<String> requireList(String key) {
            return Arrays.stream(require(key).split(",", -1))
                    .map(String::strip)
                    .collect(Collectors.toList());
        }
    }
}
