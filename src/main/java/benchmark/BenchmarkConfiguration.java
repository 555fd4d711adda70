package benchmark;

import automaton.BuildListener;

import java.util.List;
import java.util.Objects;

// Immutable knobs for BenchmarkRunner.
public final class BenchmarkConfiguration {

    public static final List<Integer> DEFAULT_SIZES = List.of(1_000, 10_000, 100_000, 1_000_000);

    private final int iterations;
    private final List<Integer> scalabilitySizes;
    private final int scalabilityIterations;
    private final double gcPercentage;
    private final long seed;
    private final BuildListener buildListener;

    private BenchmarkConfiguration(Builder builder) {
        this.iterations = builder.iterations;
        this.scalabilitySizes = List.copyOf(Objects.requireNonNull(builder.scalabilitySizes, "scalabilitySizes"));
        this.scalabilityIterations = builder.scalabilityIterations;
        this.gcPercentage = builder.gcPercentage;
        this.seed = builder.seed;
        this.buildListener = Objects.requireNonNull(builder.buildListener, "buildListener");
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static BenchmarkConfiguration defaults() { return builder().build(); }

    private void validate() {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        if (scalabilityIterations <= 0) {
            throw new IllegalArgumentException("scalabilityIterations must be positive");
        }
        if (scalabilitySizes.isEmpty()) {
            throw new IllegalArgumentException("scalabilitySizes must not be empty");
        }
        for (int size : scalabilitySizes) {
            if (size <= 0) {
                throw new IllegalArgumentException("scalability sizes must be positive, got " + size);
            }
        }
        if (gcPercentage < 0.0 || gcPercentage > 100.0) {
            throw new IllegalArgumentException("gcPercentage must be in [0,100]");
        }
    }

    public int iterations() { return iterations; }
    public List<Integer> scalabilitySizes() { return scalabilitySizes; }
    public int scalabilityIterations() { return scalabilityIterations; }
    public double gcPercentage() { return gcPercentage; }
    public long seed() { return seed; }
    public BuildListener buildListener() { return buildListener; }

    public static final class Builder {
        private int iterations = 3;
        private List<Integer> scalabilitySizes = DEFAULT_SIZES;
        private int scalabilityIterations = 2;
        private double gcPercentage = 50.0;
        private long seed = 42L;
        private BuildListener buildListener = BuildListener.SILENT;

        private Builder() {
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder scalabilitySizes(List<Integer> scalabilitySizes) {
            this.scalabilitySizes = scalabilitySizes;
            return this;
        }

        public Builder scalabilityIterations(int scalabilityIterations) {
            this.scalabilityIterations = scalabilityIterations;
            return this;
        }

        public Builder gcPercentage(double gcPercentage) {
            this.gcPercentage = gcPercentage;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder buildListener(BuildListener buildListener) {
            this.buildListener = buildListener;
            return this;
        }

        public BenchmarkConfiguration build() {
            return new BenchmarkConfiguration(this);
        }
    }
}
