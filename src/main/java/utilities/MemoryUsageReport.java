package utilities;

/** JOL measurement of one built automaton together with its printable report. */
public record MemoryUsageReport(String automaton, int patternCount, long totalBytes, String report) {

    public double totalKiB() {
        return totalBytes / 1024.0;
    }

    public double totalMiB() {
        return totalBytes / (1024.0 * 1024.0);
    }
}
