package utilities;

import automaton.IPatternAutomaton;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

public class MemUtil {

    // Detailed JOL report for a built automaton, optionally including VM details and the class footprint.
    public String jolMemoryReport(boolean includeVmDetails, boolean includeFootprintTable, IPatternAutomaton automaton) {
        return jolMemoryReportWithTotal(includeVmDetails, includeFootprintTable, automaton).report();
    }

    // Walks the automaton's object graph once and returns both the text report and the raw byte count.
    public MemoryUsageReport jolMemoryReportWithTotal(boolean includeVmDetails, boolean includeFootprintTable, IPatternAutomaton automaton) {
        StringBuilder sb = new StringBuilder(4_096);

        if (includeVmDetails) {
            // alignment, header sizes and compressed oops status
            sb.append("=== JOL / VM details ===\n");
            sb.append(VM.current().details()).append('\n');
        }

        GraphLayout total = GraphLayout.parseInstance(automaton);
        String name = automaton.getClass().getSimpleName();
        sb.append("=== ").append(name).append(" total ===\n");
        sb.append("Patterns          : ").append(automaton.patternCount()).append('\n');
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (KiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / 1024.0))
                .append(" KiB\n");
        sb.append("Bytes per pattern : ")
                .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) Math.max(1, automaton.patternCount())))
                .append(" B\n");

        if (includeFootprintTable) {
            // transition tables and child arenas show up as int[]
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }

        DnaLogger.debug("JOL measured " + name + ": " + total.totalSize() + " B");
        return new MemoryUsageReport(name, automaton.patternCount(), total.totalSize(), sb.toString());
    }
}
