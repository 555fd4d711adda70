package utilities;

import automaton.BuildListener;
import automaton.MultiPatternAutomaton;
import automaton.SinglePatternAutomaton;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemUtilTest {

    @Test
    void reportsFootprintOfBothAutomata() {
        MemUtil mem = new MemUtil();
        String dfa = mem.jolMemoryReport(false, true, SinglePatternAutomaton.build("GAATTC", BuildListener.SILENT));
        assertTrue(dfa.contains("SinglePatternAutomaton total"));
        assertTrue(dfa.contains("Class footprint"));

        MemoryUsageReport ac = mem.jolMemoryReportWithTotal(false, false,
                MultiPatternAutomaton.build(List.of("GAATTC", "GGATCC"), BuildListener.SILENT));
        assertTrue(ac.report().contains("Patterns          : 2"));
        assertEquals("MultiPatternAutomaton", ac.automaton());
        assertEquals(2, ac.patternCount());
        assertTrue(ac.totalBytes() > 0);
        assertEquals(ac.totalBytes() / 1024.0, ac.totalKiB(), 1e-9);
    }
}
