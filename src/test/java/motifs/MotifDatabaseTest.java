package motifs;

import automaton.BuildListener;
import automaton.SinglePatternAutomaton;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MotifDatabaseTest {

    @Test
    void looksUpSequencesByName() {
        assertEquals(Optional.of("GAATTC"), MotifDatabase.getMotif("EcoRI"));
        assertEquals(Optional.of("TATAAA"), MotifDatabase.getMotif("TATA_BOX"));
        assertEquals(Optional.empty(), MotifDatabase.getMotif("NotI"));
    }

    @Test
    void restrictionSitesCarryCutData() {
        Motif ecoRV = MotifDatabase.getMotifInfo("EcoRV").orElseThrow();
        assertEquals(MotifCategory.RESTRICTIONS, ecoRV.category());
        assertEquals(3, ecoRV.cutPosition());
        assertEquals("blunt", ecoRV.overhang());
        assertNull(ecoRV.gcContent());
        assertNull(ecoRV.position());
    }

    @Test
    void promotersCarryPositionAndGc() {
        Motif tata = MotifDatabase.getMotifInfo("TATA_BOX").orElseThrow();
        assertEquals("Gene promoter (-25 to -30)", tata.position());
        assertEquals(33.33, tata.gcContent(), 1e-9);
        assertNull(tata.cutPosition());
    }

    @Test
    void listsNamesInResourceOrder() {
        List<String> names = MotifDatabase.listMotifNames();
        assertEquals(9, names.size());
        assertEquals("TATA_BOX", names.get(0));
        assertEquals("CpG_DINUCLEOTIDE", names.get(8));
    }

    @Test
    void groupsByCategory() {
        Map<MotifCategory, Map<String, Motif>> all = MotifDatabase.getAllMotifs();
        assertEquals(3, all.size());
        assertEquals(List.of("EcoRI", "BamHI", "PstI", "HindIII", "EcoRV"),
                List.copyOf(MotifDatabase.listByCategory(MotifCategory.RESTRICTIONS).keySet()));
        assertEquals(3, MotifDatabase.listByCategory("promoters").size());
        assertEquals(1, MotifDatabase.listByCategory("CPG_SITES").size());
        assertTrue(MotifDatabase.listByCategory("enhancers").isEmpty());
    }

    @Test
    void tableIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> MotifDatabase.listByCategory(MotifCategory.PROMOTERS).clear());
        assertThrows(UnsupportedOperationException.class, () -> MotifDatabase.listMotifNames().add("X"));
    }

    @Test
    void categoryTokens() {
        assertEquals(MotifCategory.CPG_SITES, MotifCategory.fromString("cpg_sites"));
        assertThrows(IllegalArgumentException.class, () -> MotifCategory.fromString("enhancers"));
    }

    @Test
    void kozakAmbiguityCodeMatchesOnlyWildcard() {
        String kozak = MotifDatabase.getMotif("KOZAK_SEQUENCE").orElseThrow();
        SinglePatternAutomaton dfa = SinglePatternAutomaton.build(kozak, BuildListener.SILENT);
        assertEquals(1, dfa.match("TTGCCNCCATGGTT").size());
        assertTrue(dfa.match("TTGCCACCATGGTT").isEmpty());
    }
}
