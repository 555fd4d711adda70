package sequences;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FastaReaderTest {

    private static final String FASTA = String.join("\n",
            ";exported by a test",
            ">seq1 first gene",
            "ACGT",
            "acgn",
            "",
            ">seq2 broken",
            "ACGX",
            ">empty",
            ">seq3",
            "TTTT",
            "");

    private static List<FastaRecord> readAll(FastaReader reader) {
        List<FastaRecord> records = new ArrayList<>();
        for (FastaRecord record : reader) {
            records.add(record);
        }
        return records;
    }

    @Test
    void readsMultiLineRecordsAndSkipsInvalidOnes() throws IOException {
        try (FastaReader reader = new FastaReader(new StringReader(FASTA))) {
            List<FastaRecord> records = readAll(reader);
            assertEquals(List.of(
                    new FastaRecord("seq1", "seq1 first gene", "ACGTACGN"),
                    new FastaRecord("seq3", "seq3", "TTTT")), records);
            assertEquals(8, records.get(0).length());
            assertEquals(2, reader.skipped());
        }
    }

    @Test
    void sequenceBeforeHeaderIsRejected() throws IOException {
        try (FastaReader reader = new FastaReader(new StringReader("ACGT\n>seq\nACGT\n"))) {
            Iterator<FastaRecord> it = reader.iterator();
            assertThrows(IllegalStateException.class, it::hasNext);
        }
    }

    @Test
    void emptyInputHasNoRecords() throws IOException {
        try (FastaReader reader = new FastaReader(new StringReader(""))) {
            assertFalse(reader.iterator().hasNext());
        }
    }

    @Test
    void loadsFile(@TempDir Path dir) throws IOException {
        Path fasta = dir.resolve("genes.fa");
        Files.writeString(fasta, FASTA, StandardCharsets.UTF_8);
        List<FastaRecord> records = FastaReader.load(fasta);
        assertEquals(2, records.size());
        assertEquals("seq1", records.get(0).id());
    }

    @Test
    void missingFileFailsWithIOException(@TempDir Path dir) {
        assertThrows(IOException.class, () -> FastaReader.load(dir.resolve("missing.fa")));
    }
}
