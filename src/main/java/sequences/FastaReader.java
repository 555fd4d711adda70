package sequences;

import alphabet.DnaAlphabet;
import utilities.DnaLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Streams records out of a FASTA file.
 *
 * <pre>
 * &gt;seq1 optional description
 * ACGTACGT
 * ACGT
 * </pre>
 *
 * Blank lines and {@code ;} comment lines are ignored. Records whose sequence contains anything
 * other than A, C, G, T or N (or is empty) are skipped with a warning. The reader can be iterated
 * once; reaching the end closes the underlying file.
 */
public class FastaReader implements Iterable<FastaRecord>, AutoCloseable {

    private final Path path;
    private BufferedReader reader;
    private boolean opened;
    private boolean closed;
    private int skipped;

    public FastaReader(Path path) {
        this.path = path;
    }

    // Reads from an already opened source (tests, stdin); the caller's reader is closed with this one.
    public FastaReader(Reader source) {
        this.path = null;
        this.reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        this.opened = true;
    }

    // Convenience: every valid record of the file, in file order.
    public static List<FastaRecord> load(Path path) throws IOException {
        List<FastaRecord> records = new ArrayList<>();
        try (FastaReader fasta = new FastaReader(path)) {
            for (FastaRecord record : fasta) {
                records.add(record);
            }
            DnaLogger.info("Loaded " + records.size() + " sequences from " + path
                    + (fasta.skipped() > 0 ? " (" + fasta.skipped() + " skipped)" : ""));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return records;
    }

    public void open() {
        if (opened) {
            return;
        }
        if (closed) {
            throw new IllegalStateException("FASTA reader already consumed");
        }
        try {
            this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
            this.opened = true;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open FASTA file " + path, e);
        }
    }

    // Number of records rejected so far because of invalid characters.
    public int skipped() {
        return skipped;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        opened = false;
        if (reader != null) {
            try {
                reader.close();
            } finally {
                reader = null;
            }
        }
    }

    @Override
    public Iterator<FastaRecord> iterator() {
        this.open();
        return new RecordIterator();
    }

    private final class RecordIterator implements Iterator<FastaRecord> {

        private String pendingHeader;
        private FastaRecord next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (finished) return false;
            try {
                while (next == null && !finished) {
                    next = readRecord();
                }
            } catch (IOException e) {
                finish();
                throw new UncheckedIOException("Error reading FASTA records", e);
            }
            return next != null;
        }

        @Override
        public FastaRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more FASTA records");
            }
            FastaRecord record = next;
            next = null;
            return record;
        }

        // Returns the next valid record, or null when the current one was skipped or input ended.
        private FastaRecord readRecord() throws IOException {
            String header = pendingHeader;
            pendingHeader = null;
            StringBuilder sequence = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.strip();
                if (line.isEmpty() || line.startsWith(";")) {
                    continue;
                }
                if (line.startsWith(">")) {
                    if (header == null) {
                        header = line.substring(1).strip();
                        continue;
                    }
                    pendingHeader = line.substring(1).strip();
                    break;
                }
                if (header == null) {
                    throw new IllegalStateException("Sequence data before the first '>' header");
                }
                sequence.append(line);
            }
            if (line == null) {
                finish();
            }
            if (header == null) {
                return null;
            }
            return toRecord(header, sequence);
        }

        private FastaRecord toRecord(String header, StringBuilder sequence) {
            int space = indexOfWhitespace(header);
            String id = space < 0 ? header : header.substring(0, space);
            String seq = DnaAlphabet.normalize(sequence);
            if (!SequenceHandler.validateSequence(seq)) {
                skipped++;
                DnaLogger.warning("Skipping " + id + ": contains invalid characters");
                return null;
            }
            DnaLogger.trace("Read FASTA record " + id + " (" + seq.length() + " bp)");
            return new FastaRecord(id, header, seq);
        }

        private void finish() {
            if (!finished) {
                finished = true;
                try {
                    close();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        }
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
