package sequences;

// One FASTA entry; the sequence is upper-cased and stripped of line breaks.
public record FastaRecord(String id, String description, String sequence) {

    public int length() {
        return sequence.length();
    }
}
