package sequences;

import alphabet.DnaAlphabet;

import java.util.ArrayList;
import java.util.List;

// Validation and light processing of raw nucleotide strings, applied before text reaches an automaton.
public final class SequenceHandler {
    private SequenceHandler() {}

    // True for a non-empty string made only of A, C, G, T and N in any case.
    public static boolean validateSequence(CharSequence sequence) {
        if (sequence == null || sequence.length() == 0) {
            return false;
        }
        for (int i = 0; i < sequence.length(); i++) {
            if (!DnaAlphabet.isSymbol(sequence.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // Percentage (0-100) of G and C symbols; 0 for an empty sequence.
    public static double calculateGcContent(CharSequence sequence) {
        if (sequence == null || sequence.length() == 0) {
            return 0.0;
        }
        int gc = 0;
        for (int i = 0; i < sequence.length(); i++) {
            int code = DnaAlphabet.code(sequence.charAt(i));
            if (code == DnaAlphabet.G || code == DnaAlphabet.C) {
                gc++;
            }
        }
        return gc * 100.0 / sequence.length();
    }

    // Upper-cased reverse complement; N and non-nucleotide characters are kept as they are.
    public static String reverseComplement(CharSequence sequence) {
        String upper = DnaAlphabet.normalize(sequence);
        StringBuilder sb = new StringBuilder(upper.length());
        for (int i = upper.length() - 1; i >= 0; i--) {
            sb.append(complement(upper.charAt(i)));
        }
        return sb.toString();
    }

    private static char complement(char c) {
        switch (c) {
            case 'A': return 'T';
            case 'T': return 'A';
            case 'G': return 'C';
            case 'C': return 'G';
            default:  return c;
        }
    }

    // Upper-cases and drops every character outside the alphabet.
    public static String cleanSequence(CharSequence sequence) {
        String upper = DnaAlphabet.normalize(sequence);
        StringBuilder sb = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (DnaAlphabet.isSymbol(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static List<String> splitSequence(CharSequence sequence, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        String s = sequence.toString();
        List<String> chunks = new ArrayList<>((s.length() + chunkSize - 1) / chunkSize);
        for (int i = 0; i < s.length(); i += chunkSize) {
            chunks.add(s.substring(i, Math.min(s.length(), i + chunkSize)));
        }
        return chunks;
    }
}
