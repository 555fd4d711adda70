package utilities;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Minimal RFC 4180 style CSV support: match exports, benchmark points and the bundled motif table.
 * Quoted fields may contain delimiters and doubled quotes but not line breaks when reading.
 */
public class CsvUtil {
    private CsvUtil() {}

    public record Format(char delimiter, char quote, String lineSeparator, boolean alwaysQuote, Charset charset) {

        public Format {
            Objects.requireNonNull(lineSeparator, "lineSeparator");
            Objects.requireNonNull(charset, "charset");
            if (delimiter == quote) {
                throw new IllegalArgumentException("delimiter and quote must differ");
            }
        }

        // comma, double quote, platform line separator, quote on demand, UTF-8
        public static Format defaults() {
            return new Format(',', '"', System.lineSeparator(), false, StandardCharsets.UTF_8);
        }

        public Format withDelimiter(char d) {
            return new Format(d, quote, lineSeparator, alwaysQuote, charset);
        }

        public Format withLineSeparator(String ls) {
            return new Format(delimiter, quote, ls, alwaysQuote, charset);
        }

        public Format withAlwaysQuote(boolean aq) {
            return new Format(delimiter, quote, lineSeparator, aq, charset);
        }
    }

    public static void writeRows(Path file, List<? extends List<?>> rows) throws IOException {
        writeRows(file, rows, Format.defaults());
    }

    public static void writeRows(Path file, List<? extends List<?>> rows, Format format) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, format.charset())) {
            writeRows(out, rows, format);
        }
    }

    // Every row is terminated by the line separator; the writer stays open.
    public static void writeRows(Writer out, List<? extends List<?>> rows, Format format) throws IOException {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(format, "format");
        StringBuilder line = new StringBuilder();
        for (List<?> row : Objects.requireNonNull(rows, "rows")) {
            line.setLength(0);
            appendRow(line, row, format);
            out.write(line.append(format.lineSeparator()).toString());
        }
        out.flush();
    }

    public static String toCsvLine(List<?> row) {
        return toCsvLine(row, Format.defaults());
    }

    public static String toCsvLine(List<?> row, Format format) {
        StringBuilder line = new StringBuilder();
        appendRow(line, row, format);
        return line.toString();
    }

    // Rows joined by the default line separator, without a trailing one.
    public static String toCsv(List<? extends List<?>> rows) {
        Format format = Format.defaults();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) {
                sb.append(format.lineSeparator());
            }
            appendRow(sb, rows.get(i), format);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<?> row, Format format) {
        Objects.requireNonNull(row, "row");
        boolean first = true;
        for (Object value : row) {
            if (!first) {
                sb.append(format.delimiter());
            }
            first = false;
            appendField(sb, value == null ? "" : String.valueOf(value), format);
        }
    }

    private static void appendField(StringBuilder sb, String field, Format format) {
        boolean quoted = format.alwaysQuote();
        for (int i = 0; i < field.length() && !quoted; i++) {
            char c = field.charAt(i);
            quoted = c == format.delimiter() || c == format.quote() || c == '\n' || c == '\r';
        }
        if (!quoted) {
            sb.append(field);
            return;
        }
        sb.append(format.quote());
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == format.quote()) {
                sb.append(c);
            }
            sb.append(c);
        }
        sb.append(format.quote());
    }

    // Every non-blank line becomes a row.
    public static List<List<String>> readRows(InputStream in, Format format) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, format.charset()))) {
            String line;
            while ((line = br.readLine()) != null) {
                if (!line.isBlank()) {
                    rows.add(parseLine(line, format));
                }
            }
        }
        return rows;
    }

    public static List<String> parseLine(String line) {
        return parseLine(line, Format.defaults());
    }

    public static List<String> parseLine(String line, Format format) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c != format.quote()) {
                    field.append(c);
                } else if (i + 1 < line.length() && line.charAt(i + 1) == format.quote()) {
                    field.append(c);
                    i++;
                } else {
                    inQuotes = false;
                }
            } else if (c == format.quote()) {
                inQuotes = true;
            } else if (c == format.delimiter()) {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        if (inQuotes) {
            throw new IllegalArgumentException("Unterminated quoted field in: " + line);
        }
        fields.add(field.toString());
        return fields;
    }
}
