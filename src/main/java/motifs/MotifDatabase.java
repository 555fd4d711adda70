package motifs;

import utilities.CsvUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of well-known DNA motifs (promoter elements, restriction sites, CpG sites),
 * loaded once from the {@code motifs.csv} classpath resource.
 */
public final class MotifDatabase {

    static final String RESOURCE = "/motifs.csv";

    private static final Map<String, Motif> BY_NAME;
    private static final Map<MotifCategory, Map<String, Motif>> BY_CATEGORY;

    static {
        Map<String, Motif> byName = new LinkedHashMap<>();
        Map<MotifCategory, Map<String, Motif>> byCategory = new EnumMap<>(MotifCategory.class);
        for (MotifCategory category : MotifCategory.values()) {
            byCategory.put(category, new LinkedHashMap<>());
        }
        for (Motif motif : load()) {
            if (byName.putIfAbsent(motif.name(), motif) != null) {
                throw new IllegalStateException("Duplicate motif " + motif.name() + " in " + RESOURCE);
            }
            byCategory.get(motif.category()).put(motif.name(), motif);
        }
        byCategory.replaceAll((category, motifs) -> Collections.unmodifiableMap(motifs));
        BY_NAME = Collections.unmodifiableMap(byName);
        BY_CATEGORY = Collections.unmodifiableMap(byCategory);
    }

    private MotifDatabase() {}

    private static List<Motif> load() {
        try (InputStream in = MotifDatabase.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            List<List<String>> rows = CsvUtil.readRows(in, CsvUtil.Format.defaults());
            List<Motif> motifs = new ArrayList<>(rows.size());
            // first row is the header
            for (int i = 1; i < rows.size(); i++) {
                motifs.add(parse(rows.get(i)));
            }
            return motifs;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    // category,name,sequence,organism,function,position,gc_content,cut_position,overhang,description
    private static Motif parse(List<String> row) {
        if (row.size() != 10) {
            throw new IllegalStateException("Expected 10 columns but got " + row.size() + ": " + row);
        }
        return new Motif(
                row.get(1),
                MotifCategory.fromString(row.get(0)),
                row.get(2),
                row.get(3),
                row.get(4),
                emptyToNull(row.get(5)),
                row.get(6).isEmpty() ? null : Double.valueOf(row.get(6)),
                row.get(7).isEmpty() ? null : Integer.valueOf(row.get(7)),
                emptyToNull(row.get(8)),
                row.get(9));
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }

    public static Optional<String> getMotif(String name) {
        return getMotifInfo(name).map(Motif::sequence);
    }

    public static Optional<Motif> getMotifInfo(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static Map<MotifCategory, Map<String, Motif>> getAllMotifs() {
        return BY_CATEGORY;
    }

    public static List<String> listMotifNames() {
        return List.copyOf(BY_NAME.keySet());
    }

    public static Map<String, Motif> listByCategory(MotifCategory category) {
        return BY_CATEGORY.get(category);
    }

    // Unknown category tokens yield an empty map.
    public static Map<String, Motif> listByCategory(String token) {
        for (MotifCategory category : MotifCategory.values()) {
            if (category.token().equalsIgnoreCase(token)) {
                return BY_CATEGORY.get(category);
            }
        }
        return Map.of();
    }
}
