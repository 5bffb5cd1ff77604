package novt.tools.footprint;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import novt.tools.errors.UnknownDitherPatternException;
import novt.tools.math.TelCoordinate;
import novt.tools.utilities.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dither offsets by pattern name, in telescope coordinates. Offsets follow the dither table convention:
 * V2 offsets are subtracted from the pointing center, V3 offsets are added.
 **/
public class DitherPatternTable {

    private static final Logger log = LoggerFactory.getLogger(DitherPatternTable.class);

    public static final String NO_DITHER = "NONE";

    private final Map<String, List<TelCoordinate>> patterns;
    private final Set<String> noMosaic;

    public DitherPatternTable(Map<String, List<TelCoordinate>> patterns, Set<String> noMosaic) {
        Map<String, List<TelCoordinate>> copy = new LinkedHashMap<>();
        patterns.forEach((name, offsets) -> {
            if (!name.equals(name.toUpperCase(Locale.ROOT))) {
                throw new IllegalStateException("Dither pattern names must be upper case: " + name);
            }
            if (offsets == null || offsets.isEmpty()) {
                throw new IllegalStateException("Dither pattern " + name + " has no offsets");
            }
            copy.put(name, List.copyOf(offsets));
        });
        if (!copy.containsKey(NO_DITHER)) {
            throw new IllegalStateException("Dither table must define " + NO_DITHER);
        }
        if (!copy.get(NO_DITHER).equals(List.of(TelCoordinate.ZERO))) {
            throw new IllegalStateException(NO_DITHER + " must hold a single zero offset");
        }
        if (!copy.keySet().containsAll(noMosaic)) {
            throw new IllegalStateException("Mosaic exclusions name unknown patterns: " + noMosaic);
        }
        this.patterns = Collections.unmodifiableMap(copy);
        this.noMosaic = Collections.unmodifiableSet(new LinkedHashSet<>(noMosaic));
    }

    public static DitherPatternTable load(String location) {
        try (Reader reader = FileUtils.openReader(location)) {
            DitherPatternTable table = fromJson(reader);
            log.info("Loaded dither patterns {} from {}", table.names(), location);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read dither table " + location, e);
        }
    }

    static DitherPatternTable fromJson(Reader reader) {
        TableFile file;
        try {
            file = new Gson().fromJson(reader, TableFile.class);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Malformed dither table: " + e.getMessage(), e);
        }
        if (file == null || file.patterns == null) {
            throw new IllegalStateException("Dither table has no patterns");
        }
        Map<String, List<TelCoordinate>> patterns = new LinkedHashMap<>();
        Set<String> noMosaic = new LinkedHashSet<>();
        for (PatternEntry entry : file.patterns) {
            List<TelCoordinate> offsets = new ArrayList<>();
            if (entry.offsets != null) {
                entry.offsets.forEach(pair -> offsets.add(new TelCoordinate(pair[0], pair[1])));
            }
            patterns.put(entry.name, offsets);
            if (!entry.mosaic) {
                noMosaic.add(entry.name);
            }
        }
        return new DitherPatternTable(patterns, noMosaic);
    }

    /**
     * Normalizes a pattern name (trimmed, upper case) and checks that the table knows it
     *
     * @throws UnknownDitherPatternException if the pattern is not in the table
     **/
    public String resolve(String pattern) {
        String key = pattern == null ? "" : pattern.trim().toUpperCase(Locale.ROOT);
        if (!patterns.containsKey(key)) {
            throw new UnknownDitherPatternException(pattern, patterns.keySet());
        }
        return key;
    }

    public List<TelCoordinate> offsets(String pattern) {
        return patterns.get(resolve(pattern));
    }

    public boolean allowsMosaic(String pattern) {
        return !noMosaic.contains(resolve(pattern));
    }

    public List<String> names() {
        return new ArrayList<>(patterns.keySet());
    }

    /* Gson binding of the JSON layout */
    private static class TableFile {
        List<PatternEntry> patterns;
    }

    private static class PatternEntry {
        String name;
        boolean mosaic = true;
        List<double[]> offsets;
    }

}
