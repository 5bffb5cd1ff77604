package novt.tools.catalog;

import novt.tools.errors.InvalidInputException;
import novt.tools.geometry.PointRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads source catalogs in '.radec' form: whitespace separated RA, Dec (degrees) and an optional flag,
 * 'P' for primary sources or 'F' for fillers. Columns past the third are ignored.
 * <p>
 * Text is first read with the three column layout; when some row has no flag column, it is read again with two
 * columns and every source is primary.
 **/
public class SourceCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceCatalogLoader.class);

    public SourceCatalog load(Path catalogFile) {
        try {
            return load(Files.readAllLines(catalogFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read catalog " + catalogFile, e);
        }
    }

    public SourceCatalog load(Reader reader) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader buffered = new BufferedReader(reader)) {
            String line;
            while ((line = buffered.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read catalog", e);
        }
        return load(lines);
    }

    public SourceCatalog load(CatalogTable table) {
        List<CatalogEntry> entries = new ArrayList<>(table.size());
        for (int row = 0; row < table.size(); row++) {
            SourceClass classification = table.hasFlag()
                    ? SourceClass.fromFlag(table.flag().get(row))
                    : SourceClass.PRIMARY;
            entries.add(new CatalogEntry(table.ra().get(row), table.dec().get(row), classification));
        }
        return partition(entries);
    }

    SourceCatalog load(List<String> lines) {
        List<String[]> rows = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                rows.add(trimmed.split("\\s+"));
            }
        }

        List<CatalogEntry> entries = parse(rows, 3);
        if (entries == null) {
            // try again with two columns
            entries = parse(rows, 2);
        }
        if (entries == null) {
            throw new InvalidInputException("Catalog rows are malformed: expected 2 or 3 whitespace-delimited "
                    + "columns (ra, dec, flag)");
        }
        return partition(entries);
    }

    /**
     * @return the parsed entries, or null if some row does not fit the layout
     */
    private static List<CatalogEntry> parse(List<String[]> rows, int columns) {
        List<CatalogEntry> entries = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            if (row.length < columns) {
                return null;
            }
            double ra;
            double dec;
            try {
                ra = Double.parseDouble(row[0]);
                dec = Double.parseDouble(row[1]);
            } catch (NumberFormatException e) {
                return null;
            }
            SourceClass classification = columns > 2 ? SourceClass.fromFlag(row[2]) : SourceClass.PRIMARY;
            entries.add(new CatalogEntry(ra, dec, classification));
        }
        return entries;
    }

    private static SourceCatalog partition(List<CatalogEntry> entries) {
        if (entries.isEmpty()) {
            throw new InvalidInputException("Catalog file is empty.");
        }
        List<PointRegion> primary = new ArrayList<>();
        List<PointRegion> filler = new ArrayList<>();
        for (CatalogEntry entry : entries) {
            if (entry.classification() == SourceClass.FILLER) {
                filler.add(entry.toRegion());
            } else {
                primary.add(entry.toRegion());
            }
        }
        log.debug("Catalog: {} primary, {} filler sources", primary.size(), filler.size());
        return new SourceCatalog(primary, filler);
    }

}
