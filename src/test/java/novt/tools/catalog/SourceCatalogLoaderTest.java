package novt.tools.catalog;

import novt.tools.errors.InvalidInputException;
import novt.tools.geometry.PointRegion;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class SourceCatalogLoaderTest {

    private static final String M51_SOURCES = ""
            + "202.42053  47.17906  F  16.58300\n"
            + "202.42514  47.29251  P  16.69000\n"
            + "202.45114  47.14672  F  16.70300\n"
            + "202.48190  47.19670  F  16.71100\n"
            + "202.43707  47.16641  F  17.20600\n"
            + "202.47760  47.20205  F  17.32900\n"
            + "202.48415  47.24812  P  17.52500\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final SourceCatalogLoader loader = new SourceCatalogLoader();

    @Test
    public void flaggedFileIsSplitByClass() throws IOException {
        SourceCatalog catalog = loader.load(write("sources.radec", M51_SOURCES).toPath());

        assertEquals(2, catalog.primary().size());
        assertEquals(5, catalog.filler().size());
        assertEquals(new PointRegion(202.42514, 47.29251), catalog.primary().get(0));
        assertEquals(new PointRegion(202.48415, 47.24812), catalog.primary().get(1));
        assertEquals(new PointRegion(202.42053, 47.17906), catalog.filler().get(0));
    }

    @Test
    public void twoColumnFileIsAllPrimary() throws IOException {
        StringBuilder text = new StringBuilder();
        for (String line : M51_SOURCES.split("\n")) {
            String[] columns = line.trim().split("\\s+");
            text.append(columns[0]).append(' ').append(columns[1]).append('\n');
        }
        SourceCatalog catalog = loader.load(write("sources.radec", text.toString()).toPath());

        assertEquals(7, catalog.primary().size());
        assertEquals(0, catalog.filler().size());
    }

    @Test
    public void anyFlagButFillerIsPrimary() {
        SourceCatalog catalog = loader.load(new StringReader("10.0 20.0 P\n11.0 21.0 F\n12.0 22.0 X\n13.0 23.0 f\n"));
        assertEquals(3, catalog.primary().size());
        assertEquals(1, catalog.filler().size());
        assertEquals(new PointRegion(11.0, 21.0), catalog.filler().get(0));
    }

    @Test
    public void blankLinesAreSkipped() {
        SourceCatalog catalog = loader.load(new StringReader("\n10.0 20.0 P\n\n   \n11.0 21.0 F\n"));
        assertEquals(1, catalog.primary().size());
        assertEquals(1, catalog.filler().size());
    }

    @Test
    public void rowWithoutFlagMakesTheWholeFileTwoColumn() {
        SourceCatalog catalog = loader.load(new StringReader("10.0 20.0 F\n11.0 21.0\n"));
        assertEquals(2, catalog.primary().size());
        assertEquals(0, catalog.filler().size());
    }

    @Test
    public void emptyFileIsAnInputError() throws IOException {
        File empty = write("empty.radec", "");
        InvalidInputException e = assertThrows(InvalidInputException.class, () -> loader.load(empty.toPath()));
        assertTrue(e.getMessage().contains("empty"));
    }

    @Test
    public void malformedFileIsAnInputError() throws IOException {
        File bad = write("bad.radec", "bad\n");
        InvalidInputException e = assertThrows(InvalidInputException.class, () -> loader.load(bad.toPath()));
        assertTrue(e.getMessage().contains("expected 2"));

        assertThrows(InvalidInputException.class, () -> loader.load(new StringReader("ra dec flag\n1.0 2.0 P\n")));
    }

    @Test
    public void tableWithFlags() {
        CatalogTable table = new CatalogTable(Arrays.asList(1.0, 2.0, 3.0), Arrays.asList(-1.0, -2.0, -3.0),
                Arrays.asList("F", "P", "Q"));
        SourceCatalog catalog = loader.load(table);

        assertEquals(List.of(new PointRegion(2.0, -2.0), new PointRegion(3.0, -3.0)), catalog.primary());
        assertEquals(List.of(new PointRegion(1.0, -1.0)), catalog.filler());
    }

    @Test
    public void tableWithoutFlagsIsAllPrimary() {
        SourceCatalog catalog = loader.load(new CatalogTable(List.of(1.0, 2.0), List.of(3.0, 4.0)));
        assertEquals(2, catalog.primary().size());
        assertEquals(2, catalog.size());
    }

    @Test
    public void emptyTableIsAnInputError() {
        assertThrows(InvalidInputException.class, () -> loader.load(new CatalogTable(List.of(), List.of())));
    }

    @Test
    public void mismatchedColumnsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new CatalogTable(List.of(1.0, 2.0), List.of(3.0), null));
    }

    private File write(String name, String content) throws IOException {
        File file = folder.newFile(name);
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
