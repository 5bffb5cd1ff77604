package novt.tools.catalog;

import novt.tools.geometry.PointRegion;

import java.util.List;

/**
 * Catalog sources as point regions, grouped by classification. Input order is kept within each group.
 */
public record SourceCatalog(List<PointRegion> primary, List<PointRegion> filler) {

    public SourceCatalog {
        primary = List.copyOf(primary);
        filler = List.copyOf(filler);
    }

    public int size() {
        return primary.size() + filler.size();
    }
}
