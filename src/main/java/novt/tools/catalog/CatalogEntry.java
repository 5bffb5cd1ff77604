package novt.tools.catalog;

import novt.tools.geometry.PointRegion;

public record CatalogEntry(double ra, double dec, SourceClass classification) {

    public PointRegion toRegion() {
        return new PointRegion(ra, dec);
    }
}
