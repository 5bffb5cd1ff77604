package novt.tools.catalog;

import java.util.List;

/**
 * Pre-parsed tabular catalog input with named columns. The flag column is optional (null when absent).
 */
public record CatalogTable(List<Double> ra, List<Double> dec, List<String> flag) {

    public CatalogTable {
        if (ra.size() != dec.size()) {
            throw new IllegalArgumentException("Column lengths differ: ra " + ra.size() + ", dec " + dec.size());
        }
        if (flag != null && flag.size() != ra.size()) {
            throw new IllegalArgumentException("Column lengths differ: ra " + ra.size() + ", flag " + flag.size());
        }
    }

    public CatalogTable(List<Double> ra, List<Double> dec) {
        this(ra, dec, null);
    }

    public int size() {
        return ra.size();
    }

    public boolean hasFlag() {
        return flag != null;
    }
}
