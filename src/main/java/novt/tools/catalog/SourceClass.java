package novt.tools.catalog;

/**
 * Classification of catalog sources, from the flag column.
 */
public enum SourceClass {

    PRIMARY("P"),
    FILLER("F");

    private final String flag;

    SourceClass(String flag) {
        this.flag = flag;
    }

    /**
     * Only an explicit filler flag makes a filler; every other value, missing ones included, is primary
     **/
    public static SourceClass fromFlag(String flag) {
        return FILLER.flag.equals(flag == null ? null : flag.trim()) ? FILLER : PRIMARY;
    }
}
