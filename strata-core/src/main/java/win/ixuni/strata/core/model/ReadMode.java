package win.ixuni.strata.core.model;

/**
 * Visibility of soft-deleted records on read paths
 */
public enum ReadMode {

    /**
     * Return only records that are not soft-deleted
     */
    ACTIVE,

    /**
     * Return soft-deleted records as well
     */
    INCLUDE_DELETED
}
