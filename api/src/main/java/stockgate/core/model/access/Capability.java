package stockgate.core.model.access;

/**
 * Operations gated by role outside of page navigation.
 */
public enum Capability {
    /** Create, update or delete catalog, stock and master data. */
    MUTATE_RECORDS,
    /** Change the status of an existing sale. */
    EDIT_SALE_STATUS,
    /** Cancel a sale. */
    CANCEL_SALE,
    /** Delete a sale. */
    DELETE_SALE
}
