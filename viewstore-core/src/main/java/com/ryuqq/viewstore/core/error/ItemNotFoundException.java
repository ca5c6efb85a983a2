package com.ryuqq.viewstore.core.error;

/**
 * Raised when an operation references an id that is not in the store.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class ItemNotFoundException extends StoreException {

    private final String id;

    /**
     * @param id the absent id
     */
    public ItemNotFoundException(String id) {
        super(ErrorKind.NOT_FOUND, "No item found for id '" + id + "'");
        this.id = id;
    }

    /**
     * @return the absent id
     */
    public String getId() {
        return id;
    }
}
