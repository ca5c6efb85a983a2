package com.ryuqq.viewstore.core.error;

/**
 * Raised when an item is added under an id the store already holds.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class DuplicateIdException extends StoreException {

    private final String id;

    /**
     * @param id the id already present
     */
    public DuplicateIdException(String id) {
        super(ErrorKind.DUPLICATE_ID, "Item with id '" + id + "' already exists");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
