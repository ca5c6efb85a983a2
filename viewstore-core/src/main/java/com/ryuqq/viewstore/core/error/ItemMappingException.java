package com.ryuqq.viewstore.core.error;

/**
 * Raised when Jackson cannot convert an item to or from its tree form.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class ItemMappingException extends StoreException {

    public ItemMappingException(String message, Throwable cause) {
        super(ErrorKind.INVALID_ITEM, message, cause);
    }
}
