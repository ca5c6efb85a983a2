package com.ryuqq.viewstore.core.error;

/**
 * Raised when a patch operation targets a path that does not exist in the document.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class PatchApplicationException extends StoreException {

    public PatchApplicationException(String message) {
        super(ErrorKind.PATCH_CONFLICT, message);
    }
}
