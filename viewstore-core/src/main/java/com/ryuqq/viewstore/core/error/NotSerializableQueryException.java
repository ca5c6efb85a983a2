package com.ryuqq.viewstore.core.error;

/**
 * Raised when a query built from an opaque function is asked for its query-string form.
 *
 * <p>Part of the query contract: remote storages rely on it to detect queries they
 * cannot forward.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class NotSerializableQueryException extends StoreException {

    public NotSerializableQueryException(String message) {
        super(ErrorKind.NOT_SERIALIZABLE, message);
    }
}
