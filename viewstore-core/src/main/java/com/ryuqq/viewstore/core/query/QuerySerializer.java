package com.ryuqq.viewstore.core.query;

import com.ryuqq.viewstore.core.error.NotSerializableQueryException;

/**
 * Query-string format, pluggable per call.
 *
 * <p>Implementations throw {@link NotSerializableQueryException} for queries wrapping opaque
 * predicates or comparators.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 * @see RqlQuerySerializer
 */
public interface QuerySerializer {

    String serializeFilter(Filter<?> filter);

    String serializeSort(Sort<?> sort);

    String serializeRange(Range<?> range);
}
