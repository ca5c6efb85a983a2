package com.ryuqq.viewstore.application.store;

import com.ryuqq.viewstore.core.query.Query;

import java.util.List;

/**
 * Builds the derived views of a root.
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ViewFactory<T> {

    DerivedView<T> create(RootStore<T> root, List<Query<T>> queries);

    static <T> ViewFactory<T> defaultFactory() {
        return DerivedView::new;
    }
}
