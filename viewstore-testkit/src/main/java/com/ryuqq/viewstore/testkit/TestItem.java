package com.ryuqq.viewstore.testkit;

/**
 * Item type used by the contract tests.
 *
 * @param id item id (null until assigned)
 * @param v numeric value filtered and sorted on
 * @param name optional label
 * @author ViewStore Team
 * @since 1.0.0
 */
public record TestItem(String id, Integer v, String name) {

    public static TestItem of(String id, int v) {
        return new TestItem(id, v, null);
    }
}
