package com.ryuqq.viewstore.testkit;

import java.util.Objects;

/**
 * Mutable bean item, for checking that callers cannot reach stored state through the
 * instances they pass in or get back.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class MutableItem {

    private String id;
    private int v;

    public MutableItem() {
    }

    public MutableItem(String id, int v) {
        this.id = id;
        this.v = v;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getV() {
        return v;
    }

    public void setV(int v) {
        this.v = v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MutableItem)) {
            return false;
        }
        MutableItem that = (MutableItem) o;
        return v == that.v && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, v);
    }

    @Override
    public String toString() {
        return "MutableItem{id='" + id + "', v=" + v + "}";
    }
}
