package me.christianrobert.pyunparse.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Constructor helpers shared by the node classes.
 *
 * <p>Node constructors reject invalid field combinations with {@link IllegalArgumentException},
 * so a tree that exists is a tree the generator can render.</p>
 */
public final class NodeSupport {

    private NodeSupport() {
    }

    /**
     * Rejects a null required field.
     *
     * @param value Field value
     * @param description Field description used in the error message (e.g. "If test")
     * @return The value
     */
    public static <T> T require(T value, String description) {
        if (value == null) {
            throw new IllegalArgumentException(description + " cannot be null");
        }
        return value;
    }

    /**
     * Rejects a null or blank identifier.
     */
    public static String requireIdentifier(String value, String description) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(description + " cannot be null or empty");
        }
        return value;
    }

    /**
     * Copies a list into an unmodifiable list. A null list becomes empty, null elements are rejected.
     */
    public static <T> List<T> copyOf(List<? extends T> items, String description) {
        if (items == null) {
            return List.of();
        }
        for (T item : items) {
            if (item == null) {
                throw new IllegalArgumentException(description + " cannot contain null elements");
            }
        }
        return List.copyOf(items);
    }

    /**
     * Copies a list whose elements may legitimately be null (dict keys, keyword-only defaults).
     */
    public static <T> List<T> copyOfNullable(List<? extends T> items) {
        if (items == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * Copies a list that must contain at least one element.
     */
    public static <T> List<T> copyOfNonEmpty(List<? extends T> items, String description) {
        List<T> copy = copyOf(items, description);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException(description + " cannot be empty");
        }
        return copy;
    }
}
