package com.phodal.tracebrain.store;

import com.phodal.tracebrain.error.ValidationException;

import java.util.List;

/**
 * An offset window over a filtered, ordered result.
 *
 * @param items the items inside the window
 * @param total number of matching items before the window was applied
 * @param skip offset of the window
 * @param limit maximum window size
 */
public record Page<T>(List<T> items, long total, int skip, int limit) {

    public Page {
        items = List.copyOf(items);
    }

    public static void checkWindow(int skip, int limit, int maxLimit) {
        if (skip < 0) {
            throw new ValidationException("skip must not be negative");
        }
        if (limit < 1 || limit > maxLimit) {
            throw new ValidationException("limit must be within 1.." + maxLimit);
        }
    }

    public static <T> Page<T> of(List<T> ordered, int skip, int limit) {
        int from = Math.min(skip, ordered.size());
        int to = Math.min(ordered.size(), from + limit);
        return new Page<>(ordered.subList(from, to), ordered.size(), skip, limit);
    }
}
