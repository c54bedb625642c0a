package com.al.shopsync.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility for splitting work lists.
 */
public class CollectionUtil {

    private CollectionUtil() {
        // Utility class
    }

    /**
     * Splits {@code items} into consecutive chunks of {@code size}; the last
     * chunk may be smaller.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + size);
        }
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            chunks.add(new ArrayList<>(items.subList(start, Math.min(start + size, items.size()))));
        }
        return chunks;
    }
}
