package com.climate.quality.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 行索引集合的不可变拷贝工具，供各报告类共用
 */
final class IndexSets {

    private IndexSets() {}

    static SortedSet<Integer> copyOf(Collection<Integer> indices) {
        if (indices == null || indices.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(indices));
    }

    static Map<String, SortedSet<Integer>> copyOf(Map<String, ? extends Collection<Integer>> byColumn) {
        if (byColumn == null || byColumn.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, SortedSet<Integer>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<Integer>> entry : byColumn.entrySet()) {
            copy.put(entry.getKey(), copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    static int total(Map<String, SortedSet<Integer>> byColumn) {
        int total = 0;
        for (SortedSet<Integer> indices : byColumn.values()) {
            total += indices.size();
        }
        return total;
    }
}
