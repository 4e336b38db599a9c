package io.multidex.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Ordering index: field value to entries, kept sorted by the field comparator.
 * Range results list entries in ascending key order; entries sharing a key
 * keep their insertion order.
 *
 * @param <K> the field value type
 * @param <V> the indexed entry type
 */
public final class RangeIndex<K, V> {
    private final ConcurrentSkipListMap<K, List<V>> index;

    public RangeIndex(Comparator<? super K> comparator) {
        this.index = new ConcurrentSkipListMap<>(Objects.requireNonNull(comparator, "comparator"));
    }

    public static <K extends Comparable<? super K>, V> RangeIndex<K, V> natural() {
        return new RangeIndex<>(Comparator.naturalOrder());
    }

    public void add(K key, V entry) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        if (entry == null) {
            throw new IllegalArgumentException("entry required");
        }
        index.compute(key, (ignored, existing) -> {
            List<V> bucket = existing == null ? new ArrayList<>(1) : existing;
            bucket.add(entry);
            return bucket;
        });
    }

    public boolean remove(K key, V entry) {
        if (key == null || entry == null) {
            return false;
        }
        boolean[] removed = new boolean[1];
        index.computeIfPresent(key, (ignored, existing) -> {
            removed[0] = HashIndex.removeByIdentity(existing, entry);
            return existing.isEmpty() ? null : existing;
        });
        return removed[0];
    }

    public List<V> lookup(K key) {
        if (key == null) {
            return List.of();
        }
        var bucket = index.get(key);
        return bucket == null ? List.of() : List.copyOf(bucket);
    }

    public List<V> between(K lowerInclusive, K upperInclusive) {
        if (lowerInclusive == null || upperInclusive == null) {
            return List.of();
        }
        if (index.comparator().compare(lowerInclusive, upperInclusive) > 0) {
            return List.of();
        }
        return collect(index.subMap(lowerInclusive, true, upperInclusive, true));
    }

    public List<V> greaterThan(K value) {
        if (value == null) {
            return List.of();
        }
        return collect(index.tailMap(value, false));
    }

    public List<V> greaterThanOrEqual(K value) {
        if (value == null) {
            return List.of();
        }
        return collect(index.tailMap(value, true));
    }

    public List<V> lessThan(K value) {
        if (value == null) {
            return List.of();
        }
        return collect(index.headMap(value, false));
    }

    public List<V> lessThanOrEqual(K value) {
        if (value == null) {
            return List.of();
        }
        return collect(index.headMap(value, true));
    }

    /**
     * Every entry, ascending.
     */
    public List<V> ascending() {
        return collect(index);
    }

    public List<V> descending() {
        return collect(index.descendingMap());
    }

    public int size() {
        return index.size();
    }

    public void clear() {
        index.clear();
    }

    private List<V> collect(NavigableMap<K, List<V>> map) {
        if (map.isEmpty()) {
            return List.of();
        }
        var expected = 0;
        for (var bucket : map.values()) {
            expected += bucket.size();
        }
        var result = new ArrayList<V>(expected);
        for (var bucket : map.values()) {
            result.addAll(bucket);
        }
        return result;
    }
}
