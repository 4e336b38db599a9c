package io.multidex.index;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Equality index: field value to the entries currently holding it.
 * <p>
 * Buckets are multi-valued; the same key may map to many entries. Entries are
 * matched by identity on removal, never by {@code equals}.
 *
 * @param <K> the field value type
 * @param <V> the indexed entry type
 */
public final class HashIndex<K, V> {
    private final ConcurrentHashMap<K, List<V>> index = new ConcurrentHashMap<>();

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

    /**
     * Remove one occurrence of {@code entry} from the bucket of {@code key}.
     *
     * @return true if the entry was found
     */
    public boolean remove(K key, V entry) {
        if (key == null || entry == null) {
            return false;
        }
        boolean[] removed = new boolean[1];
        index.computeIfPresent(key, (ignored, existing) -> {
            removed[0] = removeByIdentity(existing, entry);
            return existing.isEmpty() ? null : existing;
        });
        return removed[0];
    }

    /**
     * Drop every bucket.
     */
    public void clear() {
        index.clear();
    }

    public List<V> lookup(K key) {
        if (key == null) {
            return List.of();
        }
        List<V> bucket = index.get(key);
        return bucket == null ? List.of() : List.copyOf(bucket);
    }

    public Optional<V> first(K key) {
        if (key == null) {
            return Optional.empty();
        }
        List<V> bucket = index.get(key);
        return bucket == null || bucket.isEmpty() ? Optional.empty() : Optional.of(bucket.get(0));
    }

    /**
     * Number of distinct keys.
     */
    public int size() {
        return index.size();
    }

    static <V> boolean removeByIdentity(List<V> bucket, V entry) {
        Iterator<V> it = bucket.iterator();
        while (it.hasNext()) {
            if (it.next() == entry) {
                it.remove();
                return true;
            }
        }
        return false;
    }
}
