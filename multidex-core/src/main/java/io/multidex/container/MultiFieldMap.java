package io.multidex.container;

import io.multidex.value.TypedCell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Any number of cells per key; {@code add} always inserts.
 * <p>
 * A typed {@code get} returns the first cell under the key whose type matches,
 * so cells of different types can share a key and still be told apart.
 */
public final class MultiFieldMap extends KeyedContainer {
    private final Map<String, List<TypedCell>> cells = new HashMap<>();
    private int size;

    @Override
    protected boolean insert(String key, TypedCell cell) {
        cells.computeIfAbsent(key, ignored -> new ArrayList<>(2)).add(cell);
        size++;
        return true;
    }

    @Override
    protected List<TypedCell> cells(String key) {
        List<TypedCell> bucket = cells.get(key);
        return bucket == null ? List.of() : bucket;
    }

    @Override
    protected TypedCell select(String key, Class<?> type) {
        List<TypedCell> bucket = cells(key);
        for (TypedCell cell : bucket) {
            if (cell.matches(type)) {
                return cell;
            }
        }
        return bucket.isEmpty() ? null : bucket.get(0);
    }

    @Override
    protected void removeKey(String key) {
        List<TypedCell> removed = cells.remove(key);
        if (removed != null) {
            size -= removed.size();
        }
    }

    @Override
    protected void removeAllEntries() {
        cells.clear();
        size = 0;
    }

    /**
     * All cells stored under {@code key}, in insertion order.
     */
    public List<TypedCell> getAll(String key) {
        if (key == null) {
            return List.of();
        }
        return Collections.unmodifiableList(cells(key));
    }

    public int count(String key) {
        return key == null ? 0 : cells(key).size();
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    @Override
    public Iterator<Map.Entry<String, TypedCell>> iterator() {
        List<Map.Entry<String, TypedCell>> entries = new ArrayList<>(size);
        for (Map.Entry<String, List<TypedCell>> bucket : cells.entrySet()) {
            for (TypedCell cell : bucket.getValue()) {
                entries.add(Map.entry(bucket.getKey(), cell));
            }
        }
        return entries.iterator();
    }

    @Override
    public String toString() {
        return "MultiFieldMap" + cells;
    }
}
