package io.multidex.container;

import io.multidex.value.TypedCell;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One cell per key; {@code add} of an existing key is ignored.
 */
public final class UniqueFieldMap extends KeyedContainer {
    private final Map<String, TypedCell> cells;

    public UniqueFieldMap() {
        this.cells = new HashMap<>();
    }

    private UniqueFieldMap(int expectedSize) {
        this.cells = new HashMap<>(Math.max(16, expectedSize * 2));
    }

    @Override
    protected boolean insert(String key, TypedCell cell) {
        return cells.putIfAbsent(key, cell) == null;
    }

    @Override
    protected List<TypedCell> cells(String key) {
        TypedCell cell = cells.get(key);
        return cell == null ? List.of() : List.of(cell);
    }

    @Override
    protected void removeKey(String key) {
        cells.remove(key);
    }

    @Override
    protected void removeAllEntries() {
        cells.clear();
    }

    @Override
    public int size() {
        return cells.size();
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    /**
     * Deep copy: every cell is copied through its own copier.
     */
    public UniqueFieldMap copy() {
        UniqueFieldMap copy = new UniqueFieldMap(cells.size());
        for (Map.Entry<String, TypedCell> entry : cells.entrySet()) {
            copy.cells.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    @Override
    public Iterator<Map.Entry<String, TypedCell>> iterator() {
        return Collections.unmodifiableMap(cells).entrySet().iterator();
    }

    @Override
    public String toString() {
        return "UniqueFieldMap" + cells;
    }
}
