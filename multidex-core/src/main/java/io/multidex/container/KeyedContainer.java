package io.multidex.container;

import io.multidex.value.ReleaseHook;
import io.multidex.value.TypedCell;
import io.multidex.value.ValueCopier;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * String-keyed container of {@link TypedCell}s.
 * <p>
 * Subclasses supply the backing structure and with it the duplicate-key policy:
 * {@link UniqueFieldMap} keeps one cell per key, {@link MultiFieldMap} keeps any
 * number. Everything else (typed access, in-place update, erase with release)
 * is shared here.
 */
public abstract class KeyedContainer implements Iterable<Map.Entry<String, TypedCell>> {

    /**
     * Insert according to the duplicate policy.
     *
     * @return true if the cell was stored
     */
    protected abstract boolean insert(String key, TypedCell cell);

    /**
     * @return the cells stored under {@code key}, empty if none
     */
    protected abstract List<TypedCell> cells(String key);

    protected abstract void removeKey(String key);

    protected abstract void removeAllEntries();

    /**
     * Number of stored cells.
     */
    public abstract int size();

    public abstract Set<String> keys();

    public <T> boolean add(String key, Class<T> type, T value) {
        return add(key, type, value, ValueCopier.immutable(type), null);
    }

    public <T> boolean add(String key, Class<T> type, T value, ReleaseHook<? super T> releaseHook) {
        return add(key, type, value, ValueCopier.immutable(type), releaseHook);
    }

    public <T> boolean add(String key, Class<T> type, T value, ValueCopier<T> copier, ReleaseHook<? super T> releaseHook) {
        requireKey(key);
        TypedCell cell = new TypedCell();
        cell.set(type, value, copier, releaseHook);
        return insert(key, cell);
    }

    public <T> void set(String key, Class<T> type, T value) {
        set(key, type, value, ValueCopier.immutable(type), null);
    }

    public <T> void set(String key, Class<T> type, T value, ReleaseHook<? super T> releaseHook) {
        set(key, type, value, ValueCopier.immutable(type), releaseHook);
    }

    /**
     * Add the value if the key is absent, otherwise update the existing cell in
     * place. A null {@code releaseHook} keeps the hook already attached.
     */
    public <T> void set(String key, Class<T> type, T value, ValueCopier<T> copier, ReleaseHook<? super T> releaseHook) {
        requireKey(key);
        List<TypedCell> existing = cells(key);
        if (existing.isEmpty()) {
            add(key, type, value, copier, releaseHook);
        } else {
            existing.get(0).update(type, value, copier, releaseHook);
        }
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        if (key == null) {
            return Optional.empty();
        }
        TypedCell cell = select(key, type);
        return cell == null ? Optional.empty() : cell.get(type);
    }

    /**
     * Pick the cell a typed read of {@code key} goes to.
     */
    protected TypedCell select(String key, Class<?> type) {
        List<TypedCell> existing = cells(key);
        return existing.isEmpty() ? null : existing.get(0);
    }

    public boolean has(String key) {
        return key != null && !cells(key).isEmpty();
    }

    /**
     * Run the release hook of every cell under {@code key}, then remove them.
     */
    public void erase(String key) {
        if (key == null) {
            return;
        }
        for (TypedCell cell : cells(key)) {
            cell.releaseCustom();
        }
        removeKey(key);
    }

    /**
     * Remove everything without running release hooks.
     */
    public void clear() {
        removeAllEntries();
    }

    /**
     * Run every release hook, then remove everything.
     */
    public void releaseAll() {
        for (Map.Entry<String, TypedCell> entry : this) {
            entry.getValue().releaseCustom();
        }
        removeAllEntries();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void forEach(BiConsumer<String, TypedCell> action) {
        for (Map.Entry<String, TypedCell> entry : this) {
            action.accept(entry.getKey(), entry.getValue());
        }
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
    }
}
