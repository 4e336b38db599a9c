package io.multidex.value;

import io.multidex.core.MultidexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds one value of any type behind a uniform handle.
 * <p>
 * The stored {@link Class} is the type witness: a read succeeds only when the
 * requested class is identical to it. Subtypes and supertypes do not match.
 * <p>
 * Ownership has two phases. The cell always drops its own value on
 * {@link #clear()} or overwrite; an optional {@link ReleaseHook} for an external
 * resource runs only through {@link #releaseCustom()}, and at most once.
 */
public final class TypedCell {
    private static final Logger log = LoggerFactory.getLogger(TypedCell.class);

    // type == null <=> value == null
    private Class<?> type;
    private Object value;
    private ValueCopier<Object> copier;
    private ReleaseHook<Object> releaseHook;

    public TypedCell() {
    }

    public static <T> TypedCell of(Class<T> type, T value) {
        TypedCell cell = new TypedCell();
        cell.set(type, value);
        return cell;
    }

    public static <T> TypedCell of(Class<T> type, T value, ReleaseHook<? super T> releaseHook) {
        TypedCell cell = new TypedCell();
        cell.set(type, value, releaseHook);
        return cell;
    }

    /**
     * Store {@code value} of an immutable type; see {@link ValueCopier#immutable(Class)}.
     */
    public <T> void set(Class<T> type, T value) {
        set(type, value, (ReleaseHook<? super T>) null);
    }

    public <T> void set(Class<T> type, T value, ReleaseHook<? super T> releaseHook) {
        checkStorable(type, value);
        set(type, value, ValueCopier.immutable(type), releaseHook);
    }

    /**
     * Store a copy of {@code value} produced by {@code copier}, replacing the
     * previous value and hook. The replaced hook is not invoked.
     */
    @SuppressWarnings("unchecked")
    public <T> void set(Class<T> type, T value, ValueCopier<T> copier, ReleaseHook<? super T> releaseHook) {
        checkStorable(type, value);
        if (copier == null) {
            throw new IllegalArgumentException("copier required");
        }
        T copy = copier.copy(value);
        this.type = type;
        this.value = copy;
        this.copier = (ValueCopier<Object>) (ValueCopier<?>) copier;
        this.releaseHook = (ReleaseHook<Object>) (ReleaseHook<?>) releaseHook;
    }

    /**
     * Like {@link #set(Class, Object, ValueCopier, ReleaseHook)} but keeps the
     * current release hook when {@code releaseHook} is null.
     */
    public <T> void update(Class<T> type, T value, ValueCopier<T> copier, ReleaseHook<? super T> releaseHook) {
        ReleaseHook<Object> kept = this.releaseHook;
        set(type, value, copier, releaseHook);
        if (releaseHook == null) {
            this.releaseHook = kept;
        }
    }

    /**
     * Read a copy of the stored value.
     *
     * @return the value, or empty when the cell is empty or {@code requested}
     * is not the stored type (a mismatch is logged)
     */
    public <T> Optional<T> get(Class<T> requested) {
        Objects.requireNonNull(requested, "requested");
        if (type != null && type != requested) {
            log.warn("Type mismatch: cell holds {} but {} was requested", type.getName(), requested.getName());
            return Optional.empty();
        }
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(requested.cast(copier.copy(value)));
    }

    public boolean matches(Class<?> requested) {
        return type != null && type == requested;
    }

    /**
     * @return the stored type, or null for an empty cell
     */
    public Class<?> type() {
        return type;
    }

    public boolean isEmpty() {
        return value == null;
    }

    public boolean hasReleaseHook() {
        return releaseHook != null;
    }

    /**
     * Deep copy through the copier captured at store time. The copy shares the
     * release hook, so only one of the two should be released.
     */
    public TypedCell copy() {
        TypedCell cell = new TypedCell();
        if (value != null) {
            cell.type = type;
            cell.value = copier.copy(value);
            cell.copier = copier;
            cell.releaseHook = releaseHook;
        }
        return cell;
    }

    /**
     * Invoke the release hook, if any, and detach it. Calling again is a no-op.
     *
     * @throws MultidexException if the hook throws
     */
    public void releaseCustom() {
        ReleaseHook<Object> hook = releaseHook;
        if (hook == null) {
            return;
        }
        releaseHook = null;
        try {
            hook.release(value);
        } catch (RuntimeException e) {
            throw new MultidexException("Release hook failed for value of type " + type.getName(), e);
        }
    }

    /**
     * Drop the value and its type without running the release hook.
     */
    public void clear() {
        type = null;
        value = null;
        copier = null;
        releaseHook = null;
    }

    private static void checkStorable(Class<?> type, Object value) {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        if (type.isArray()) {
            throw new IllegalArgumentException("array types cannot be stored: " + type.getTypeName());
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("value of " + value.getClass().getName()
                    + " is not a " + type.getName());
        }
    }

    @Override
    public String toString() {
        return type == null ? "TypedCell{empty}" : "TypedCell{" + type.getSimpleName() + "=" + value + "}";
    }
}
