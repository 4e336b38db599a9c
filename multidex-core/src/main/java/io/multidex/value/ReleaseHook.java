package io.multidex.value;

/**
 * Frees an external resource owned by a stored value.
 * <p>
 * Invoked at most once per attachment, and only by an explicit release
 * ({@link TypedCell#releaseCustom()}, a container erase or teardown), never
 * when the value is overwritten or the cell is dropped. Implementations must
 * not throw.
 *
 * @param <T> the stored value type
 */
@FunctionalInterface
public interface ReleaseHook<T> {

    void release(T value);
}
