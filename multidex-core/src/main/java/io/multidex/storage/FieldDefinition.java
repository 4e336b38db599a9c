package io.multidex.storage;

import io.multidex.value.ValueCopier;

import java.util.Comparator;

/**
 * Declaration of one field: its name, its type (fixed for the lifetime of the
 * storage), the default every new record starts with, the order used by the
 * ordering index, and the copy routine for its values.
 *
 * @param <T> the field type
 */
public record FieldDefinition<T>(String name,
                                 Class<T> type,
                                 T defaultValue,
                                 Comparator<? super T> comparator,
                                 ValueCopier<T> copier) {

    public FieldDefinition {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (type.isArray()) {
            throw new IllegalArgumentException("array types cannot be used as field type: " + type.getTypeName());
        }
        if (defaultValue == null) {
            throw new IllegalArgumentException("defaultValue required for field " + name);
        }
        if (typeOf(defaultValue) != type) {
            throw new IllegalArgumentException("default of field " + name + " is a "
                    + defaultValue.getClass().getName() + ", not a " + type.getName());
        }
        if (comparator == null) {
            throw new IllegalArgumentException("comparator required for field " + name);
        }
        if (copier == null) {
            throw new IllegalArgumentException("copier required for field " + name);
        }
        if (copier == ValueCopier.<T>identity() && !ValueCopier.isImmutable(type)) {
            throw new IllegalArgumentException("field " + name + " of " + type.getName()
                    + " cannot share its values; declare it with a ValueCopier");
        }
    }

    /**
     * Field of an immutable type (see {@link ValueCopier#isImmutable(Class)}),
     * ordered by the natural order of its values.
     */
    public static <T extends Comparable<? super T>> FieldDefinition<T> of(String name, T defaultValue) {
        return of(name, defaultValue, Comparator.naturalOrder());
    }

    public static <T> FieldDefinition<T> of(String name, T defaultValue, Comparator<? super T> comparator) {
        if (defaultValue == null) {
            throw new IllegalArgumentException("defaultValue required for field " + name);
        }
        Class<T> type = typeOf(defaultValue);
        if (!ValueCopier.isImmutable(type)) {
            throw new IllegalArgumentException("field " + name + " of " + type.getName()
                    + " cannot share its values; declare it with a ValueCopier");
        }
        return new FieldDefinition<>(name, type, defaultValue, comparator, ValueCopier.identity());
    }

    /**
     * Field ordered by the natural order of its values, every value stored
     * and read through {@code copier}.
     */
    public static <T extends Comparable<? super T>> FieldDefinition<T> of(String name, T defaultValue,
                                                                           ValueCopier<T> copier) {
        return of(name, defaultValue, Comparator.naturalOrder(), copier);
    }

    public static <T> FieldDefinition<T> of(String name, T defaultValue, Comparator<? super T> comparator,
                                            ValueCopier<T> copier) {
        if (defaultValue == null) {
            throw new IllegalArgumentException("defaultValue required for field " + name);
        }
        return new FieldDefinition<>(name, typeOf(defaultValue), defaultValue, comparator, copier);
    }

    /**
     * Whether {@code value} has exactly this field's type.
     */
    public boolean accepts(Object value) {
        return value != null && typeOf(value) == type;
    }

    T cast(Object value) {
        return type.cast(value);
    }

    /**
     * Runtime type of a field value. Enum constants with a body report their
     * enum class rather than the anonymous subclass.
     */
    @SuppressWarnings("unchecked")
    static <T> Class<T> typeOf(T value) {
        if (value instanceof Enum<?> constant) {
            return (Class<T>) constant.getDeclaringClass();
        }
        return (Class<T>) value.getClass();
    }
}
