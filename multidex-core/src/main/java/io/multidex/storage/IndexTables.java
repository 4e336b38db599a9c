package io.multidex.storage;

import io.multidex.container.MultiFieldMap;
import io.multidex.index.HashIndex;
import io.multidex.index.RangeIndex;
import io.multidex.value.ValueCopier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Equality and ordering index of every declared field.
 * <p>
 * Both tables of a field live under the field name in one {@link MultiFieldMap},
 * told apart by their type. Each is added with a release hook that empties it,
 * so {@link #release()} tears all of them down through the container.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
final class IndexTables {
    private static final Logger log = LoggerFactory.getLogger(IndexTables.class);

    private final MultiFieldMap tables = new MultiFieldMap();

    <T> void allocate(FieldDefinition<T> definition) {
        HashIndex<Object, StoredRecord> equality = new HashIndex<>();
        RangeIndex<Object, StoredRecord> ordering =
                new RangeIndex<>((Comparator<Object>) (Comparator<?>) definition.comparator());
        // Tables are shared handles, not values: stored without copying.
        tables.add(definition.name(), HashIndex.class, equality, ValueCopier.identity(), HashIndex::clear);
        tables.add(definition.name(), RangeIndex.class, ordering, ValueCopier.identity(), RangeIndex::clear);
    }

    boolean has(String field) {
        return tables.has(field);
    }

    void insert(String field, Object value, StoredRecord record) {
        equality(field).add(value, record);
        ordering(field).add(value, record);
    }

    /**
     * @return false if either table did not hold {@code record} under
     * {@code value}; the miss is logged
     */
    boolean remove(String field, Object value, StoredRecord record) {
        boolean fromEquality = equality(field).remove(value, record);
        boolean fromOrdering = ordering(field).remove(value, record);
        if (!fromEquality || !fromOrdering) {
            log.warn("Record {} was not indexed under {}={} (equality: {}, ordering: {})",
                    record.id().value(), field, value, fromEquality, fromOrdering);
            return false;
        }
        return true;
    }

    /**
     * Move {@code record} from {@code oldValue} to {@code newValue} in both
     * tables of the field. A null {@code oldValue} means the record was not
     * indexed under this field yet.
     */
    void reindex(String field, Object oldValue, Object newValue, StoredRecord record) {
        if (oldValue != null) {
            remove(field, oldValue, record);
        }
        equality(field).add(newValue, record);
        ordering(field).add(newValue, record);
    }

    Optional<StoredRecord> first(String field, Object value) {
        return equality(field).first(value);
    }

    List<StoredRecord> all(String field, Object value) {
        return equality(field).lookup(value);
    }

    RangeIndex<Object, StoredRecord> ordering(String field) {
        return tables.get(field, RangeIndex.class)
                .orElseThrow(() -> new IllegalStateException("no ordering index for field " + field));
    }

    HashIndex<Object, StoredRecord> equality(String field) {
        return tables.get(field, HashIndex.class)
                .orElseThrow(() -> new IllegalStateException("no equality index for field " + field));
    }

    /**
     * Run the release hook of every table and drop them.
     */
    void release() {
        tables.releaseAll();
    }
}
