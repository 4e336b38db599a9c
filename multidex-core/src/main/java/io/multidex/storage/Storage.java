package io.multidex.storage;

import io.multidex.core.MultidexConfiguration;
import io.multidex.core.MultidexException;
import io.multidex.index.RangeIndex;
import io.multidex.value.ValueCopier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * In-process record store indexed on every field.
 * <p>
 * Each declared field gets an equality index (exact lookup) and an ordering
 * index (range and sorted traversal). Both always hold exactly one entry per
 * live record, keyed by the record's current value of the field:
 * <pre>
 * try (Storage storage = new Storage()) {
 *     storage.declareField("id", -1);
 *     storage.declareField("name", "");
 *     RecordRef ref = storage.createRecord();
 *     ref.setData("name", "mrognor");
 *     storage.findByField("name", "mrognor").flatMap(r -> r.getData("id", Integer.class));
 * }
 * </pre>
 * Reads run under the shared scope of the {@link StorageLock}, writes under the
 * exclusive scope. Failures caused by the caller's data (unknown field, wrong
 * type, no match, erased record) are reported as {@code false} or empty;
 * a type mismatch is also logged.
 */
public final class Storage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Storage.class);

    // Ids are unique across storages so refs from different storages never compare equal.
    private static final AtomicLong RECORD_SEQUENCE = new AtomicLong();

    private final MultidexConfiguration configuration;
    private final StorageLock lock;
    private final Schema schema = new Schema();
    private final IndexTables indexes = new IndexTables();
    private final StorageContext context;
    private final Map<RecordId, StoredRecord> records = new LinkedHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Storage() {
        this(MultidexConfiguration.defaults());
    }

    public Storage(MultidexConfiguration configuration) {
        this(configuration, StorageLock.forConfiguration(configuration));
    }

    /**
     * Storage running under a lock supplied by the embedding program.
     */
    public Storage(MultidexConfiguration configuration, StorageLock lock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.context = new StorageContext(schema, indexes, lock);
    }

    public MultidexConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Declare a field ordered by the natural order of its values. The field's
     * type is the runtime class of {@code defaultValue} and must be immutable
     * (see {@link ValueCopier#isImmutable(Class)}); other types are declared
     * with a {@link ValueCopier}.
     *
     * @return false if the name is already declared
     * @throws MultidexException for a repeated name under
     *                           {@link MultidexConfiguration.DuplicateFieldPolicy#FAIL}
     */
    public <T extends Comparable<? super T>> boolean declareField(String name, T defaultValue) {
        return declareField(FieldDefinition.of(name, defaultValue));
    }

    public <T> boolean declareField(String name, T defaultValue, Comparator<? super T> comparator) {
        return declareField(FieldDefinition.of(name, defaultValue, comparator));
    }

    /**
     * Declare a field whose values are copied by {@code copier} on every write
     * and read, so neither the caller nor other records share them.
     */
    public <T extends Comparable<? super T>> boolean declareField(String name, T defaultValue, ValueCopier<T> copier) {
        return declareField(FieldDefinition.of(name, defaultValue, copier));
    }

    public <T> boolean declareField(FieldDefinition<T> definition) {
        Objects.requireNonNull(definition, "definition");
        try (var ignored = lock.exclusive()) {
            assertOpen();
            if (schema.has(definition.name())) {
                if (configuration.duplicateFieldPolicy() == MultidexConfiguration.DuplicateFieldPolicy.FAIL) {
                    throw new MultidexException("Field already declared: " + definition.name());
                }
                log.warn("Field {} is already declared; declaration ignored", definition.name());
                return false;
            }
            schema.declare(definition);
            indexes.allocate(definition);
            if (!records.isEmpty() && configuration.backfillExistingRecords()) {
                backfill(definition);
            }
            log.debug("Declared field {} of type {}", definition.name(), definition.type().getName());
            return true;
        }
    }

    private <T> void backfill(FieldDefinition<T> definition) {
        for (StoredRecord record : records.values()) {
            record.fields().set(definition.name(), definition.type(), definition.defaultValue(), definition.copier(), null);
            indexes.insert(definition.name(), record.read(definition), record);
        }
    }

    /**
     * Create a record holding the default of every declared field.
     */
    public RecordRef createRecord() {
        try (var ignored = lock.exclusive()) {
            assertOpen();
            return new RecordRef().bind(newRecord(), context);
        }
    }

    /**
     * Create a record and write {@code values} over its defaults, as one step.
     *
     * @return the new record, or empty (and no record created) if a value names
     * an undeclared field or has the wrong type
     */
    public Optional<RecordRef> createRecord(List<FieldValue> values) {
        Objects.requireNonNull(values, "values");
        try (var ignored = lock.exclusive()) {
            assertOpen();
            for (FieldValue value : values) {
                FieldDefinition<?> definition = schema.definition(value.field());
                if (definition == null || !definition.accepts(value.value())) {
                    log.debug("Record not created: {} does not fit the schema", value);
                    return Optional.empty();
                }
            }
            StoredRecord record = newRecord();
            RecordRef.writeAll(context, record, values);
            return Optional.of(new RecordRef().bind(record, context));
        }
    }

    private StoredRecord newRecord() {
        StoredRecord record = new StoredRecord(RecordId.fromLong(RECORD_SEQUENCE.incrementAndGet()),
                schema.newRecordFields());
        for (FieldDefinition<?> definition : schema.definitions()) {
            indexes.insert(definition.name(), record.read(definition), record);
        }
        records.put(record.id(), record);
        return record;
    }

    /**
     * Look up a record whose {@code field} currently equals {@code value}.
     * When several match, the one that took the value first is returned.
     */
    public Optional<RecordRef> findByField(String field, Object value) {
        try (var ignored = lock.shared()) {
            assertOpen();
            if (!checkLookup(field, value)) {
                return Optional.empty();
            }
            return indexes.first(field, value).map(this::bind);
        }
    }

    /**
     * Out-parameter form of {@link #findByField(String, Object)}: on a hit
     * {@code target} is rebound to the found record, otherwise it is untouched.
     */
    public boolean findByField(String field, Object value, RecordRef target) {
        Objects.requireNonNull(target, "target");
        try (var ignored = lock.shared()) {
            assertOpen();
            if (!checkLookup(field, value)) {
                return false;
            }
            Optional<StoredRecord> found = indexes.first(field, value);
            found.ifPresent(record -> target.bind(record, context));
            return found.isPresent();
        }
    }

    /**
     * Every record whose {@code field} currently equals {@code value}.
     */
    public List<RecordRef> findAllByField(String field, Object value) {
        try (var ignored = lock.shared()) {
            assertOpen();
            if (!checkLookup(field, value)) {
                return List.of();
            }
            return bindAll(indexes.all(field, value));
        }
    }

    /**
     * Records with {@code from <= field <= to}, ascending by the field.
     */
    public List<RecordRef> findRange(String field, Object from, Object to) {
        try (var ignored = lock.shared()) {
            assertOpen();
            if (!checkLookup(field, from) || !checkLookup(field, to)) {
                return List.of();
            }
            return bindAll(indexes.ordering(field).between(from, to));
        }
    }

    /**
     * Records with {@code field > value}, ascending by the field.
     */
    public List<RecordRef> findGreaterThan(String field, Object value) {
        return rangeQuery(field, value, ordering -> ordering.greaterThan(value));
    }

    /**
     * Records with {@code field < value}, ascending by the field.
     */
    public List<RecordRef> findLessThan(String field, Object value) {
        return rangeQuery(field, value, ordering -> ordering.lessThan(value));
    }

    /**
     * Records with {@code field >= value}, ascending by the field.
     */
    public List<RecordRef> findAtLeast(String field, Object value) {
        return rangeQuery(field, value, ordering -> ordering.greaterThanOrEqual(value));
    }

    /**
     * Records with {@code field <= value}, ascending by the field.
     */
    public List<RecordRef> findAtMost(String field, Object value) {
        return rangeQuery(field, value, ordering -> ordering.lessThanOrEqual(value));
    }

    /**
     * Every record, ascending by {@code field}.
     */
    public List<RecordRef> ordered(String field) {
        try (var ignored = lock.shared()) {
            assertOpen();
            if (!schema.has(field)) {
                return List.of();
            }
            return bindAll(indexes.ordering(field).ascending());
        }
    }

    public List<RecordRef> orderedDescending(String field) {
        try (var ignored = lock.shared()) {
            assertOpen();
            if (!schema.has(field)) {
                return List.of();
            }
            return bindAll(indexes.ordering(field).descending());
        }
    }

    private List<RecordRef> rangeQuery(String field, Object bound,
                                       Function<RangeIndex<Object, StoredRecord>, List<StoredRecord>> query) {
        try (var ignored = lock.shared()) {
            assertOpen();
            if (!checkLookup(field, bound)) {
                return List.of();
            }
            return bindAll(query.apply(indexes.ordering(field)));
        }
    }

    /**
     * Remove a record: drop it from every index, invalidate every ref to it,
     * then release its payload.
     *
     * @return false if the ref is invalid or belongs to another storage
     */
    public boolean eraseRecord(RecordRef ref) {
        Objects.requireNonNull(ref, "ref");
        try (var ignored = lock.exclusive()) {
            assertOpen();
            StoredRecord record = ref.target();
            if (record == null || !record.validity().isValid() || records.get(record.id()) != record) {
                return false;
            }
            for (FieldDefinition<?> definition : schema.definitions()) {
                purge(definition, record);
            }
            records.remove(record.id());
            record.destroy();
            log.debug("Erased record {}", record.id().value());
            return true;
        }
    }

    private <T> void purge(FieldDefinition<T> definition, StoredRecord record) {
        T value = record.read(definition);
        if (value != null) {
            indexes.remove(definition.name(), value, record);
        }
    }

    /**
     * Number of live records.
     */
    public int size() {
        try (var ignored = lock.shared()) {
            assertOpen();
            return records.size();
        }
    }

    public boolean hasField(String field) {
        try (var ignored = lock.shared()) {
            assertOpen();
            return schema.has(field);
        }
    }

    public Optional<Class<?>> fieldType(String field) {
        try (var ignored = lock.shared()) {
            assertOpen();
            FieldDefinition<?> definition = schema.definition(field);
            return definition == null ? Optional.empty() : Optional.of(definition.type());
        }
    }

    /**
     * Declared field names, in declaration order.
     */
    public List<String> fieldNames() {
        try (var ignored = lock.shared()) {
            assertOpen();
            List<String> names = new ArrayList<>(schema.size());
            for (FieldDefinition<?> definition : schema.definitions()) {
                names.add(definition.name());
            }
            return names;
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Release every index table, then destroy every live record. Refs to those
     * records turn invalid. Closing twice is a no-op.
     */
    @Override
    public void close() {
        try (var ignored = lock.exclusive()) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            indexes.release();
            int released = records.size();
            for (StoredRecord record : records.values()) {
                record.destroy();
            }
            records.clear();
            log.debug("Storage closed, {} records released", released);
        }
    }

    private boolean checkLookup(String field, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        FieldDefinition<?> definition = schema.definition(field);
        if (definition == null) {
            return false;
        }
        if (!definition.accepts(value)) {
            log.warn("Type mismatch on lookup of field {}: declared {} but got {}",
                    field, definition.type().getName(), value.getClass().getName());
            return false;
        }
        return true;
    }

    private RecordRef bind(StoredRecord record) {
        return new RecordRef().bind(record, context);
    }

    private List<RecordRef> bindAll(List<StoredRecord> found) {
        List<RecordRef> refs = new ArrayList<>(found.size());
        for (StoredRecord record : found) {
            refs.add(bind(record));
        }
        return refs;
    }

    private void assertOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Storage is closed");
        }
    }
}
