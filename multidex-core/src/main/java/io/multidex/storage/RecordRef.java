package io.multidex.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Non-owning handle to a record held by a {@link Storage}.
 * <p>
 * Reads and writes go straight to the record, and writes move the record
 * within the equality and ordering index of the changed field, so the record
 * stays findable by its new value. Any number of refs may target one record
 * and see each other's writes.
 * <p>
 * Once the record is erased or its storage closed, every operation fails
 * without touching it: {@link #isValid()} reports {@code false}, writes return
 * {@code false}, reads return empty.
 * <p>
 * Only a {@link Storage} binds a ref. {@link #unbound()} gives an empty ref to
 * pass to {@link Storage#findByField(String, Object, RecordRef)}.
 */
public final class RecordRef {
    private static final Logger log = LoggerFactory.getLogger(RecordRef.class);

    // Record, context and flag change together; a ref may be shared between threads.
    private volatile Binding binding = Binding.DETACHED;

    RecordRef() {
    }

    public static RecordRef unbound() {
        return new RecordRef();
    }

    RecordRef bind(StoredRecord record, StorageContext context) {
        this.binding = new Binding(record, context, record.validity());
        return this;
    }

    StoredRecord target() {
        return binding.record();
    }

    /**
     * Write one field and move the record in that field's indices.
     *
     * @return false, with nothing changed, if the ref is invalid, the field is
     * not declared or {@code value} is not of the field's declared type
     */
    public boolean setData(String field, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        Binding bound = binding;
        if (!bound.isValid()) {
            return false;
        }
        StorageContext ctx = bound.context();
        try (var ignored = ctx.lock().exclusive()) {
            if (!bound.isValid()) {
                return false;
            }
            FieldDefinition<?> definition = resolve(ctx, field, value);
            if (definition == null) {
                return false;
            }
            write(ctx, bound.record(), definition, value);
            return true;
        }
    }

    /**
     * Write several fields in one exclusive scope. Every pair is checked first;
     * if any is rejected nothing is written.
     */
    public boolean setData(List<FieldValue> values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        Binding bound = binding;
        if (!bound.isValid()) {
            return false;
        }
        StorageContext ctx = bound.context();
        try (var ignored = ctx.lock().exclusive()) {
            if (!bound.isValid()) {
                return false;
            }
            return writeAll(ctx, bound.record(), values);
        }
    }

    /**
     * @return a copy of the field value, or empty if the ref is invalid, the
     * field is absent or {@code type} is not the field's type
     */
    public <T> Optional<T> getData(String field, Class<T> type) {
        Binding bound = binding;
        if (!bound.isValid()) {
            return Optional.empty();
        }
        try (var ignored = bound.context().lock().shared()) {
            if (!bound.isValid()) {
                return Optional.empty();
            }
            return bound.record().fields().get(field, type);
        }
    }

    /**
     * Identity of the target record: equal for refs to the same record and
     * distinct across records.
     *
     * @return the id, or empty if the ref is invalid
     */
    public Optional<RecordId> getRecordUniqueId() {
        Binding bound = binding;
        if (!bound.isValid()) {
            return Optional.empty();
        }
        return Optional.of(bound.record().id());
    }

    public boolean isValid() {
        return binding.isValid();
    }

    /**
     * Detach this ref from its record. The record and other refs are unaffected.
     */
    public void unlink() {
        binding = Binding.DETACHED;
    }

    static boolean writeAll(StorageContext ctx, StoredRecord target, List<FieldValue> values) {
        FieldDefinition<?>[] definitions = new FieldDefinition<?>[values.size()];
        for (int i = 0; i < definitions.length; i++) {
            FieldValue fieldValue = values.get(i);
            definitions[i] = resolve(ctx, fieldValue.field(), fieldValue.value());
            if (definitions[i] == null) {
                return false;
            }
        }
        for (int i = 0; i < definitions.length; i++) {
            write(ctx, target, definitions[i], values.get(i).value());
        }
        return true;
    }

    private static FieldDefinition<?> resolve(StorageContext ctx, String field, Object value) {
        FieldDefinition<?> definition = ctx.schema().definition(field);
        if (definition == null) {
            log.debug("Field {} is not declared", field);
            return null;
        }
        if (!definition.accepts(value)) {
            log.warn("Type mismatch on field {}: declared {} but got {}",
                    field, definition.type().getName(), value.getClass().getName());
            return null;
        }
        return definition;
    }

    // Index entries move before the payload changes; the caller holds the exclusive scope.
    private static <T> void write(StorageContext ctx, StoredRecord target, FieldDefinition<T> definition, Object value) {
        T stored = definition.copier().copy(definition.cast(value));
        T previous = target.read(definition);
        ctx.indexes().reindex(definition.name(), previous, stored, target);
        target.fields().set(definition.name(), definition.type(), stored, definition.copier(), null);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return binding.record() == ((RecordRef) obj).binding.record();
    }

    @Override
    public int hashCode() {
        StoredRecord target = binding.record();
        return target == null ? 0 : target.id().hashCode();
    }

    @Override
    public String toString() {
        Binding bound = binding;
        if (bound.record() == null) {
            return "RecordRef{unbound}";
        }
        return "RecordRef{id=" + bound.record().id().value() + ", valid=" + bound.isValid() + "}";
    }

    private record Binding(StoredRecord record, StorageContext context, ValidityFlag validity) {
        static final Binding DETACHED = new Binding(null, null, ValidityFlag.DETACHED);

        boolean isValid() {
            return validity.isValid();
        }
    }
}
