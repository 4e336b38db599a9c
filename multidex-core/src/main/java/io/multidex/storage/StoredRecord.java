package io.multidex.storage;

import io.multidex.container.UniqueFieldMap;

/**
 * One stored row. Only {@link Storage} creates and destroys records; clients
 * reach them through {@link RecordRef}.
 */
final class StoredRecord {
    private final RecordId id;
    private final UniqueFieldMap fields;
    private final ValidityFlag validity = new ValidityFlag();

    StoredRecord(RecordId id, UniqueFieldMap fields) {
        this.id = id;
        this.fields = fields;
    }

    RecordId id() {
        return id;
    }

    UniqueFieldMap fields() {
        return fields;
    }

    ValidityFlag validity() {
        return validity;
    }

    /**
     * @return the current value of the field, or null if the record has none
     */
    <T> T read(FieldDefinition<T> definition) {
        return fields.get(definition.name(), definition.type()).orElse(null);
    }

    /**
     * Clears the flag before dropping the payload, so a ref that sees a valid
     * flag under the storage lock always sees the payload too.
     */
    void destroy() {
        validity.invalidate();
        fields.clear();
    }

    @Override
    public String toString() {
        return "StoredRecord{" + id.value() + (validity.isValid() ? "" : ", destroyed") + "}";
    }
}
