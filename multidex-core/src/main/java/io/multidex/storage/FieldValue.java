package io.multidex.storage;

/**
 * A field name paired with a value, for writing several fields at once.
 */
public record FieldValue(String field, Object value) {

    public FieldValue {
        if (field == null) {
            throw new IllegalArgumentException("field required");
        }
        if (value == null) {
            throw new IllegalArgumentException("value required for field " + field);
        }
    }

    public static FieldValue of(String field, Object value) {
        return new FieldValue(field, value);
    }
}
