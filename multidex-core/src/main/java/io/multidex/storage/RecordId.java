package io.multidex.storage;

/**
 * Identity of a stored record, assigned at creation and never reused.
 * Derived from the record itself, not from its field values.
 */
public final class RecordId implements Comparable<RecordId> {
    private final long value;

    private RecordId(long value) {
        this.value = value;
    }

    public long value() {
        return value;
    }

    public static RecordId fromLong(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("record id out of range: " + value);
        }
        return new RecordId(value);
    }

    @Override
    public int compareTo(RecordId other) {
        return Long.compare(this.value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        RecordId recordId = (RecordId) obj;
        return value == recordId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "RecordId{" + value + "}";
    }
}
