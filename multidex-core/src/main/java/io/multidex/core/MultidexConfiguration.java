package io.multidex.core;

import java.util.Objects;

/**
 * Immutable configuration for a {@code Storage}.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * MultidexConfiguration config = MultidexConfiguration.builder()
 *     .lockMode(LockMode.NONE)
 *     .duplicateFieldPolicy(DuplicateFieldPolicy.FAIL)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class MultidexConfiguration {

    // Concurrency
    private final LockMode lockMode;
    private final boolean fairLock;

    // Schema evolution
    private final DuplicateFieldPolicy duplicateFieldPolicy;
    private final boolean backfillExistingRecords;

    private MultidexConfiguration(Builder builder) {
        this.lockMode = builder.lockMode;
        this.fairLock = builder.fairLock;
        this.duplicateFieldPolicy = builder.duplicateFieldPolicy;
        this.backfillExistingRecords = builder.backfillExistingRecords;
    }

    /**
     * Create a new builder for MultidexConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every option at its default.
     */
    public static MultidexConfiguration defaults() {
        return builder().build();
    }

    /**
     * Get the locking mode used around storage operations.
     *
     * @return the lock mode (READ_WRITE or NONE)
     */
    public LockMode lockMode() {
        return lockMode;
    }

    /**
     * Check if the read/write lock is created in fair mode.
     * Ignored when the lock mode is NONE.
     *
     * @return true if the lock is fair
     */
    public boolean fairLock() {
        return fairLock;
    }

    /**
     * Get what happens when a field name is declared a second time.
     */
    public DuplicateFieldPolicy duplicateFieldPolicy() {
        return duplicateFieldPolicy;
    }

    /**
     * Check if records that already exist receive the default value of a field
     * declared after their creation.
     *
     * @return true if existing records are back-filled (default: true)
     */
    public boolean backfillExistingRecords() {
        return backfillExistingRecords;
    }

    /**
     * Locking strategy enum.
     */
    public enum LockMode {
        /**
         * Shared scope for reads, exclusive scope for writes.
         */
        READ_WRITE,

        /**
         * No locking. Only for storages confined to a single thread.
         */
        NONE
    }

    /**
     * Behaviour of a repeated field declaration.
     */
    public enum DuplicateFieldPolicy {
        /**
         * The declaration is ignored and reported as {@code false}.
         */
        REJECT,

        /**
         * The declaration throws {@link MultidexException}.
         */
        FAIL
    }

    /**
     * Builder for MultidexConfiguration.
     */
    public static class Builder {
        private LockMode lockMode = LockMode.READ_WRITE;
        private boolean fairLock = false;
        private DuplicateFieldPolicy duplicateFieldPolicy = DuplicateFieldPolicy.REJECT;
        private boolean backfillExistingRecords = true;

        private Builder() {
        }

        public Builder lockMode(LockMode lockMode) {
            this.lockMode = Objects.requireNonNull(lockMode, "lockMode");
            return this;
        }

        public Builder fairLock(boolean fairLock) {
            this.fairLock = fairLock;
            return this;
        }

        public Builder duplicateFieldPolicy(DuplicateFieldPolicy duplicateFieldPolicy) {
            this.duplicateFieldPolicy = Objects.requireNonNull(duplicateFieldPolicy, "duplicateFieldPolicy");
            return this;
        }

        public Builder backfillExistingRecords(boolean backfillExistingRecords) {
            this.backfillExistingRecords = backfillExistingRecords;
            return this;
        }

        /**
         * Build the immutable configuration.
         *
         * @return a new MultidexConfiguration instance
         */
        public MultidexConfiguration build() {
            return new MultidexConfiguration(this);
        }
    }
}
