package io.multidex.storage;

import io.multidex.core.MultidexConfiguration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StorageLockTest {

    @Test
    void configurationSelectsLockKind() {
        assertThat(StorageLock.forConfiguration(MultidexConfiguration.defaults()))
                .isInstanceOf(StorageLock.ReadWrite.class);
        assertThat(StorageLock.forConfiguration(MultidexConfiguration.builder()
                .lockMode(MultidexConfiguration.LockMode.NONE)
                .build()))
                .isSameAs(StorageLock.none());
        StorageLock fair = StorageLock.forConfiguration(MultidexConfiguration.builder().fairLock(true).build());
        assertThat(((StorageLock.ReadWrite) fair).isFair()).isTrue();
    }

    @Test
    void guardReleasesOnClose() {
        StorageLock.ReadWrite lock = (StorageLock.ReadWrite) StorageLock.readWrite(false);

        try (var ignored = lock.exclusive()) {
            assertThat(lock.isExclusivelyHeldByCurrentThread()).isTrue();
        }

        assertThat(lock.isExclusivelyHeldByCurrentThread()).isFalse();
    }

    @Test
    void writesRunUnderExclusiveAndReadsUnderShared() {
        RecordingLock lock = new RecordingLock();
        try (Storage storage = new Storage(MultidexConfiguration.defaults(), lock)) {
            storage.declareField("id", 0);
            RecordRef ref = storage.createRecord();
            lock.scopes.clear();

            ref.setData("id", 1);
            assertThat(lock.scopes).containsExactly("exclusive");

            lock.scopes.clear();
            ref.getData("id", Integer.class);
            storage.findByField("id", 1);
            assertThat(lock.scopes).containsExactly("shared", "shared");
        }
    }

    @Test
    void failedWriteStillReleasesLock() {
        RecordingLock lock = new RecordingLock();
        try (Storage storage = new Storage(MultidexConfiguration.defaults(), lock)) {
            storage.declareField("id", 0);
            RecordRef ref = storage.createRecord();

            assertThat(ref.setData("id", "wrong")).isFalse();
            assertThat(ref.setData("missing", 1)).isFalse();

            assertThat(lock.delegate.isExclusivelyHeldByCurrentThread()).isFalse();
            assertThat(lock.open).isZero();
        }
    }

    @Test
    void unlockedStorageWorksSingleThreaded() {
        try (Storage storage = new Storage(MultidexConfiguration.builder()
                .lockMode(MultidexConfiguration.LockMode.NONE)
                .build())) {
            storage.declareField("id", 0);
            RecordRef ref = storage.createRecord();

            assertThat(ref.setData("id", 42)).isTrue();
            assertThat(storage.findByField("id", 42)).contains(ref);
        }
    }

    private static final class RecordingLock implements StorageLock {
        private final StorageLock.ReadWrite delegate = (StorageLock.ReadWrite) StorageLock.readWrite(false);
        private final List<String> scopes = new ArrayList<>();
        private int open;

        @Override
        public Guard shared() {
            return track("shared", delegate.shared());
        }

        @Override
        public Guard exclusive() {
            return track("exclusive", delegate.exclusive());
        }

        private Guard track(String kind, Guard guard) {
            scopes.add(kind);
            open++;
            return () -> {
                open--;
                guard.close();
            };
        }
    }
}
