package io.multidex.storage;

import io.multidex.core.MultidexConfiguration;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared/exclusive lock a {@link Storage} runs its operations under.
 * <p>
 * Acquisitions are scoped: each returns a {@link Guard} to be closed by
 * try-with-resources, so the lock is released on every exit path:
 * <pre>
 * try (var ignored = lock.exclusive()) {
 *     // mutate
 * }
 * </pre>
 * Implementations supplied by the embedding program must allow a thread that
 * holds the exclusive scope to take it again.
 */
public interface StorageLock {

    Guard shared();

    Guard exclusive();

    /**
     * Held acquisition; closing releases it.
     */
    interface Guard extends AutoCloseable {
        @Override
        void close();
    }

    static StorageLock readWrite(boolean fair) {
        return new ReadWrite(fair);
    }

    /**
     * No-op lock for storages confined to a single thread.
     */
    static StorageLock none() {
        return Unlocked.INSTANCE;
    }

    static StorageLock forConfiguration(MultidexConfiguration configuration) {
        return switch (configuration.lockMode()) {
            case READ_WRITE -> readWrite(configuration.fairLock());
            case NONE -> none();
        };
    }

    /**
     * {@link ReentrantReadWriteLock} backed implementation.
     */
    final class ReadWrite implements StorageLock {
        private final ReentrantReadWriteLock lock;

        ReadWrite(boolean fair) {
            this.lock = new ReentrantReadWriteLock(fair);
        }

        @Override
        public Guard shared() {
            return new LockGuard(lock.readLock());
        }

        @Override
        public Guard exclusive() {
            return new LockGuard(lock.writeLock());
        }

        public boolean isExclusivelyHeldByCurrentThread() {
            return lock.isWriteLockedByCurrentThread();
        }

        public boolean isFair() {
            return lock.isFair();
        }
    }

    final class LockGuard implements Guard {
        private final Lock lock;

        LockGuard(Lock lock) {
            this.lock = lock;
            lock.lock();
        }

        @Override
        public void close() {
            lock.unlock();
        }
    }

    enum Unlocked implements StorageLock, Guard {
        INSTANCE;

        @Override
        public Guard shared() {
            return this;
        }

        @Override
        public Guard exclusive() {
            return this;
        }

        @Override
        public void close() {
            // nothing held
        }
    }
}
