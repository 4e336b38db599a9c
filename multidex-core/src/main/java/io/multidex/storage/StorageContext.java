package io.multidex.storage;

/**
 * What a bound {@link RecordRef} shares with the storage that issued it.
 */
record StorageContext(Schema schema, IndexTables indexes, StorageLock lock) {
}
