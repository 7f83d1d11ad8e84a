package com.umitunal.preemptq.storage;

import com.umitunal.preemptq.core.Mutation;
import com.umitunal.preemptq.serialization.PayloadCodec;
import org.rocksdb.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Records keyed by job id in one column family, with optimistic single-record updates.
 *
 * @param <R> the record type
 */
abstract class RocksRecordStore<R> {
    private static final int MAX_UPDATE_ATTEMPTS = 16;

    protected final RocksDatabase database;
    private final ColumnFamilyHandle family;
    private final PayloadCodec<R> codec;

    protected RocksRecordStore(RocksDatabase database, RocksDatabase.Family family, PayloadCodec<R> codec) {
        this.database = database;
        this.family = database.handle(family);
        this.codec = codec;
    }

    protected abstract String keyOf(R record);

    /**
     * Stamp a record that is about to be written.
     */
    protected abstract void touch(R record, long now);

    protected Optional<R> get(String id) throws RocksDBException {
        byte[] value = database.db().get(family, id.getBytes(UTF_8));
        return value == null ? Optional.empty() : Optional.of(codec.decode(value));
    }

    protected R insert(R record) throws RocksDBException {
        byte[] key = keyOf(record).getBytes(UTF_8);

        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            try (Transaction txn = database.beginTransaction();
                 ReadOptions readOptions = new ReadOptions()) {
                if (txn.getForUpdate(readOptions, family, key, true) != null) {
                    throw new IllegalStateException("Record already exists: " + keyOf(record));
                }
                touch(record, System.currentTimeMillis());
                txn.put(family, key, codec.encode(record));
                txn.commit();
                return record;
            } catch (RocksDBException e) {
                if (!RocksDatabase.isConflict(e)) {
                    throw e;
                }
                // Lost to a concurrent insert, the next attempt sees it and reports a duplicate
            }
        }
        throw new IllegalStateException("Gave up inserting " + keyOf(record) + " after "
                + MAX_UPDATE_ATTEMPTS + " conflicting attempts");
    }

    protected void put(R record) throws RocksDBException {
        touch(record, System.currentTimeMillis());
        database.db().put(family, database.writeOptions(), keyOf(record).getBytes(UTF_8), codec.encode(record));
    }

    /**
     * Read, mutate and write one record inside an optimistic transaction, retrying on conflict.
     */
    protected Optional<R> update(String id, Mutation<R> mutation) throws RocksDBException {
        byte[] key = id.getBytes(UTF_8);

        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            try (Transaction txn = database.beginTransaction();
                 ReadOptions readOptions = new ReadOptions()) {
                byte[] value = txn.getForUpdate(readOptions, family, key, true);
                if (value == null) {
                    return Optional.empty();
                }

                R record = codec.decode(value);
                if (!mutation.apply(record)) {
                    return Optional.empty();
                }

                touch(record, System.currentTimeMillis());
                txn.put(family, key, codec.encode(record));
                txn.commit();
                return Optional.of(record);
            } catch (RocksDBException e) {
                if (!RocksDatabase.isConflict(e)) {
                    throw e;
                }
                // Another writer got there first, re-read and re-apply
            }
        }
        throw new IllegalStateException("Gave up updating " + id + " after "
                + MAX_UPDATE_ATTEMPTS + " conflicting attempts");
    }

    protected List<R> scan(Predicate<R> filter) {
        List<R> matches = new ArrayList<>();

        try (final RocksIterator iter = database.db().newIterator(family, database.scanOptions())) {
            iter.seekToFirst();

            while (iter.isValid()) {
                R record = codec.decode(iter.value());
                if (filter.test(record)) {
                    matches.add(record);
                }
                iter.next();
            }
        }

        return matches;
    }

    protected long count(Predicate<R> filter) {
        long count = 0;

        try (final RocksIterator iter = database.db().newIterator(family, database.scanOptions())) {
            iter.seekToFirst();

            while (iter.isValid()) {
                if (filter.test(codec.decode(iter.value()))) {
                    count++;
                }
                iter.next();
            }
        }

        return count;
    }
}
