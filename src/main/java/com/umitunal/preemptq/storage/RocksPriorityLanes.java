package com.umitunal.preemptq.storage;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.PriorityLanes;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed priority lanes and delayed set.
 *
 * Lane keys are {@code [priority byte][sequence long]}, so a forward iteration from the lane
 * prefix yields FIFO order. Delayed keys are {@code [readyAt long][jobId]}, ordered by ready time.
 * Removal goes through an optimistic transaction so each entry is handed out once.
 */
public class RocksPriorityLanes implements PriorityLanes {
    private static final Logger log = LoggerFactory.getLogger(RocksPriorityLanes.class);

    private final RocksDatabase database;
    private final ColumnFamilyHandle lanes;
    private final ColumnFamilyHandle delayed;
    private final AtomicLong sequence;

    public RocksPriorityLanes(RocksDatabase database) {
        this.database = database;
        this.lanes = database.handle(RocksDatabase.Family.LANES);
        this.delayed = database.handle(RocksDatabase.Family.DELAYED);
        this.sequence = new AtomicLong(lastSequence());
    }

    /**
     * Recover the sequence counter from the tail of every lane.
     */
    private long lastSequence() {
        long max = 0;
        try (final RocksIterator iter = database.db().newIterator(lanes)) {
            for (int p = Job.MIN_PRIORITY; p <= Job.MAX_PRIORITY; p++) {
                iter.seekForPrev(laneKey(p, Long.MAX_VALUE));
                if (iter.isValid() && iter.key()[0] == (byte) p) {
                    max = Math.max(max, ByteBuffer.wrap(iter.key(), 1, Long.BYTES).getLong());
                }
            }
        }
        return max;
    }

    @Override
    public LaneEntry popHighest() throws RocksDBException {
        for (int p = Job.MAX_PRIORITY; p >= Job.MIN_PRIORITY; p--) {
            try (final RocksIterator iter = database.db().newIterator(lanes)) {
                for (iter.seek(lanePrefix(p)); iter.isValid() && iter.key()[0] == (byte) p; iter.next()) {
                    byte[] key = iter.key();
                    byte[] value = tryRemove(lanes, key);
                    if (value != null) {
                        return new LaneEntry(p, new String(value, UTF_8));
                    }
                }
            }
        }
        return null;
    }

    @Override
    public void push(int priority, String jobId) throws RocksDBException {
        checkPriority(priority);
        byte[] key = laneKey(priority, sequence.incrementAndGet());
        database.db().put(lanes, database.writeOptions(), key, jobId.getBytes(UTF_8));
        log.debug("Pushed job {} to lane {}", jobId, priority);
    }

    @Override
    public long length(int priority) {
        checkPriority(priority);
        long count = 0;
        try (final RocksIterator iter = database.db().newIterator(lanes, database.scanOptions())) {
            for (iter.seek(lanePrefix(priority)); iter.isValid() && iter.key()[0] == (byte) priority; iter.next()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public int highestWaitingPriority() {
        try (final RocksIterator iter = database.db().newIterator(lanes)) {
            for (int p = Job.MAX_PRIORITY; p >= Job.MIN_PRIORITY; p--) {
                iter.seek(lanePrefix(p));
                if (iter.isValid() && iter.key()[0] == (byte) p) {
                    return p;
                }
            }
        }
        return 0;
    }

    @Override
    public boolean contains(String jobId) {
        byte[] wanted = jobId.getBytes(UTF_8);
        try (final RocksIterator iter = database.db().newIterator(lanes, database.scanOptions())) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                if (Arrays.equals(wanted, iter.value())) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public void delayedAdd(String jobId, long readyAt) throws RocksDBException {
        delayedRemove(jobId);
        database.db().put(delayed, database.writeOptions(), delayedKey(readyAt, jobId), jobId.getBytes(UTF_8));
    }

    @Override
    public List<String> delayedPopReady(long now) throws RocksDBException {
        List<String> ready = new ArrayList<>();
        try (final RocksIterator iter = database.db().newIterator(delayed)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                byte[] key = iter.key();
                if (ByteBuffer.wrap(key).getLong() > now) {
                    break;
                }
                byte[] value = tryRemove(delayed, key);
                if (value != null) {
                    ready.add(new String(value, UTF_8));
                }
            }
        }
        return ready;
    }

    @Override
    public boolean delayedRemove(String jobId) throws RocksDBException {
        byte[] wanted = jobId.getBytes(UTF_8);
        List<byte[]> keys = new ArrayList<>();
        try (final RocksIterator iter = database.db().newIterator(delayed, database.scanOptions())) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                if (Arrays.equals(wanted, iter.value())) {
                    keys.add(iter.key());
                }
            }
        }
        for (byte[] key : keys) {
            database.db().delete(delayed, database.writeOptions(), key);
        }
        return !keys.isEmpty();
    }

    @Override
    public long delayedSize() {
        long count = 0;
        try (final RocksIterator iter = database.db().newIterator(delayed, database.scanOptions())) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Delete an entry if it is still there.
     *
     * @return the removed value, or null if another caller removed it first
     */
    private byte[] tryRemove(ColumnFamilyHandle family, byte[] key) throws RocksDBException {
        try (Transaction txn = database.beginTransaction();
             ReadOptions readOptions = new ReadOptions()) {
            byte[] value = txn.getForUpdate(readOptions, family, key, true);
            if (value == null) {
                return null;
            }
            txn.delete(family, key);
            txn.commit();
            return value;
        } catch (RocksDBException e) {
            if (!RocksDatabase.isConflict(e)) {
                throw e;
            }
            log.debug("Lost the race for a lane entry, skipping it");
            return null;
        }
    }

    private static void checkPriority(int priority) {
        if (priority < Job.MIN_PRIORITY || priority > Job.MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must be between "
                    + Job.MIN_PRIORITY + " and " + Job.MAX_PRIORITY + ": " + priority);
        }
    }

    private static byte[] lanePrefix(int priority) {
        return new byte[]{(byte) priority};
    }

    static byte[] laneKey(int priority, long seq) {
        return ByteBuffer.allocate(1 + Long.BYTES)
                .put((byte) priority)
                .putLong(seq)
                .array();
    }

    static byte[] delayedKey(long readyAt, String jobId) {
        byte[] id = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(Long.BYTES + id.length)
                .putLong(readyAt)
                .put(id)
                .array();
    }
}
