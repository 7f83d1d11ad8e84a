package com.umitunal.preemptq.storage;

import com.esotericsoftware.kryo.Kryo;
import com.umitunal.preemptq.core.ExecutionStateStore;
import com.umitunal.preemptq.core.Mutation;
import com.umitunal.preemptq.model.ProcessControlBlock;
import com.umitunal.preemptq.serialization.KryoCodec;
import org.rocksdb.RocksDBException;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * RocksDB-backed implementation of ExecutionStateStore, PCBs encoded with Kryo.
 */
public class RocksExecutionStateStore extends RocksRecordStore<ProcessControlBlock> implements ExecutionStateStore {

    public RocksExecutionStateStore(RocksDatabase database) {
        super(database, RocksDatabase.Family.EXECUTION_STATE,
                new KryoCodec<>(ProcessControlBlock.class, RocksExecutionStateStore::createKryo));
    }

    /**
     * Registration ids are part of the on-disk format, never renumber them.
     */
    public static Kryo createKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(true);
        kryo.setReferences(false);
        kryo.register(ProcessControlBlock.class, 100);
        kryo.register(ProcessControlBlock.Status.class, 101);
        kryo.register(ProcessControlBlock.DelayProgress.class, 102);
        return kryo;
    }

    @Override
    protected String keyOf(ProcessControlBlock record) {
        return record.getJobId();
    }

    @Override
    protected void touch(ProcessControlBlock record, long now) {
        record.touch(now);
    }

    @Override
    public Optional<ProcessControlBlock> findByJobId(String jobId) throws RocksDBException {
        return get(jobId);
    }

    @Override
    public ProcessControlBlock create(ProcessControlBlock pcb) throws RocksDBException {
        return insert(pcb);
    }

    @Override
    public void save(ProcessControlBlock pcb) throws RocksDBException {
        put(pcb);
    }

    @Override
    public Optional<ProcessControlBlock> update(String jobId, Mutation<ProcessControlBlock> mutation)
            throws RocksDBException {
        return super.update(jobId, mutation);
    }

    @Override
    public List<ProcessControlBlock> findByStatus(ProcessControlBlock.Status status) {
        return scan(pcb -> pcb.getStatus() == status).stream()
                .sorted(Comparator.comparingLong(ProcessControlBlock::getSuspendedAt))
                .collect(Collectors.toList());
    }

    @Override
    public long countByStatus(ProcessControlBlock.Status status) {
        return count(pcb -> pcb.getStatus() == status);
    }
}
