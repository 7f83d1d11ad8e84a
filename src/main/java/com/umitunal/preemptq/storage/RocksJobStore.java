package com.umitunal.preemptq.storage;

import com.umitunal.preemptq.core.Job;
import com.umitunal.preemptq.core.JobStore;
import com.umitunal.preemptq.core.Mutation;
import com.umitunal.preemptq.model.JobRecord;
import com.umitunal.preemptq.model.JobRecordSerializer;
import org.rocksdb.RocksDBException;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * RocksDB-backed implementation of JobStore.
 */
public class RocksJobStore extends RocksRecordStore<JobRecord> implements JobStore {

    private static final Comparator<JobRecord> OLDEST_FIRST =
            Comparator.comparingLong(JobRecord::getCreatedAt).thenComparing(JobRecord::getId);

    public RocksJobStore(RocksDatabase database) {
        super(database, RocksDatabase.Family.JOBS, new JobRecordSerializer());
    }

    @Override
    protected String keyOf(JobRecord record) {
        return record.getId();
    }

    @Override
    protected void touch(JobRecord record, long now) {
        record.touch(now);
    }

    @Override
    public JobRecord create(JobRecord job) throws RocksDBException {
        return insert(job);
    }

    @Override
    public Optional<JobRecord> findById(String jobId) throws RocksDBException {
        return get(jobId);
    }

    @Override
    public List<JobRecord> findByStatus(Job.Status status, int offset, int limit) {
        return scan(job -> job.getStatus() == status).stream()
                .sorted(OLDEST_FIRST)
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public List<JobRecord> findRecent(int limit) {
        return scan(job -> true).stream()
                .sorted(OLDEST_FIRST.reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public void save(JobRecord job) throws RocksDBException {
        put(job);
    }

    @Override
    public Optional<JobRecord> update(String jobId, Mutation<JobRecord> mutation) throws RocksDBException {
        return super.update(jobId, mutation);
    }

    @Override
    public long countByStatus(Job.Status status) {
        return count(job -> job.getStatus() == status);
    }
}
