package com.umitunal.preemptq.core;

import com.umitunal.preemptq.model.JobRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of every job's scheduling metadata.
 */
public interface JobStore {

    /**
     * Persist a newly submitted job.
     *
     * @throws IllegalStateException if a job with the same id already exists
     */
    JobRecord create(JobRecord job) throws Exception;

    Optional<JobRecord> findById(String jobId) throws Exception;

    /**
     * Find jobs in a status, oldest first.
     *
     * @param offset number of matching jobs to skip
     * @param limit maximum number of jobs to return
     */
    List<JobRecord> findByStatus(Job.Status status, int offset, int limit) throws Exception;

    default List<JobRecord> findByStatus(Job.Status status) throws Exception {
        return findByStatus(status, 0, Integer.MAX_VALUE);
    }

    /**
     * Most recently created jobs first.
     */
    List<JobRecord> findRecent(int limit) throws Exception;

    /**
     * Full-record upsert.
     */
    void save(JobRecord job) throws Exception;

    /**
     * Atomic read-modify-write of a single job.
     *
     * @return the written record, or empty if the job does not exist or the mutation declined
     */
    Optional<JobRecord> update(String jobId, Mutation<JobRecord> mutation) throws Exception;

    long countByStatus(Job.Status status) throws Exception;
}
