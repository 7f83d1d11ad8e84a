package com.umitunal.preemptq.core;

import com.umitunal.preemptq.model.ProcessControlBlock;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-job execution progress (the process control blocks).
 */
public interface ExecutionStateStore {

    Optional<ProcessControlBlock> findByJobId(String jobId) throws Exception;

    /**
     * @throws IllegalStateException if the job already has a PCB
     */
    ProcessControlBlock create(ProcessControlBlock pcb) throws Exception;

    void save(ProcessControlBlock pcb) throws Exception;

    /**
     * Atomic read-modify-write of a single PCB.
     *
     * @return the written PCB, or empty if it does not exist or the mutation declined
     */
    Optional<ProcessControlBlock> update(String jobId, Mutation<ProcessControlBlock> mutation)
            throws Exception;

    List<ProcessControlBlock> findByStatus(ProcessControlBlock.Status status) throws Exception;

    long countByStatus(ProcessControlBlock.Status status) throws Exception;
}
