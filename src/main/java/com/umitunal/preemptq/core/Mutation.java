package com.umitunal.preemptq.core;

/**
 * A change applied to a freshly read record inside a store transaction.
 *
 * @param <R> the record type
 */
@FunctionalInterface
public interface Mutation<R> {

    /**
     * @return false to leave the record untouched
     */
    boolean apply(R record);
}
