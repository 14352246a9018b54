package org.morph.state.guard;

/**
 * Grants exclusive access to a schema for the duration of a lease. Acquisition never
 * waits: a held schema fails immediately.
 */
public interface ConcurrencyGuard {

    /**
     * @throws org.morph.exception.AlreadyActiveException if another caller holds the schema
     */
    GuardLease acquire(String schemaName);
}
