package org.morph.state.guard;

/**
 * Exclusive hold on one schema. Releasing more than once has no further effect.
 */
public interface GuardLease extends AutoCloseable {

    String schemaName();

    /**
     * @throws org.morph.exception.StoreException if the hold could not be given up; the
     *         schema stays locked until an operator intervenes
     */
    void release();

    @Override
    default void close() {
        release();
    }
}
