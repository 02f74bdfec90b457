package com.orderstream.syncclient;

import com.orderstream.syncmodel.Identifiable;

import java.util.List;

/**
 * One-shot "read all" used to seed an {@link EntityCacheStore}.
 *
 * @param <T> entity record type
 */
@FunctionalInterface
public interface BootstrapSource<T extends Identifiable> {

    /**
     * Returns the full current collection.
     *
     * @throws BootstrapException if the collection cannot be read
     */
    List<T> fetchAll();

    /** Thrown when a bootstrap read fails. */
    class BootstrapException extends RuntimeException {
        public BootstrapException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
