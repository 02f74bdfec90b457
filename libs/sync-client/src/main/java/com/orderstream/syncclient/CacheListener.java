package com.orderstream.syncclient;

import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.Identifiable;

import java.util.List;

/**
 * Observer of an {@link EntityCacheStore}. Called after the store's state has changed,
 * outside the store's lock, with an immutable snapshot.
 */
public interface CacheListener<T extends Identifiable> {

    void onChange(ChangeEnvelope<T> envelope, List<T> snapshot);

    /** Called after a bootstrap replaced the whole collection. */
    default void onReset(List<T> snapshot) {
    }
}
