package com.orderstream.syncmodel;

/** Anything that can travel inside a {@link ChangeEnvelope}: every synchronized entity has a stable id. */
public interface Identifiable {

    String id();
}
