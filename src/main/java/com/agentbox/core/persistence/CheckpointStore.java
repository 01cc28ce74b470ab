package com.agentbox.core.persistence;

/**
 * Durable persistence cursor. {@link #set} only changes memory; {@link #save} writes it.
 */
public interface CheckpointStore {

    long get();

    void set(long cursor);

    void save();
}
