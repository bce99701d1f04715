package com.voice_agent_backend.services.realtime;

import com.voice_agent_backend.models.UpstreamEvent;

import java.util.concurrent.TimeUnit;

/**
 * Single-consumer, pull-based view of the events received on one upstream connection.
 */
public interface UpstreamEventSequence {

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the next event, or null if none arrived in time or the sequence is exhausted
     */
    UpstreamEvent next(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * True once the connection has ended and every buffered event has been taken.
     */
    boolean isExhausted();
}
