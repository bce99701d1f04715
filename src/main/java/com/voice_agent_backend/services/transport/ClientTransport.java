package com.voice_agent_backend.services.transport;

import com.voice_agent_backend.models.ClientFrame;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * The calling party's end of a session: inbound audio and control frames, outbound JSON text.
 */
public interface ClientTransport {

    String getId();

    /**
     * Wait up to {@code timeout} for the next inbound frame. Once the peer has gone and every
     * buffered frame was taken, a {@link ClientFrame.Kind#DISCONNECT} frame is returned.
     *
     * @return the next frame, or null on timeout
     */
    ClientFrame receive(long timeout, TimeUnit unit) throws InterruptedException;

    void send(String json) throws IOException;

    boolean isOpen();

    /**
     * Release the transport. Only the first call has an effect.
     */
    void close(boolean failed);
}
