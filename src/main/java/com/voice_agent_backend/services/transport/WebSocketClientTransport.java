package com.voice_agent_backend.services.transport;

import com.voice_agent_backend.models.ClientFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client transport over a server-side WebSocket. The container thread pushes frames in with
 * {@link #offer}; the session's client pump pulls them with {@link #receive}.
 */
@Slf4j
public class WebSocketClientTransport implements ClientTransport {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_SIZE_LIMIT = 1024 * 1024;

    private final WebSocketSession webSocketSession;
    private final BlockingQueue<ClientFrame> inbound;
    private final long enqueueTimeoutMs;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile boolean disconnected;
    private volatile String disconnectReason;

    public WebSocketClientTransport(WebSocketSession session, int queueCapacity, long enqueueTimeoutMs) {
        this.webSocketSession = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_SIZE_LIMIT);
        this.inbound = new LinkedBlockingQueue<>(queueCapacity);
        this.enqueueTimeoutMs = enqueueTimeoutMs;
    }

    @Override
    public String getId() {
        return webSocketSession.getId();
    }

    /**
     * Buffer an inbound frame. Frames that cannot be buffered in time are dropped.
     *
     * @return false if the frame was dropped
     */
    public boolean offer(ClientFrame frame) {
        try {
            if (inbound.offer(frame, enqueueTimeoutMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Client {}: inbound queue full, dropping {} frame", getId(), frame.getKind());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Client {}: interrupted while buffering {} frame", getId(), frame.getKind());
        }
        return false;
    }

    /**
     * Record that the peer went away. Frames already buffered are still delivered first.
     */
    public void markDisconnected(String reason) {
        this.disconnectReason = reason;
        this.disconnected = true;
    }

    @Override
    public ClientFrame receive(long timeout, TimeUnit unit) throws InterruptedException {
        if (disconnected && inbound.isEmpty()) {
            return ClientFrame.disconnect(disconnectReason);
        }
        ClientFrame frame = inbound.poll(timeout, unit);
        if (frame == null && disconnected) {
            return ClientFrame.disconnect(disconnectReason);
        }
        return frame;
    }

    @Override
    public void send(String json) throws IOException {
        if (!isOpen()) {
            throw new IOException("Client connection " + getId() + " is closed");
        }
        webSocketSession.sendMessage(new TextMessage(json));
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !disconnected && webSocketSession.isOpen();
    }

    @Override
    public void close(boolean failed) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!webSocketSession.isOpen()) {
            return;
        }
        try {
            webSocketSession.close(failed ? CloseStatus.SERVER_ERROR : CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Client {}: error closing WebSocket", getId(), e);
        }
    }
}
