package com.voice_agent_backend.services.transport;

import com.voice_agent_backend.models.ClientFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketClientTransportTest {

    private WebSocketSession webSocketSession;

    @BeforeEach
    void setUp() {
        webSocketSession = mock(WebSocketSession.class);
        when(webSocketSession.getId()).thenReturn("client-1");
        when(webSocketSession.isOpen()).thenReturn(true);
    }

    @Test
    void framesBeyondCapacityAreDropped() throws Exception {
        WebSocketClientTransport transport = new WebSocketClientTransport(webSocketSession, 2, 10);

        assertThat(transport.offer(ClientFrame.audio(new byte[]{1}))).isTrue();
        assertThat(transport.offer(ClientFrame.audio(new byte[]{2}))).isTrue();
        assertThat(transport.offer(ClientFrame.audio(new byte[]{3}))).isFalse();

        assertThat(transport.receive(10, TimeUnit.MILLISECONDS).getAudio()).containsExactly(1);
        assertThat(transport.receive(10, TimeUnit.MILLISECONDS).getAudio()).containsExactly(2);
        assertThat(transport.receive(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void bufferedFramesAreDeliveredBeforeDisconnect() throws Exception {
        WebSocketClientTransport transport = new WebSocketClientTransport(webSocketSession, 8, 10);
        transport.offer(ClientFrame.control("{\"type\":\"response.cancel\"}"));
        transport.markDisconnected("closed with code 1000");

        assertThat(transport.receive(10, TimeUnit.MILLISECONDS).getKind()).isEqualTo(ClientFrame.Kind.CONTROL);
        ClientFrame last = transport.receive(10, TimeUnit.MILLISECONDS);
        assertThat(last.getKind()).isEqualTo(ClientFrame.Kind.DISCONNECT);
        assertThat(last.getText()).isEqualTo("closed with code 1000");
        assertThat(transport.isOpen()).isFalse();
    }

    @Test
    void closeHappensOnceWithStatusMatchingOutcome() throws Exception {
        WebSocketClientTransport transport = new WebSocketClientTransport(webSocketSession, 8, 10);

        transport.close(true);
        transport.close(false);

        verify(webSocketSession, times(1)).close(CloseStatus.SERVER_ERROR);
        assertThatThrownBy(() -> transport.send("{}")).isInstanceOf(IOException.class);
    }
}
