package com.jonathantong.SensorRelay.web;

import com.jonathantong.SensorRelay.broadcast.SubscriberConnection;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Subscriber backed by a WebSocket session.
 * The session is expected to be safe for concurrent sends.
 */
public class WebSocketSubscriberConnection implements SubscriberConnection {

    private final WebSocketSession session;

    public WebSocketSubscriberConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(String message) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(message));
    }

    @Override
    public String toString() {
        return "WebSocketSubscriberConnection{" + session.getId() + '}';
    }
}
