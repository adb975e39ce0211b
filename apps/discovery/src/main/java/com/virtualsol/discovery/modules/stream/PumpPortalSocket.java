package com.virtualsol.discovery.modules.stream;

import org.java_websocket.WebSocket;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.framing.Framedata;
import org.java_websocket.handshake.ServerHandshake;
import org.springframework.stereotype.Component;

import java.net.URI;

/**
 * Java-WebSocket client bound to one {@link StreamSocket.Listener}. One instance per connection.
 */
public class PumpPortalSocket extends WebSocketClient implements StreamSocket {

    private final Listener listener;

    public PumpPortalSocket(URI serverUri, Listener listener) {
        super(serverUri);
        this.listener = listener;
        // heartbeat is driven by the stream service
        setConnectionLostTimeout(0);
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
        listener.onOpen();
    }

    @Override
    public void onMessage(String message) {
        listener.onMessage(message);
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        listener.onClose(code, reason, remote);
    }

    @Override
    public void onError(Exception ex) {
        listener.onError(ex);
    }

    @Override
    public void onWebsocketPong(WebSocket conn, Framedata frame) {
        listener.onPong();
    }

    @Override
    public void terminate() {
        closeConnection(CloseFrame.ABNORMAL_CLOSE, "heartbeat timeout");
    }

    @Component
    public static class DefaultFactory implements StreamSocket.Factory {

        @Override
        public StreamSocket create(URI uri, Listener listener) {
            return new PumpPortalSocket(uri, listener);
        }
    }
}
