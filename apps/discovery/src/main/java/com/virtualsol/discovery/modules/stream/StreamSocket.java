package com.virtualsol.discovery.modules.stream;

import java.net.URI;

/**
 * The upstream connection as the stream service sees it.
 */
public interface StreamSocket {

    /**
     * Starts connecting without blocking. Outcome arrives through the {@link Listener}.
     */
    void connect();

    boolean isOpen();

    void send(String text);

    void sendPing();

    /**
     * Close handshake.
     */
    void close();

    /**
     * Drops the connection without a close handshake.
     */
    void terminate();

    interface Listener {

        void onOpen();

        void onMessage(String message);

        void onClose(int code, String reason, boolean remote);

        void onError(Exception error);

        void onPong();
    }

    @FunctionalInterface
    interface Factory {

        StreamSocket create(URI uri, Listener listener);
    }
}
