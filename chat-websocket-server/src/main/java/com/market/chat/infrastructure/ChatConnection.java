package com.market.chat.infrastructure;

import java.io.IOException;

/**
 * One live client connection, independent of the transport library.
 */
public interface ChatConnection {

    String getId();

    boolean isOpen();

    /**
     * Send one serialized frame. Implementations serialize concurrent sends.
     */
    void send(String payload) throws IOException;
}
