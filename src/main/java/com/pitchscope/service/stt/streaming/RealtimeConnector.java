package com.pitchscope.service.stt.streaming;

import com.pitchscope.exception.ConnectionException;

/**
 * Opens realtime connections to a provider endpoint.
 */
public interface RealtimeConnector {

    /**
     * Opens a connection and waits until it is ready to send.
     *
     * @param url realtime endpoint returned when the live session was created
     * @return an open connection; the caller must close it
     * @throws ConnectionException if the connection cannot be opened within the connect timeout
     */
    RealtimeConnection connect(String url);
}
