package com.pitchscope.service.stt.streaming;

import com.pitchscope.exception.ConnectionException;

import java.time.Duration;
import java.util.Optional;

/**
 * An open, bidirectional realtime connection. Outbound frames are sent directly; inbound frames
 * are queued by the transport and drained with {@link #receive(Duration)}.
 */
public interface RealtimeConnection extends AutoCloseable {

    /**
     * @throws ConnectionException if the frame cannot be queued for sending
     */
    void sendBinary(byte[] chunk);

    /**
     * @throws ConnectionException if the frame cannot be queued for sending
     */
    void sendText(String text);

    /**
     * Waits up to {@code timeout} for the next inbound frame.
     *
     * @return the next frame, or empty when the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<RealtimeFrame> receive(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
