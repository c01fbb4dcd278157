package com.pitchscope.service.session;

import com.pitchscope.domain.AudioSession;
import com.pitchscope.exception.SizeLimitExceededException;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry: a session together with the state its driving task needs (cancellation
 * signal, bounded audio buffer, stop guard, last activity).
 */
public final class ManagedSession {

    private final AudioSession session;
    private final long maxBufferBytes;
    private final CancellationSignal cancellation = new CancellationSignal();
    private final ByteArrayOutputStream audio = new ByteArrayOutputStream();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Instant lastActivity;

    public ManagedSession(AudioSession session, long maxBufferBytes) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        if (maxBufferBytes <= 0) {
            throw new IllegalArgumentException("maxBufferBytes must be positive: " + maxBufferBytes);
        }
        this.maxBufferBytes = maxBufferBytes;
        this.lastActivity = session.getUpdatedAt();
    }

    public AudioSession session() {
        return session;
    }

    public String sessionId() {
        return session.getSessionId();
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    /**
     * Appends a chunk to the buffer.
     *
     * @throws SizeLimitExceededException if the chunk would take the buffer past its limit; the
     *                                    buffer is left unchanged
     */
    public void appendAudio(byte[] bytes) {
        synchronized (audio) {
            long total = (long) audio.size() + bytes.length;
            if (total > maxBufferBytes) {
                throw new SizeLimitExceededException(total, maxBufferBytes);
            }
            audio.write(bytes, 0, bytes.length);
        }
    }

    public byte[] bufferedAudio() {
        synchronized (audio) {
            return audio.toByteArray();
        }
    }

    public int bufferedBytes() {
        synchronized (audio) {
            return audio.size();
        }
    }

    public long maxBufferBytes() {
        return maxBufferBytes;
    }

    public void touch(Instant at) {
        this.lastActivity = Objects.requireNonNull(at, "at must not be null");
    }

    /**
     * Latest of the last fed audio and the last state change.
     */
    public Instant lastActivity() {
        Instant updated = session.getUpdatedAt();
        Instant fed = lastActivity;
        return fed.isAfter(updated) ? fed : updated;
    }

    /**
     * Marks the session as stopping. Only the first caller gets {@code true}.
     */
    public boolean requestStop() {
        return stopRequested.compareAndSet(false, true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
