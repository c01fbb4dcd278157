package com.pitchscope.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Pacing and receive-loop bounds for the realtime transcription channel.
 */
@ConfigurationProperties(prefix = "stt.streaming")
@Validated
public class StreamingProperties {

    /** Bytes of raw audio per binary frame. */
    @Positive(message = "Chunk size must be positive")
    private int chunkSizeBytes = 4096;

    /** Delay between chunks, approximating real-time playback. */
    @PositiveOrZero(message = "Chunk interval must not be negative")
    private long chunkIntervalMs = 50;

    /** Per-read timeout in the receive loop. */
    @Positive(message = "Read timeout must be positive")
    private long readTimeoutMs = 3000;

    /** Maximum provider messages read before the loop stops. */
    @Positive(message = "Max messages must be positive")
    private int maxMessages = 100;

    /** Consecutive read timeouts tolerated before the loop stops. */
    @Positive(message = "Max consecutive timeouts must be positive")
    private int maxConsecutiveTimeouts = 10;

    public int getChunkSizeBytes() {
        return chunkSizeBytes;
    }

    public void setChunkSizeBytes(int chunkSizeBytes) {
        this.chunkSizeBytes = chunkSizeBytes;
    }

    public long getChunkIntervalMs() {
        return chunkIntervalMs;
    }

    public void setChunkIntervalMs(long chunkIntervalMs) {
        this.chunkIntervalMs = chunkIntervalMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(long readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    public void setMaxMessages(int maxMessages) {
        this.maxMessages = maxMessages;
    }

    public int getMaxConsecutiveTimeouts() {
        return maxConsecutiveTimeouts;
    }

    public void setMaxConsecutiveTimeouts(int maxConsecutiveTimeouts) {
        this.maxConsecutiveTimeouts = maxConsecutiveTimeouts;
    }

    public Duration chunkInterval() {
        return Duration.ofMillis(chunkIntervalMs);
    }

    public Duration readTimeout() {
        return Duration.ofMillis(readTimeoutMs);
    }
}
