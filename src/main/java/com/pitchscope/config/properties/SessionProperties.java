package com.pitchscope.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Registry retention for finished and abandoned sessions, and the per-session audio buffer limit.
 */
@ConfigurationProperties(prefix = "session")
@Validated
public class SessionProperties {

    /** Terminal sessions are evicted this long after their last update. */
    @Positive(message = "Retention minutes must be positive")
    private int retentionMinutes = 30;

    /** Active sessions idle this long are cancelled and evicted. */
    @Positive(message = "Max idle minutes must be positive")
    private int maxIdleMinutes = 60;

    @Positive(message = "Reaper interval must be positive")
    private long reaperIntervalMs = 60_000;

    /** Audio fed to one session beyond this many bytes is rejected. */
    @Positive(message = "Max buffer bytes must be positive")
    private long maxBufferBytes = 52_428_800;

    public int getRetentionMinutes() {
        return retentionMinutes;
    }

    public void setRetentionMinutes(int retentionMinutes) {
        this.retentionMinutes = retentionMinutes;
    }

    public int getMaxIdleMinutes() {
        return maxIdleMinutes;
    }

    public void setMaxIdleMinutes(int maxIdleMinutes) {
        this.maxIdleMinutes = maxIdleMinutes;
    }

    public long getReaperIntervalMs() {
        return reaperIntervalMs;
    }

    public void setReaperIntervalMs(long reaperIntervalMs) {
        this.reaperIntervalMs = reaperIntervalMs;
    }

    public long getMaxBufferBytes() {
        return maxBufferBytes;
    }

    public void setMaxBufferBytes(long maxBufferBytes) {
        this.maxBufferBytes = maxBufferBytes;
    }

    public Duration retention() {
        return Duration.ofMinutes(retentionMinutes);
    }

    public Duration maxIdle() {
        return Duration.ofMinutes(maxIdleMinutes);
    }
}
