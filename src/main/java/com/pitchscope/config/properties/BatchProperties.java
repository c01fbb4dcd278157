package com.pitchscope.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Upload ceiling and polling bounds for the batch transcription pipeline.
 */
@ConfigurationProperties(prefix = "stt.batch")
@Validated
public class BatchProperties {

    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 2000;

    @Positive(message = "Max poll attempts must be positive")
    private int maxPollAttempts = 30;

    /** Audio above this size skips the batch path entirely. */
    @Positive(message = "Max upload bytes must be positive")
    private long maxUploadBytes = 10L * 1024 * 1024;

    /** Delete submitted jobs at the provider once the pipeline is done with them. */
    private boolean deleteAfterCompletion = true;

    /** Optional language hint for batch jobs; blank lets the provider detect it. */
    private String language = "";

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getMaxPollAttempts() {
        return maxPollAttempts;
    }

    public void setMaxPollAttempts(int maxPollAttempts) {
        this.maxPollAttempts = maxPollAttempts;
    }

    public long getMaxUploadBytes() {
        return maxUploadBytes;
    }

    public void setMaxUploadBytes(long maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
    }

    public boolean isDeleteAfterCompletion() {
        return deleteAfterCompletion;
    }

    public void setDeleteAfterCompletion(boolean deleteAfterCompletion) {
        this.deleteAfterCompletion = deleteAfterCompletion;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }
}
