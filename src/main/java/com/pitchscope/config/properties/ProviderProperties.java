package com.pitchscope.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the speech-to-text provider (live sessions, uploads, batch jobs).
 */
@ConfigurationProperties(prefix = "stt.provider")
@Validated
public class ProviderProperties {

    /** API key sent in the {@code X-Gladia-Key} header. */
    private String apiKey = "";

    /** Provider base URL, without trailing slash. */
    @NotBlank(message = "Provider base URL must not be blank")
    private String baseUrl = "https://api.gladia.io";

    @NotBlank
    private String livePath = "/v2/live";

    @NotBlank
    private String uploadPath = "/v2/upload";

    @NotBlank
    private String preRecordedPath = "/v2/pre-recorded";

    /** TCP connect timeout, also the realtime socket open timeout. */
    @Positive(message = "Connect timeout must be positive")
    private long connectTimeoutMs = 10_000;

    /** Whole-call timeout for each HTTP request, including polls. */
    @Positive(message = "Request timeout must be positive")
    private long requestTimeoutMs = 30_000;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getLivePath() {
        return livePath;
    }

    public void setLivePath(String livePath) {
        this.livePath = livePath;
    }

    public String getUploadPath() {
        return uploadPath;
    }

    public void setUploadPath(String uploadPath) {
        this.uploadPath = uploadPath;
    }

    public String getPreRecordedPath() {
        return preRecordedPath;
    }

    public void setPreRecordedPath(String preRecordedPath) {
        this.preRecordedPath = preRecordedPath;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }
}
