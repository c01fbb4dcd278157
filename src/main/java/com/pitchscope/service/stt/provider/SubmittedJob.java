package com.pitchscope.service.stt.provider;

import java.util.Objects;

/**
 * Handle for a batch job accepted by the provider.
 *
 * @param id        provider job id
 * @param resultUrl URL to poll for status and result
 */
public record SubmittedJob(String id, String resultUrl) {
    public SubmittedJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resultUrl, "resultUrl");
    }
}
