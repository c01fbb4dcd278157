package com.pitchscope.service.stt.provider;

import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.ProviderSession;
import com.pitchscope.exception.ConnectionException;
import com.pitchscope.exception.ProtocolException;

/**
 * HTTP operations against the speech-to-text provider.
 *
 * <p>Every method throws {@link ConnectionException} when the provider is unreachable or returns
 * a non-success status, and {@link ProtocolException} when a response body is missing required
 * fields.
 */
public interface SttProviderClient {

    /**
     * Opens a live session for realtime streaming.
     *
     * @param configuration audio shape; advanced features are not sent
     * @return external session id and realtime URL
     */
    ProviderSession createLiveSession(AudioConfiguration configuration);

    /**
     * Uploads an audio blob as multipart form data.
     *
     * @return provider reference to the uploaded content ({@code audio_url})
     */
    String uploadAudio(byte[] audio, String fileName);

    /**
     * Submits an asynchronous transcription job for uploaded content.
     *
     * @param audioUrl      content reference from {@link #uploadAudio(byte[], String)}
     * @param configuration feature flags to request
     * @param language      language hint (nullable)
     */
    SubmittedJob submitJob(String audioUrl, AudioConfiguration configuration, String language);

    /**
     * Fetches the current state of a submitted job.
     */
    JobStatus fetchJob(SubmittedJob job);

    /**
     * Deletes a job and its stored artifacts at the provider.
     */
    void deleteJob(SubmittedJob job);
}
