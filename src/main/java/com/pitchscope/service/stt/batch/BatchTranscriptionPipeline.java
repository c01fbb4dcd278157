package com.pitchscope.service.stt.batch;

import com.pitchscope.config.properties.BatchProperties;
import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.exception.PitchScopeException;
import com.pitchscope.exception.SessionCancelledException;
import com.pitchscope.exception.SizeLimitExceededException;
import com.pitchscope.exception.TranscriptionTimeoutException;
import com.pitchscope.exception.UpstreamJobException;
import com.pitchscope.service.session.CancellationSignal;
import com.pitchscope.service.stt.provider.BatchTranscript;
import com.pitchscope.service.stt.provider.JobStatus;
import com.pitchscope.service.stt.provider.SttProviderClient;
import com.pitchscope.service.stt.provider.SubmittedJob;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Fallback transcription path: upload, submit, then bounded polling.
 *
 * <p>This path returns the provider's advanced annotations (sentiment, entities, summary,
 * chapters) that the realtime channel cannot deliver. Steps:
 * <ol>
 *   <li>Reject audio above {@code stt.batch.max-upload-bytes} without any network call</li>
 *   <li>Upload the blob as multipart form data</li>
 *   <li>Submit a job with the requested feature flags</li>
 *   <li>Poll every {@code stt.batch.poll-interval-ms}, at most {@code stt.batch.max-poll-attempts} times</li>
 * </ol>
 *
 * <p>Errors are terminal for this path and contribute no segments: {@link SizeLimitExceededException},
 * {@link UpstreamJobException}, {@link TranscriptionTimeoutException}, provider connection
 * failures, and {@link SessionCancelledException}. A submitted job is deleted on every exit path
 * when {@code stt.batch.delete-after-completion} is set.
 *
 * @since 1.0
 */
public class BatchTranscriptionPipeline {

    private static final Logger LOG = LogManager.getLogger(BatchTranscriptionPipeline.class);

    private final SttProviderClient client;
    private final BatchProperties properties;

    public BatchTranscriptionPipeline(SttProviderClient client, BatchProperties properties) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Transcribes {@code audio} through the batch API.
     *
     * @param sessionId     owning session, used for file naming and errors
     * @param audio         complete audio blob
     * @param configuration feature flags to request
     * @param cancellation  checked before each step and between polls
     * @return segments (all final) and annotations
     */
    public BatchOutcome transcribe(String sessionId, byte[] audio, AudioConfiguration configuration,
                                   CancellationSignal cancellation) {
        Objects.requireNonNull(audio, "audio must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        if (audio.length > properties.getMaxUploadBytes()) {
            throw new SizeLimitExceededException(audio.length, properties.getMaxUploadBytes());
        }

        checkCancelled(sessionId, cancellation);
        String audioUrl = client.uploadAudio(audio, sessionId + ".wav");

        checkCancelled(sessionId, cancellation);
        SubmittedJob job = client.submitJob(audioUrl, configuration, properties.getLanguage());
        try {
            return poll(sessionId, job, cancellation);
        } finally {
            cleanup(job);
        }
    }

    private BatchOutcome poll(String sessionId, SubmittedJob job, CancellationSignal cancellation) {
        Duration interval = properties.pollInterval();
        int maxAttempts = properties.getMaxPollAttempts();
        long startNanos = System.nanoTime();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            checkCancelled(sessionId, cancellation);
            JobStatus status = client.fetchJob(job);
            LOG.debug("Batch job {} poll {}/{}: {}", job.id(), attempt, maxAttempts, status.state());

            if (status.state() == JobStatus.State.DONE) {
                BatchTranscript transcript = status.transcript()
                        .orElseThrow(() -> new UpstreamJobException("Job finished without a result", job.id()));
                LOG.info("Batch job {} done after {} polls: {} segments", job.id(), attempt,
                        transcript.segments().size());
                return new BatchOutcome(transcript.segments(), transcript.annotations(), job.id(), attempt);
            }
            if (status.state() == JobStatus.State.ERROR) {
                throw new UpstreamJobException("Batch job failed: " + status.errorMessage(), job.id());
            }

            if (attempt < maxAttempts) {
                try {
                    if (cancellation.await(interval)) {
                        throw new SessionCancelledException(sessionId);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SessionCancelledException(sessionId);
                }
            }
        }

        Duration waited = Duration.ofNanos(System.nanoTime() - startNanos);
        LOG.warn("Batch job {} not finished after {} polls", job.id(), maxAttempts);
        throw new TranscriptionTimeoutException("batch", maxAttempts, waited);
    }

    private void cleanup(SubmittedJob job) {
        if (!properties.isDeleteAfterCompletion()) {
            return;
        }
        try {
            client.deleteJob(job);
            LOG.debug("Deleted batch job {}", job.id());
        } catch (PitchScopeException e) {
            LOG.warn("Failed to delete batch job {}: {}", job.id(), e.getMessage());
        }
    }

    private static void checkCancelled(String sessionId, CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            throw new SessionCancelledException(sessionId);
        }
    }
}
