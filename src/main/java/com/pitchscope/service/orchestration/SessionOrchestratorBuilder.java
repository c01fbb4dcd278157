package com.pitchscope.service.orchestration;

import com.pitchscope.service.intelligence.AudioIntelligenceExtractor;
import com.pitchscope.service.scoring.ScoringCollaborator;
import com.pitchscope.service.session.SessionRegistry;
import com.pitchscope.service.stt.batch.BatchTranscriptionPipeline;
import com.pitchscope.service.stt.provider.SttProviderClient;
import com.pitchscope.service.stt.streaming.StreamingTranscriptionChannel;
import com.pitchscope.service.transcript.TranscriptAssembler;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultSessionOrchestrator}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SessionOrchestrator orchestrator = SessionOrchestratorBuilder.builder()
 *     .providerClient(client)
 *     .streamingChannel(channel)
 *     .batchPipeline(pipeline)
 *     .scoringCollaborator(collaborator)
 *     .eventPublisher(events)
 *     .sessionExecutor(sessionExecutor)
 *     .handoffExecutor(eventExecutor)
 *     .build();
 * }</pre>
 *
 * <p>Optional dependencies fall back to defaults: a fresh {@link TranscriptAssembler}, an
 * {@link AudioIntelligenceExtractor} with the default target pace, a private
 * {@link SessionRegistry}, {@link SessionMetricsPublisher#NOOP} and the UTC system clock.
 */
public final class SessionOrchestratorBuilder {

    // Required dependencies
    private SttProviderClient providerClient;
    private StreamingTranscriptionChannel streamingChannel;
    private BatchTranscriptionPipeline batchPipeline;
    private ScoringCollaborator scoringCollaborator;
    private SessionEventPublisher eventPublisher;
    private Executor sessionExecutor;
    private Executor handoffExecutor;

    // Optional dependencies
    private TranscriptAssembler assembler;
    private AudioIntelligenceExtractor extractor;
    private SessionRegistry registry;
    private SessionMetricsPublisher metricsPublisher;
    private Clock clock;

    private SessionOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static SessionOrchestratorBuilder builder() {
        return new SessionOrchestratorBuilder();
    }

    /**
     * @param providerClient creates realtime sessions (required)
     */
    public SessionOrchestratorBuilder providerClient(SttProviderClient providerClient) {
        this.providerClient = providerClient;
        return this;
    }

    /**
     * @param streamingChannel primary transcription path (required)
     */
    public SessionOrchestratorBuilder streamingChannel(StreamingTranscriptionChannel streamingChannel) {
        this.streamingChannel = streamingChannel;
        return this;
    }

    /**
     * @param batchPipeline fallback transcription path (required)
     */
    public SessionOrchestratorBuilder batchPipeline(BatchTranscriptionPipeline batchPipeline) {
        this.batchPipeline = batchPipeline;
        return this;
    }

    /**
     * @param scoringCollaborator receives each stopped session (required)
     */
    public SessionOrchestratorBuilder scoringCollaborator(ScoringCollaborator scoringCollaborator) {
        this.scoringCollaborator = scoringCollaborator;
        return this;
    }

    /**
     * @param eventPublisher bounded notification channel (required)
     */
    public SessionOrchestratorBuilder eventPublisher(SessionEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
        return this;
    }

    /**
     * @param sessionExecutor runs {@code stopSessionAsync} (required)
     */
    public SessionOrchestratorBuilder sessionExecutor(Executor sessionExecutor) {
        this.sessionExecutor = sessionExecutor;
        return this;
    }

    /**
     * @param handoffExecutor runs the scoring handoff (required)
     */
    public SessionOrchestratorBuilder handoffExecutor(Executor handoffExecutor) {
        this.handoffExecutor = handoffExecutor;
        return this;
    }

    public SessionOrchestratorBuilder assembler(TranscriptAssembler assembler) {
        this.assembler = assembler;
        return this;
    }

    public SessionOrchestratorBuilder extractor(AudioIntelligenceExtractor extractor) {
        this.extractor = extractor;
        return this;
    }

    /**
     * Shares a registry with other components (the reaper). A private registry is created
     * when none is set.
     */
    public SessionOrchestratorBuilder registry(SessionRegistry registry) {
        this.registry = registry;
        return this;
    }

    public SessionOrchestratorBuilder metricsPublisher(SessionMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    public SessionOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if any required dependency is missing
     */
    public DefaultSessionOrchestrator build() {
        Objects.requireNonNull(providerClient, "providerClient is required");
        Objects.requireNonNull(streamingChannel, "streamingChannel is required");
        Objects.requireNonNull(batchPipeline, "batchPipeline is required");
        Objects.requireNonNull(scoringCollaborator, "scoringCollaborator is required");
        Objects.requireNonNull(eventPublisher, "eventPublisher is required");
        Objects.requireNonNull(sessionExecutor, "sessionExecutor is required");
        Objects.requireNonNull(handoffExecutor, "handoffExecutor is required");

        return new DefaultSessionOrchestrator(
                providerClient,
                streamingChannel,
                batchPipeline,
                assembler != null ? assembler : new TranscriptAssembler(),
                extractor != null ? extractor : new AudioIntelligenceExtractor(),
                scoringCollaborator,
                registry != null ? registry : new SessionRegistry(),
                eventPublisher,
                metricsPublisher != null ? metricsPublisher : SessionMetricsPublisher.NOOP,
                sessionExecutor,
                handoffExecutor,
                clock != null ? clock : Clock.systemUTC()
        );
    }
}
