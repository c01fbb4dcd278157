package com.pitchscope.service.orchestration;

import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.AudioSession;
import com.pitchscope.domain.IntelligenceAnnotations;
import com.pitchscope.domain.ProviderSession;
import com.pitchscope.domain.SessionSnapshot;
import com.pitchscope.domain.SessionStatus;
import com.pitchscope.domain.TranscriptCollection;
import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.exception.AudioNotAcceptedException;
import com.pitchscope.exception.ConnectionException;
import com.pitchscope.exception.InvalidTransitionException;
import com.pitchscope.exception.PitchScopeException;
import com.pitchscope.exception.ProtocolException;
import com.pitchscope.exception.SessionCancelledException;
import com.pitchscope.exception.SessionFailedException;
import com.pitchscope.exception.TranscriptionTimeoutException;
import com.pitchscope.service.intelligence.AudioIntelligenceExtractor;
import com.pitchscope.service.intelligence.AudioIntelligenceReport;
import com.pitchscope.service.orchestration.event.SessionCompletedEvent;
import com.pitchscope.service.orchestration.event.SessionStatusChangedEvent;
import com.pitchscope.service.orchestration.event.TranscriptSegmentReceivedEvent;
import com.pitchscope.service.scoring.FinalizedSession;
import com.pitchscope.service.scoring.ScoringCollaborator;
import com.pitchscope.service.session.ManagedSession;
import com.pitchscope.service.session.SessionRegistry;
import com.pitchscope.service.stt.batch.BatchOutcome;
import com.pitchscope.service.stt.batch.BatchTranscriptionPipeline;
import com.pitchscope.service.stt.provider.SttProviderClient;
import com.pitchscope.service.stt.streaming.StreamingOutcome;
import com.pitchscope.service.stt.streaming.StreamingTranscriptionChannel;
import com.pitchscope.service.transcript.TranscriptAssembler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Default {@link SessionOrchestrator}: streaming first, batch as fallback, then assembly,
 * analysis and a fire-and-forget scoring handoff.
 *
 * <p><b>Path selection:</b> the realtime channel always runs when a provider session is bound.
 * The batch pipeline runs only when streaming produced no segments at all and the session's
 * configuration requires batch for full fidelity. A failure on either path is recorded and logged
 * and never discards segments already attached to the session; the session still ends STOPPED.
 *
 * <p><b>Failure semantics:</b>
 * <ul>
 *   <li>Cancellation observed during the stop sequence moves the session to ERROR
 *       ("Session cancelled") and rethrows {@link SessionCancelledException}</li>
 *   <li>Any other unexpected exception moves the session to ERROR and is rethrown wrapped in
 *       {@link SessionFailedException}</li>
 *   <li>A failing scoring collaborator is logged and counted; the result is unaffected</li>
 * </ul>
 *
 * <p><b>Configuration:</b> Not annotated as {@code @Component}; see
 * {@link com.pitchscope.config.orchestration.OrchestrationConfig} for bean wiring.
 *
 * @see SessionOrchestratorBuilder
 */
public class DefaultSessionOrchestrator implements SessionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSessionOrchestrator.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String CANCELLED_MESSAGE = "Session cancelled";

    private final SttProviderClient providerClient;
    private final StreamingTranscriptionChannel streamingChannel;
    private final BatchTranscriptionPipeline batchPipeline;
    private final TranscriptAssembler assembler;
    private final AudioIntelligenceExtractor extractor;
    private final ScoringCollaborator scoringCollaborator;
    private final SessionRegistry registry;
    private final SessionEventPublisher events;
    private final SessionMetricsPublisher metricsPublisher;
    private final Executor sessionExecutor;
    private final Executor handoffExecutor;
    private final Clock clock;

    // CHECKSTYLE.OFF: ParameterNumber - Package-private constructor only used by builder
    DefaultSessionOrchestrator(SttProviderClient providerClient,
                               StreamingTranscriptionChannel streamingChannel,
                               BatchTranscriptionPipeline batchPipeline,
                               TranscriptAssembler assembler,
                               AudioIntelligenceExtractor extractor,
                               ScoringCollaborator scoringCollaborator,
                               SessionRegistry registry,
                               SessionEventPublisher events,
                               SessionMetricsPublisher metricsPublisher,
                               Executor sessionExecutor,
                               Executor handoffExecutor,
                               Clock clock) {
        this.providerClient = Objects.requireNonNull(providerClient);
        this.streamingChannel = Objects.requireNonNull(streamingChannel);
        this.batchPipeline = Objects.requireNonNull(batchPipeline);
        this.assembler = Objects.requireNonNull(assembler);
        this.extractor = Objects.requireNonNull(extractor);
        this.scoringCollaborator = Objects.requireNonNull(scoringCollaborator);
        this.registry = Objects.requireNonNull(registry);
        this.events = Objects.requireNonNull(events);
        this.metricsPublisher = Objects.requireNonNull(metricsPublisher);
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor);
        this.handoffExecutor = Objects.requireNonNull(handoffExecutor);
        this.clock = Objects.requireNonNull(clock);
    }
    // CHECKSTYLE.ON: ParameterNumber

    @Override
    public SessionHandle createSession(AudioConfiguration configuration) {
        return createSession(configuration, null);
    }

    @Override
    public SessionHandle createSession(AudioConfiguration configuration, String sessionName) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        String sessionId = UUID.randomUUID().toString();
        String name = sessionName == null || sessionName.isBlank()
                ? "session-" + sessionId.substring(0, 8)
                : sessionName;

        ThreadContext.put(MDC_SESSION_ID, sessionId);
        try {
            AudioSession session = new AudioSession(sessionId, name, configuration, clock);
            registry.register(session);
            LOG.info("Session created: name='{}', encoding={}, sampleRate={}, channels={}, batchRequired={}",
                    name, configuration.encoding().wireName(), configuration.sampleRate(),
                    configuration.channels(), configuration.requiresBatchForFullFidelity());

            boolean streamingAvailable = bindProvider(session);
            move(session, SessionStatus.CONNECTED, null);
            return new SessionHandle(sessionId, name, SessionStatus.CONNECTED, streamingAvailable,
                    session.snapshot().createdAt());
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    private boolean bindProvider(AudioSession session) {
        AudioConfiguration configuration = session.getConfiguration();
        try {
            ProviderSession provider = providerClient.createLiveSession(configuration);
            session.bindProvider(provider);
            return true;
        } catch (ConnectionException | ProtocolException e) {
            if (configuration.requiresBatchForFullFidelity()) {
                LOG.warn("Realtime session unavailable ({}); continuing with batch transcription only",
                        e.getMessage());
                metricsPublisher.recordPathFailure(TranscriptionPath.STREAMING, e);
                return false;
            }
            failQuietly(session, "Provider connection failed: " + e.getMessage());
            metricsPublisher.recordErrored();
            throw e;
        } catch (RuntimeException e) {
            failQuietly(session, "Session setup failed: " + e.getMessage());
            metricsPublisher.recordErrored();
            throw e;
        }
    }

    @Override
    public void feedAudio(String sessionId, byte[] audio) {
        Objects.requireNonNull(audio, "audio must not be null");
        ManagedSession managed = registry.require(sessionId);
        AudioSession session = managed.session();

        synchronized (managed) {
            SessionStatus status = session.getStatus();
            if (!status.canReceiveAudio() || managed.isStopRequested()) {
                throw new AudioNotAcceptedException(sessionId, status);
            }
            managed.appendAudio(audio);
            managed.touch(clock.instant());
            if (status == SessionStatus.CONNECTED) {
                move(session, SessionStatus.RECORDING, null);
            }
        }
    }

    @Override
    public SessionResult stopSession(String sessionId, byte[] finalAudioBlob) {
        ManagedSession managed = registry.require(sessionId);
        AudioSession session = managed.session();

        synchronized (managed) {
            SessionStatus status = session.getStatus();
            if (!status.canTransitionTo(SessionStatus.STOPPING) || !managed.requestStop()) {
                throw new InvalidTransitionException(sessionId, status, SessionStatus.STOPPING);
            }
        }

        ThreadContext.put(MDC_SESSION_ID, sessionId);
        long startNanos = System.nanoTime();
        try {
            SessionResult result = runStopSequence(managed, finalAudioBlob, startNanos);
            handOff(result, session.snapshot().sessionName());
            return result;
        } catch (SessionCancelledException e) {
            LOG.info("Session cancelled during stop");
            failQuietly(session, CANCELLED_MESSAGE);
            metricsPublisher.recordErrored();
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Session stop failed: {}", e.getMessage(), e);
            failQuietly(session, "Stop failed: " + e.getMessage());
            metricsPublisher.recordErrored();
            throw new SessionFailedException(sessionId, e);
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    private SessionResult runStopSequence(ManagedSession managed, byte[] finalAudioBlob, long startNanos) {
        AudioSession session = managed.session();
        String sessionId = session.getSessionId();
        AudioConfiguration configuration = session.getConfiguration();
        byte[] audio = finalAudioBlob != null && finalAudioBlob.length > 0
                ? finalAudioBlob
                : managed.bufferedAudio();
        LOG.info("Stopping session: audioBytes={}, estimatedSeconds={}",
                audio.length, String.format(Locale.ROOT, "%.1f", configuration.estimateDuration(audio.length)));

        TranscriptionPath path = TranscriptionPath.NONE;
        IntelligenceAnnotations annotations = IntelligenceAnnotations.empty();

        List<TranscriptSegment> streamed = runStreaming(managed, audio);
        if (managed.cancellation().isCancelled()) {
            throw new SessionCancelledException(sessionId);
        }
        if (!streamed.isEmpty()) {
            path = TranscriptionPath.STREAMING;
        } else if (configuration.requiresBatchForFullFidelity()) {
            BatchOutcome batch = runBatch(managed, audio);
            if (batch != null && !batch.segments().isEmpty()) {
                for (TranscriptSegment segment : batch.segments()) {
                    session.addSegment(segment);
                    publishSegment(sessionId, segment, TranscriptionPath.BATCH);
                }
                path = TranscriptionPath.BATCH;
            }
            if (batch != null) {
                annotations = batch.annotations();
            }
        } else {
            LOG.info("Streaming produced no segments; batch not required by configuration");
        }

        move(session, SessionStatus.STOPPING, null);
        TranscriptCollection assembled = assembler.merge(List.of(session.getTranscript()));
        session.replaceTranscript(assembled);
        AudioIntelligenceReport report = extractor.extract(assembler.analysisView(assembled), annotations);
        // Last cancellation point; cancelSession observes STOPPED under the same monitor.
        synchronized (managed) {
            if (managed.cancellation().isCancelled()) {
                throw new SessionCancelledException(sessionId);
            }
            move(session, SessionStatus.STOPPED, null);
        }

        long elapsedNanos = System.nanoTime() - startNanos;
        metricsPublisher.recordStopped(path, elapsedNanos);
        events.publish(new SessionCompletedEvent(sessionId, path, assembled.size(),
                report.speech().totalWords(), report.deliveryScore(), Duration.ofNanos(elapsedNanos),
                clock.instant()));
        LOG.info("Session stopped: path={}, segments={}, words={}, deliveryScore={}, elapsedMs={}",
                path, assembled.size(), report.speech().totalWords(), report.deliveryScore(),
                elapsedNanos / 1_000_000L);

        return new SessionResult(session.snapshot(), assembled, report, path, annotations);
    }

    private List<TranscriptSegment> runStreaming(ManagedSession managed, byte[] audio) {
        AudioSession session = managed.session();
        if (session.snapshot().provider().isEmpty()) {
            LOG.debug("No realtime session bound; skipping streaming");
            return List.of();
        }
        try {
            StreamingOutcome outcome = streamingChannel.stream(session, audio, managed.cancellation(),
                    segment -> publishSegment(session.getSessionId(), segment, TranscriptionPath.STREAMING));
            outcome.error()
                    .filter(e -> !(e instanceof SessionCancelledException))
                    .ifPresent(e -> {
                        LOG.warn("Streaming ended with {} after {} segments: {}",
                                outcome.termination(), outcome.segments().size(), e.getMessage());
                        metricsPublisher.recordPathFailure(TranscriptionPath.STREAMING, e);
                    });
            return outcome.segments();
        } catch (ConnectionException | TranscriptionTimeoutException e) {
            LOG.warn("Streaming path failed: {}", e.getMessage());
            metricsPublisher.recordPathFailure(TranscriptionPath.STREAMING, e);
            return List.of();
        }
    }

    /**
     * @return the batch outcome, or {@code null} when the batch path failed
     */
    private BatchOutcome runBatch(ManagedSession managed, byte[] audio) {
        AudioSession session = managed.session();
        LOG.info("Streaming produced no segments; falling back to batch transcription");
        try {
            BatchOutcome outcome = batchPipeline.transcribe(session.getSessionId(), audio,
                    session.getConfiguration(), managed.cancellation());
            LOG.info("Batch transcription finished: job={}, segments={}, polls={}",
                    outcome.jobId(), outcome.segments().size(), outcome.pollAttempts());
            return outcome;
        } catch (SessionCancelledException e) {
            throw e;
        } catch (PitchScopeException e) {
            LOG.warn("Batch path failed: {}", e.getMessage());
            metricsPublisher.recordPathFailure(TranscriptionPath.BATCH, e);
            return null;
        }
    }

    private void handOff(SessionResult result, String sessionName) {
        FinalizedSession finalized = new FinalizedSession(result.sessionId(), sessionName,
                result.transcript(), result.report(), result.snapshot().updatedAt());
        try {
            CompletableFuture.runAsync(() -> scoringCollaborator.onSessionFinalized(finalized), handoffExecutor)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOG.warn("Scoring handoff failed for session {}: {}",
                                    finalized.sessionId(), error.getMessage(), error);
                            metricsPublisher.recordHandoffFailure();
                        }
                    });
        } catch (RejectedExecutionException e) {
            LOG.warn("Scoring handoff rejected for session {}: executor saturated", finalized.sessionId());
            metricsPublisher.recordHandoffFailure();
        }
    }

    @Override
    public CompletableFuture<SessionResult> stopSessionAsync(String sessionId, byte[] finalAudioBlob) {
        return CompletableFuture.supplyAsync(() -> stopSession(sessionId, finalAudioBlob), sessionExecutor);
    }

    @Override
    public boolean cancelSession(String sessionId) {
        ManagedSession managed = registry.find(sessionId).orElse(null);
        if (managed == null) {
            LOG.debug("Cancel requested for unknown session {}", sessionId);
            return false;
        }
        AudioSession session = managed.session();
        synchronized (managed) {
            if (session.getStatus().isTerminal()) {
                return false;
            }
            managed.cancellation().cancel();
            if (!managed.isStopRequested()) {
                failQuietly(session, CANCELLED_MESSAGE);
                metricsPublisher.recordErrored();
            }
        }
        LOG.info("Session {} cancelled", sessionId);
        return true;
    }

    @Override
    public SessionSnapshot getSessionState(String sessionId) {
        return registry.require(sessionId).session().snapshot();
    }

    @Override
    public int activeSessionCount() {
        return (int) registry.activeCount();
    }

    private void move(AudioSession session, SessionStatus target, String errorMessage) {
        SessionStatus previous = session.transitionTo(target, errorMessage);
        LOG.debug("Session {} {} -> {}", session.getSessionId(), previous, target);
        events.publish(new SessionStatusChangedEvent(session.getSessionId(), previous, target,
                errorMessage, clock.instant()));
    }

    private void failQuietly(AudioSession session, String message) {
        if (session.getStatus().isTerminal()) {
            return;
        }
        try {
            move(session, SessionStatus.ERROR, message);
        } catch (InvalidTransitionException e) {
            LOG.debug("Session {} reached a terminal state concurrently: {}", session.getSessionId(), e.getMessage());
        }
    }

    private void publishSegment(String sessionId, TranscriptSegment segment, TranscriptionPath source) {
        events.publish(new TranscriptSegmentReceivedEvent(sessionId, segment, source, clock.instant()));
    }
}
