package com.pitchscope.service.orchestration;

import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.SessionSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Drives capture sessions from creation to a scored transcript.
 *
 * <p><b>Session Lifecycle:</b>
 * <ol>
 *   <li>{@link #createSession} registers a session and binds a realtime provider session</li>
 *   <li>{@link #feedAudio} buffers audio; the first call starts recording</li>
 *   <li>{@link #stopSession} transcribes (streaming first, batch fallback), assembles, analyzes
 *       and hands the result to the scoring collaborator</li>
 *   <li>{@link #cancelSession} aborts at any point</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe. Sessions are independent; each
 * one is driven by a single task at a time.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SessionHandle handle = orchestrator.createSession(AudioConfiguration.pitchAnalysis(), "Demo day");
 * orchestrator.feedAudio(handle.sessionId(), pcmChunk);
 * SessionResult result = orchestrator.stopSession(handle.sessionId(), null);
 * double score = result.report().deliveryScore();
 * }</pre>
 */
public interface SessionOrchestrator {

    /**
     * Creates a session with a generated name.
     *
     * @see #createSession(AudioConfiguration, String)
     */
    SessionHandle createSession(AudioConfiguration configuration);

    /**
     * Creates and registers a session, then binds a realtime provider session.
     *
     * <p>If binding fails and the configuration requires the batch path anyway, the session
     * is still created without streaming. Otherwise the session moves to ERROR and the failure
     * propagates.
     *
     * @param configuration audio and feature configuration
     * @param sessionName   display name; generated when blank
     * @return handle for subsequent calls
     * @throws com.pitchscope.exception.ConnectionException if the provider is unreachable
     */
    SessionHandle createSession(AudioConfiguration configuration, String sessionName);

    /**
     * Buffers raw audio for the session. The first call moves CONNECTED to RECORDING.
     *
     * @throws com.pitchscope.exception.SessionNotFoundException  for unknown ids
     * @throws com.pitchscope.exception.AudioNotAcceptedException if the session cannot receive audio
     * @throws com.pitchscope.exception.SizeLimitExceededException if the session's buffer limit would
     *         be exceeded; nothing is buffered and the state is unchanged
     */
    void feedAudio(String sessionId, byte[] audio);

    /**
     * Stops the session and produces its transcript and report.
     *
     * @param sessionId      session to stop
     * @param finalAudioBlob complete recording; when {@code null} or empty the buffered audio is used
     * @return result with a STOPPED snapshot
     * @throws com.pitchscope.exception.SessionNotFoundException    for unknown ids
     * @throws com.pitchscope.exception.InvalidTransitionException  if the session cannot be stopped
     * @throws com.pitchscope.exception.SessionCancelledException   if cancelled while stopping
     * @throws com.pitchscope.exception.SessionFailedException      on any unexpected failure
     */
    SessionResult stopSession(String sessionId, byte[] finalAudioBlob);

    /**
     * Runs {@link #stopSession} on the session executor.
     */
    CompletableFuture<SessionResult> stopSessionAsync(String sessionId, byte[] finalAudioBlob);

    /**
     * Signals cancellation. A session that is not being stopped moves to ERROR immediately; a stop
     * in progress observes the signal at its next suspension point and at the latest just before
     * moving to STOPPED, so an accepted cancellation always ends in ERROR.
     *
     * @return {@code true} if the session existed and was not already terminal
     */
    boolean cancelSession(String sessionId);

    /**
     * @throws com.pitchscope.exception.SessionNotFoundException for unknown ids
     */
    SessionSnapshot getSessionState(String sessionId);

    /**
     * Number of registered sessions in INITIALIZING, CONNECTED or RECORDING.
     */
    int activeSessionCount();
}
