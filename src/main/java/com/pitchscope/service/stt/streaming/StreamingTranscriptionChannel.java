package com.pitchscope.service.stt.streaming;

import com.pitchscope.config.properties.StreamingProperties;
import com.pitchscope.domain.AudioSession;
import com.pitchscope.domain.ProviderSession;
import com.pitchscope.domain.TranscriptSegment;
import com.pitchscope.exception.ConnectionException;
import com.pitchscope.exception.PitchScopeException;
import com.pitchscope.exception.ProtocolException;
import com.pitchscope.exception.SessionCancelledException;
import com.pitchscope.exception.TranscriptionTimeoutException;
import com.pitchscope.service.session.CancellationSignal;
import com.pitchscope.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Primary transcription path: streams audio to the provider's realtime endpoint and collects
 * transcript messages.
 *
 * <p><b>Protocol:</b>
 * <ol>
 *   <li>Connect to the session's bound realtime URL</li>
 *   <li>Send audio as fixed-size binary chunks, paced at a fixed interval</li>
 *   <li>Send {@code {"type":"stop_recording"}}</li>
 *   <li>Read messages until the session ends, the provider reports an error, the connection
 *       drops, the message budget is spent, or too many consecutive reads time out</li>
 * </ol>
 *
 * <p><b>Failure semantics:</b> connect and send failures throw {@link ConnectionException}
 * immediately with no retry. Anything that goes wrong after the receive loop starts is reported
 * in the returned {@link StreamingOutcome} together with every segment gathered so far. The
 * connection is closed on every exit path.
 *
 * @since 1.0
 */
public class StreamingTranscriptionChannel {

    private static final Logger LOG = LogManager.getLogger(StreamingTranscriptionChannel.class);

    static final String STOP_RECORDING = new JSONObject().put("type", "stop_recording").toString();

    private final RealtimeConnector connector;
    private final StreamingProperties properties;

    public StreamingTranscriptionChannel(RealtimeConnector connector, StreamingProperties properties) {
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public StreamingOutcome stream(AudioSession session, byte[] audio, CancellationSignal cancellation) {
        return stream(session, audio, cancellation, segment -> { });
    }

    /**
     * Runs one streaming pass for {@code session}.
     *
     * <p>Each non-empty transcript is attached to the session via
     * {@link AudioSession#addSegment(TranscriptSegment)} and then passed to {@code onSegment}.
     *
     * @param session      session with a bound provider session
     * @param audio        raw audio to send (may be empty)
     * @param cancellation checked between chunks and between reads
     * @param onSegment    notified for each accepted segment
     * @return outcome with segments in arrival order
     * @throws ConnectionException if the session has no provider binding, or connect/send fails
     */
    public StreamingOutcome stream(AudioSession session, byte[] audio, CancellationSignal cancellation,
                                   Consumer<TranscriptSegment> onSegment) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        ProviderSession provider = session.snapshot().provider()
                .orElseThrow(() -> new ConnectionException("No realtime session bound", "realtime"));
        byte[] data = audio == null ? new byte[0] : audio;

        long startNanos = System.nanoTime();
        RealtimeConnection connection = connector.connect(provider.url());
        try {
            if (!sendAudio(connection, data, cancellation)) {
                return cancelled(session, List.of(), 0, 0);
            }
            connection.sendText(STOP_RECORDING);
            LOG.debug("Sent {} bytes of audio and stop_recording to realtime session {}",
                    data.length, provider.externalId());

            StreamingOutcome outcome = receive(session, connection, cancellation, onSegment);
            LOG.info("Streaming finished: termination={}, segments={}, messages={}, malformed={}, elapsedMs={}",
                    outcome.termination(), outcome.segments().size(), outcome.messagesReceived(),
                    outcome.malformedMessages(), (System.nanoTime() - startNanos) / 1_000_000L);
            return outcome;
        } finally {
            connection.close();
        }
    }

    private boolean sendAudio(RealtimeConnection connection, byte[] data, CancellationSignal cancellation) {
        int chunkSize = properties.getChunkSizeBytes();
        Duration interval = properties.chunkInterval();
        for (int offset = 0; offset < data.length; offset += chunkSize) {
            if (cancellation.isCancelled()) {
                return false;
            }
            int end = Math.min(data.length, offset + chunkSize);
            connection.sendBinary(Arrays.copyOfRange(data, offset, end));
            if (end < data.length && waitInterrupted(cancellation, interval)) {
                return false;
            }
        }
        return true;
    }

    private StreamingOutcome receive(AudioSession session, RealtimeConnection connection,
                                     CancellationSignal cancellation, Consumer<TranscriptSegment> onSegment) {
        List<TranscriptSegment> segments = new ArrayList<>();
        int messages = 0;
        int malformed = 0;
        int consecutiveTimeouts = 0;
        Duration readTimeout = properties.readTimeout();

        while (true) {
            if (cancellation.isCancelled()) {
                return cancelled(session, segments, messages, malformed);
            }

            Optional<RealtimeFrame> next;
            try {
                next = connection.receive(readTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(session, segments, messages, malformed);
            }

            if (next.isEmpty()) {
                consecutiveTimeouts++;
                if (consecutiveTimeouts >= properties.getMaxConsecutiveTimeouts()) {
                    LOG.warn("Realtime channel idle for {} consecutive reads", consecutiveTimeouts);
                    PitchScopeException failure = segments.isEmpty()
                            ? new TranscriptionTimeoutException("streaming", consecutiveTimeouts,
                                    readTimeout.multipliedBy(consecutiveTimeouts))
                            : null;
                    return new StreamingOutcome(segments, StreamTermination.IDLE_TIMEOUT, failure, messages, malformed);
                }
                continue;
            }
            consecutiveTimeouts = 0;

            RealtimeFrame frame = next.get();
            if (frame.type() == RealtimeFrame.Type.CLOSED) {
                LOG.warn("Realtime connection closed before session end: {}", frame.payload());
                return new StreamingOutcome(segments, StreamTermination.CONNECTION_CLOSED,
                        new ConnectionException("Realtime connection closed: " + frame.payload(), "realtime"),
                        messages, malformed);
            }
            if (frame.type() == RealtimeFrame.Type.FAILURE) {
                LOG.warn("Realtime connection failed mid-stream: {}", frame.payload());
                return new StreamingOutcome(segments, StreamTermination.CONNECTION_FAILED,
                        new ConnectionException("Realtime connection failed", "realtime", frame.failure()),
                        messages, malformed);
            }

            messages++;
            ProviderMessage message;
            try {
                message = ProviderMessageParser.parse(frame.payload(), messages);
            } catch (ProtocolException e) {
                malformed++;
                LOG.warn("Skipping malformed realtime message #{}: {} (payload: {})",
                        messages, e.getMessage(), LogSanitizer.preview(frame.payload(), 120));
                if (messages >= properties.getMaxMessages()) {
                    return new StreamingOutcome(segments, StreamTermination.MAX_MESSAGES, null, messages, malformed);
                }
                continue;
            }

            switch (message.kind()) {
                case TRANSCRIPT:
                    if (message.segment() != null) {
                        TranscriptSegment segment = message.segment();
                        session.addSegment(segment);
                        segments.add(segment);
                        LOG.debug("Transcript {} final={} text='{}'", segment.id(), segment.isFinal(),
                                LogSanitizer.preview(segment.text(), 60));
                        onSegment.accept(segment);
                    }
                    break;
                case SESSION_ENDS:
                    return new StreamingOutcome(segments, StreamTermination.SESSION_ENDED, null, messages, malformed);
                case ERROR:
                    LOG.warn("Provider reported realtime error: {}", message.errorMessage());
                    return new StreamingOutcome(segments, StreamTermination.PROVIDER_ERROR,
                            new ProtocolException("Provider error: " + message.errorMessage()), messages, malformed);
                case FEATURE_ANNOTATION:
                    LOG.debug("Ignoring realtime annotation message type={}", message.wireType());
                    break;
                default:
                    LOG.debug("Unknown realtime message type={}", message.wireType());
                    break;
            }

            if (messages >= properties.getMaxMessages()) {
                LOG.info("Realtime message budget of {} reached", properties.getMaxMessages());
                return new StreamingOutcome(segments, StreamTermination.MAX_MESSAGES, null, messages, malformed);
            }
        }
    }

    private static StreamingOutcome cancelled(AudioSession session, List<TranscriptSegment> segments,
                                              int messages, int malformed) {
        return new StreamingOutcome(segments, StreamTermination.CANCELLED,
                new SessionCancelledException(session.getSessionId()), messages, malformed);
    }

    private static boolean waitInterrupted(CancellationSignal cancellation, Duration interval) {
        try {
            return cancellation.await(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
