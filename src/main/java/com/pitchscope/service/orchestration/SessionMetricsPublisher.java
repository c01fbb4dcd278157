package com.pitchscope.service.orchestration;

import com.pitchscope.exception.ConnectionException;
import com.pitchscope.exception.PitchScopeException;
import com.pitchscope.exception.ProtocolException;
import com.pitchscope.exception.SizeLimitExceededException;
import com.pitchscope.exception.TranscriptionTimeoutException;
import com.pitchscope.exception.UpstreamJobException;
import com.pitchscope.service.metrics.SessionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Centralizes session metrics recording for the orchestrator.
 *
 * <p><b>Null Safety:</b> All methods tolerate a missing {@link SessionMetrics}, so the
 * orchestrator runs without a meter registry in tests.
 *
 * @see SessionMetrics
 */
@Component
public final class SessionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(SessionMetricsPublisher.class);

    /**
     * No-op instance used as the builder default.
     */
    public static final SessionMetricsPublisher NOOP = new SessionMetricsPublisher(null);

    private final SessionMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public SessionMetricsPublisher(SessionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("SessionMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a session that reached STOPPED.
     *
     * @param path          path that produced the transcript
     * @param durationNanos stop sequence duration
     */
    public void recordStopped(TranscriptionPath path, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordStopLatency(path.tag(), durationNanos);
        metrics.incrementCompleted("stopped");
        metrics.incrementPath(path.tag());
    }

    public void recordErrored() {
        if (metrics == null) {
            return;
        }
        metrics.incrementCompleted("error");
    }

    /**
     * Records a failure on one transcription path.
     *
     * @param path    streaming or batch
     * @param failure the failure, categorized by type
     */
    public void recordPathFailure(TranscriptionPath path, PitchScopeException failure) {
        if (metrics == null) {
            return;
        }
        metrics.incrementPathFailure(path.tag(), categorize(failure));
    }

    public void recordHandoffFailure() {
        if (metrics == null) {
            return;
        }
        metrics.incrementHandoffFailure();
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    static String categorize(PitchScopeException failure) {
        if (failure instanceof ConnectionException) {
            return "connection";
        }
        if (failure instanceof TranscriptionTimeoutException) {
            return "timeout";
        }
        if (failure instanceof ProtocolException) {
            return "protocol";
        }
        if (failure instanceof UpstreamJobException) {
            return "upstream";
        }
        if (failure instanceof SizeLimitExceededException) {
            return "size_limit";
        }
        return "unexpected";
    }
}
