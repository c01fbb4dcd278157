package com.pitchscope.service.events;

import com.pitchscope.domain.SessionStatus;
import com.pitchscope.service.orchestration.event.SessionCompletedEvent;
import com.pitchscope.service.orchestration.event.SessionStatusChangedEvent;
import com.pitchscope.service.orchestration.event.TranscriptSegmentReceivedEvent;
import com.pitchscope.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs session notifications. Transcript text is truncated and repeated session errors with the
 * same message are throttled to avoid log spam.
 */
@Component
class SessionEventsListener {
    private static final Logger LOG = LogManager.getLogger(SessionEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private static final int PREVIEW_LENGTH = 80;

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    SessionEventsListener() {
        this(Clock.systemUTC());
    }

    SessionEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onStatusChanged(SessionStatusChangedEvent e) {
        if (e.current() == SessionStatus.ERROR) {
            String key = "session-error-" + e.errorMessage();
            if (shouldLog(key)) {
                LOG.warn("Session {} failed ({} -> ERROR): {}", e.sessionId(), e.previous(), e.errorMessage());
            }
            return;
        }
        LOG.debug("Session {} status {} -> {}", e.sessionId(), e.previous(), e.current());
    }

    @EventListener
    void onSegment(TranscriptSegmentReceivedEvent e) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Session {} {} segment via {}: '{}'", e.sessionId(),
                    e.segment().isFinal() ? "final" : "interim", e.source(),
                    LogSanitizer.preview(e.segment().text(), PREVIEW_LENGTH));
        }
    }

    @EventListener
    void onCompleted(SessionCompletedEvent e) {
        LOG.info("Session {} completed via {}: segments={}, words={}, deliveryScore={}, elapsedMs={}",
                e.sessionId(), e.path(), e.segmentCount(), e.wordCount(), e.deliveryScore(),
                e.elapsed().toMillis());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
