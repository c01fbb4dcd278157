package com.pitchscope.service.session;

import com.pitchscope.config.properties.SessionProperties;
import com.pitchscope.domain.AudioSession;
import com.pitchscope.domain.SessionStatus;
import com.pitchscope.exception.InvalidTransitionException;
import com.pitchscope.service.orchestration.SessionEventPublisher;
import com.pitchscope.service.orchestration.SessionMetricsPublisher;
import com.pitchscope.service.orchestration.event.SessionStatusChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Periodically evicts finished and abandoned sessions from a {@link SessionRegistry}.
 *
 * <p>Terminal sessions are evicted once their last update is older than
 * {@code session.retention-minutes}. Active sessions that have neither changed state nor received
 * audio for longer than {@code session.max-idle-minutes} are cancelled, moved to ERROR and
 * evicted; that transition is published and counted like any other failure. Sessions with a stop
 * in progress are left alone.
 */
public class SessionReaper {

    private static final Logger LOG = LogManager.getLogger(SessionReaper.class);

    private final SessionRegistry registry;
    private final SessionProperties properties;
    private final Clock clock;
    private final SessionEventPublisher events;
    private final SessionMetricsPublisher metricsPublisher;

    public SessionReaper(SessionRegistry registry, SessionProperties properties, Clock clock,
                         SessionEventPublisher events, SessionMetricsPublisher metricsPublisher) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.metricsPublisher = Objects.requireNonNull(metricsPublisher, "metricsPublisher must not be null");
    }

    @Scheduled(fixedDelayString = "${session.reaper-interval-ms:60000}",
            initialDelayString = "${session.reaper-interval-ms:60000}")
    public void reap() {
        int evicted = evictExpired();
        if (evicted > 0) {
            LOG.info("Session reaper evicted {} sessions ({} remain)", evicted, registry.size());
        }
    }

    /**
     * Runs one eviction pass.
     *
     * @return number of sessions removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        Duration retention = properties.retention();
        Duration maxIdle = properties.maxIdle();
        int evicted = 0;

        for (ManagedSession managed : registry.all()) {
            AudioSession session = managed.session();
            SessionStatus status = session.getStatus();

            if (status.isTerminal()) {
                if (Duration.between(session.getUpdatedAt(), now).compareTo(retention) > 0) {
                    registry.remove(managed.sessionId());
                    evicted++;
                }
                continue;
            }
            Duration idle = Duration.between(managed.lastActivity(), now);
            if (!managed.isStopRequested() && idle.compareTo(maxIdle) > 0) {
                managed.cancellation().cancel();
                abandon(managed, "Session abandoned after " + idle.toMinutes() + " idle minutes", now);
                registry.remove(managed.sessionId());
                LOG.warn("Evicted idle session {} (status was {})", managed.sessionId(), status);
                evicted++;
            }
        }
        return evicted;
    }

    private void abandon(ManagedSession managed, String message, Instant now) {
        AudioSession session = managed.session();
        SessionStatus previous;
        synchronized (managed) {
            if (session.getStatus().isTerminal()) {
                return;
            }
            try {
                previous = session.transitionTo(SessionStatus.ERROR, message);
            } catch (InvalidTransitionException e) {
                LOG.debug("Session {} changed state during eviction: {}", managed.sessionId(), e.getMessage());
                return;
            }
        }
        metricsPublisher.recordErrored();
        events.publish(new SessionStatusChangedEvent(managed.sessionId(), previous, SessionStatus.ERROR,
                message, now));
    }
}
