package com.pitchscope.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers session notifications to Spring listeners off the session's own thread.
 *
 * <p>Each event is handed to a bounded executor. If the executor rejects the task the event is
 * dropped with a warning; if a listener throws, the exception is logged. Neither case reaches the
 * caller, so notification delivery can never change a session's state.
 *
 * @see com.pitchscope.config.ThreadPoolConfig
 */
public class SessionEventPublisher {

    private static final Logger LOG = LogManager.getLogger(SessionEventPublisher.class);

    private final ApplicationEventPublisher publisher;
    private final Executor executor;

    public SessionEventPublisher(ApplicationEventPublisher publisher, Executor executor) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Queues {@code event} for delivery.
     *
     * @return {@code false} if the event was dropped because the executor is saturated
     */
    public boolean publish(Object event) {
        Objects.requireNonNull(event, "event must not be null");
        try {
            executor.execute(() -> deliver(event));
            return true;
        } catch (RejectedExecutionException e) {
            LOG.warn("Notification queue full, dropping {}", event.getClass().getSimpleName());
            return false;
        }
    }

    private void deliver(Object event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
