package com.pitchscope.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for capture sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Session completions by final status</li>
 *   <li>Which transcription path produced the transcript</li>
 *   <li>Streaming and batch path failures by reason</li>
 *   <li>Scoring handoff failures</li>
 *   <li>Stop-sequence latency</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "pitchscope.session";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStopLatency(String path, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stop.latency")
                .description("Time taken to stop a session and produce its report")
                .tag("path", path)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCompleted(String status) {
        Counter.builder(METRIC_PREFIX + ".completed")
                .description("Number of sessions reaching a terminal status")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void incrementPath(String path) {
        Counter.builder(METRIC_PREFIX + ".path")
                .description("Transcription path that produced the final transcript")
                .tag("path", path)
                .register(registry)
                .increment();
    }

    /**
     * @param path   streaming or batch
     * @param reason failure category (connection, timeout, upstream, size_limit, ...)
     */
    public void incrementPathFailure(String path, String reason) {
        Counter.builder(METRIC_PREFIX + "." + path + ".failure")
                .description("Number of transcription path failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementHandoffFailure() {
        Counter.builder(METRIC_PREFIX + ".handoff.failure")
                .description("Number of failed or dropped scoring handoffs")
                .register(registry)
                .increment();
    }
}
