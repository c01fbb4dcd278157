package com.pitchscope.config.orchestration;

import com.pitchscope.config.properties.BatchProperties;
import com.pitchscope.config.properties.IntelligenceProperties;
import com.pitchscope.config.properties.ProviderProperties;
import com.pitchscope.config.properties.SessionProperties;
import com.pitchscope.config.properties.StreamingProperties;
import com.pitchscope.service.intelligence.AudioIntelligenceExtractor;
import com.pitchscope.service.orchestration.SessionEventPublisher;
import com.pitchscope.service.orchestration.SessionMetricsPublisher;
import com.pitchscope.service.orchestration.SessionOrchestrator;
import com.pitchscope.service.orchestration.SessionOrchestratorBuilder;
import com.pitchscope.service.scoring.ScoringCollaborator;
import com.pitchscope.service.session.SessionReaper;
import com.pitchscope.service.session.SessionRegistry;
import com.pitchscope.service.stt.batch.BatchTranscriptionPipeline;
import com.pitchscope.service.stt.provider.GladiaProviderClient;
import com.pitchscope.service.stt.provider.SttProviderClient;
import com.pitchscope.service.stt.streaming.OkHttpRealtimeConnector;
import com.pitchscope.service.stt.streaming.RealtimeConnector;
import com.pitchscope.service.stt.streaming.StreamingTranscriptionChannel;
import com.pitchscope.service.transcript.TranscriptAssembler;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the provider clients, both transcription paths and the session orchestrator explicitly.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public Clock sessionClock() {
        return Clock.systemUTC();
    }

    /**
     * Shared HTTP client. The call timeout bounds every REST request; WebSocket reads are
     * bounded by the streaming read timeout instead.
     */
    @Bean
    public OkHttpClient providerHttpClient(ProviderProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .callTimeout(properties.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(properties.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Bean
    public SttProviderClient sttProviderClient(OkHttpClient providerHttpClient, ProviderProperties properties) {
        return new GladiaProviderClient(providerHttpClient, properties);
    }

    @Bean
    public RealtimeConnector realtimeConnector(OkHttpClient providerHttpClient, ProviderProperties properties) {
        // Streaming reads must not be cut off by the REST timeouts.
        OkHttpClient socketClient = providerHttpClient.newBuilder()
                .callTimeout(0, TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();
        return new OkHttpRealtimeConnector(socketClient, Duration.ofMillis(properties.getConnectTimeoutMs()));
    }

    @Bean
    public StreamingTranscriptionChannel streamingTranscriptionChannel(RealtimeConnector realtimeConnector,
                                                                       StreamingProperties properties) {
        return new StreamingTranscriptionChannel(realtimeConnector, properties);
    }

    @Bean
    public BatchTranscriptionPipeline batchTranscriptionPipeline(SttProviderClient sttProviderClient,
                                                                 BatchProperties properties) {
        return new BatchTranscriptionPipeline(sttProviderClient, properties);
    }

    @Bean
    public TranscriptAssembler transcriptAssembler() {
        return new TranscriptAssembler();
    }

    @Bean
    public AudioIntelligenceExtractor audioIntelligenceExtractor(IntelligenceProperties properties) {
        return new AudioIntelligenceExtractor(properties.getTargetWpm());
    }

    @Bean
    public SessionRegistry sessionRegistry(SessionProperties properties) {
        return new SessionRegistry(properties.getMaxBufferBytes());
    }

    @Bean
    public SessionReaper sessionReaper(SessionRegistry sessionRegistry, SessionProperties properties,
                                       Clock sessionClock, SessionEventPublisher sessionEventPublisher,
                                       SessionMetricsPublisher sessionMetricsPublisher) {
        return new SessionReaper(sessionRegistry, properties, sessionClock, sessionEventPublisher,
                sessionMetricsPublisher);
    }

    @Bean
    public SessionEventPublisher sessionEventPublisher(ApplicationEventPublisher publisher,
                                                       @Qualifier("eventExecutor") Executor eventExecutor) {
        return new SessionEventPublisher(publisher, eventExecutor);
    }

    // CHECKSTYLE.OFF: ParameterNumber - bean method mirrors the builder
    @Bean
    public SessionOrchestrator sessionOrchestrator(SttProviderClient sttProviderClient,
                                                   StreamingTranscriptionChannel streamingTranscriptionChannel,
                                                   BatchTranscriptionPipeline batchTranscriptionPipeline,
                                                   TranscriptAssembler transcriptAssembler,
                                                   AudioIntelligenceExtractor audioIntelligenceExtractor,
                                                   ScoringCollaborator scoringCollaborator,
                                                   SessionRegistry sessionRegistry,
                                                   SessionEventPublisher sessionEventPublisher,
                                                   SessionMetricsPublisher sessionMetricsPublisher,
                                                   @Qualifier("sessionExecutor") Executor sessionExecutor,
                                                   @Qualifier("eventExecutor") Executor eventExecutor,
                                                   Clock sessionClock) {
        return SessionOrchestratorBuilder.builder()
                .providerClient(sttProviderClient)
                .streamingChannel(streamingTranscriptionChannel)
                .batchPipeline(batchTranscriptionPipeline)
                .assembler(transcriptAssembler)
                .extractor(audioIntelligenceExtractor)
                .scoringCollaborator(scoringCollaborator)
                .registry(sessionRegistry)
                .eventPublisher(sessionEventPublisher)
                .metricsPublisher(sessionMetricsPublisher)
                .sessionExecutor(sessionExecutor)
                .handoffExecutor(eventExecutor)
                .clock(sessionClock)
                .build();
    }
    // CHECKSTYLE.ON: ParameterNumber
}
