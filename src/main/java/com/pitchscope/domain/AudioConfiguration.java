package com.pitchscope.domain;

import com.pitchscope.exception.ConfigurationException;
import org.json.JSONObject;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable recording profile for a capture session.
 *
 * <p>Besides the raw PCM shape (encoding, sample rate, bit depth, channels), a configuration
 * carries the advanced-feature flags requested from the provider. The realtime channel cannot
 * deliver those annotations, so setting any of them makes the configuration
 * {@linkplain #requiresBatchForFullFidelity() batch-required}.
 *
 * @param encoding              audio encoding
 * @param sampleRate            samples per second (8000, 16000, 22050, 44100 or 48000)
 * @param bitDepth              bits per sample (8, 16, 24 or 32)
 * @param channels              channel count, 1 to 8
 * @param sentimentAnalysis     request sentiment annotations
 * @param emotionAnalysis       request emotion annotations
 * @param summarization         request a document summary
 * @param entityExtraction      request named-entity annotations
 * @param chapterization        request chapter annotations
 * @param speakerIdentification request speaker identification
 * @param translation           request translation into {@code targetLanguage}
 * @param targetLanguage        optional target language code (nullable)
 */
public record AudioConfiguration(
        AudioEncoding encoding,
        int sampleRate,
        int bitDepth,
        int channels,
        boolean sentimentAnalysis,
        boolean emotionAnalysis,
        boolean summarization,
        boolean entityExtraction,
        boolean chapterization,
        boolean speakerIdentification,
        boolean translation,
        String targetLanguage
) {

    public static final int MIN_CHANNELS = 1;
    public static final int MAX_CHANNELS = 8;

    private static final Set<Integer> SUPPORTED_SAMPLE_RATES = Set.of(8000, 16000, 22050, 44100, 48000);
    private static final Set<Integer> SUPPORTED_BIT_DEPTHS = Set.of(8, 16, 24, 32);

    public AudioConfiguration {
        if (encoding == null) {
            throw new ConfigurationException("Encoding must not be null", "encoding");
        }
        if (!SUPPORTED_SAMPLE_RATES.contains(sampleRate)) {
            throw new ConfigurationException("Unsupported sample rate: " + sampleRate, "sampleRate");
        }
        if (!SUPPORTED_BIT_DEPTHS.contains(bitDepth)) {
            throw new ConfigurationException("Unsupported bit depth: " + bitDepth, "bitDepth");
        }
        if (channels < MIN_CHANNELS || channels > MAX_CHANNELS) {
            throw new ConfigurationException(
                    "Channels must be between " + MIN_CHANNELS + " and " + MAX_CHANNELS + ", got: " + channels,
                    "channels");
        }
        if (targetLanguage != null && targetLanguage.isBlank()) {
            targetLanguage = null;
        }
    }

    /** 16 kHz, 16-bit, mono PCM with no advanced features. */
    public static AudioConfiguration defaults() {
        return builder().build();
    }

    /** Mono PCM profile with the annotation set used for pitch analysis. */
    public static AudioConfiguration pitchAnalysis() {
        return builder()
                .sentimentAnalysis(true)
                .emotionAnalysis(true)
                .summarization(true)
                .entityExtraction(true)
                .chapterization(true)
                .build();
    }

    /** Pitch-analysis profile plus speaker identification. */
    public static AudioConfiguration fullIntelligence() {
        return builder()
                .sentimentAnalysis(true)
                .emotionAnalysis(true)
                .summarization(true)
                .entityExtraction(true)
                .chapterization(true)
                .speakerIdentification(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int bytesPerSample() {
        return bitDepth / 8;
    }

    public boolean isMultichannel() {
        return channels > 1;
    }

    /**
     * Estimates the playback duration of raw audio of the given size.
     *
     * @param byteSize audio size in bytes
     * @return duration in seconds
     */
    public double estimateDuration(long byteSize) {
        if (byteSize < 0) {
            throw new IllegalArgumentException("byteSize must be >= 0, got: " + byteSize);
        }
        long samples = byteSize / ((long) bytesPerSample() * channels);
        return (double) samples / sampleRate;
    }

    /**
     * True iff any advanced-feature flag is set. Those annotations are only produced by the
     * batch path.
     */
    public boolean requiresBatchForFullFidelity() {
        return sentimentAnalysis || emotionAnalysis || summarization || entityExtraction || chapterization;
    }

    /**
     * Builds the provider configuration body.
     *
     * @param includeAdvancedFeatures true for batch job submission, false for live sessions
     * @return provider JSON configuration
     */
    public JSONObject toProviderConfig(boolean includeAdvancedFeatures) {
        JSONObject config = new JSONObject();
        config.put("encoding", encoding.wireName());
        config.put("sample_rate", sampleRate);
        config.put("bit_depth", bitDepth);
        config.put("channels", channels);
        if (!includeAdvancedFeatures) {
            return config;
        }
        if (sentimentAnalysis) {
            config.put("sentiment_analysis", true);
        }
        if (emotionAnalysis) {
            config.put("emotion_analysis", true);
        }
        if (speakerIdentification) {
            config.put("speaker_identification", true);
        }
        if (summarization) {
            config.put("summarization", true);
        }
        if (entityExtraction) {
            config.put("named_entity_recognition", true);
        }
        if (chapterization) {
            config.put("chapterization", true);
        }
        if (translation && targetLanguage != null) {
            config.put("translation", true);
            config.put("target_language", targetLanguage);
        }
        return config;
    }

    /**
     * Fluent builder; unset fields default to 16 kHz, 16-bit, mono PCM with no features.
     */
    public static final class Builder {
        private AudioEncoding encoding = AudioEncoding.WAV_PCM;
        private int sampleRate = 16000;
        private int bitDepth = 16;
        private int channels = 1;
        private boolean sentimentAnalysis;
        private boolean emotionAnalysis;
        private boolean summarization;
        private boolean entityExtraction;
        private boolean chapterization;
        private boolean speakerIdentification;
        private boolean translation;
        private String targetLanguage;

        private Builder() {
        }

        public Builder encoding(AudioEncoding encoding) {
            this.encoding = Objects.requireNonNull(encoding, "encoding must not be null");
            return this;
        }

        public Builder sampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder bitDepth(int bitDepth) {
            this.bitDepth = bitDepth;
            return this;
        }

        public Builder channels(int channels) {
            this.channels = channels;
            return this;
        }

        public Builder sentimentAnalysis(boolean enabled) {
            this.sentimentAnalysis = enabled;
            return this;
        }

        public Builder emotionAnalysis(boolean enabled) {
            this.emotionAnalysis = enabled;
            return this;
        }

        public Builder summarization(boolean enabled) {
            this.summarization = enabled;
            return this;
        }

        public Builder entityExtraction(boolean enabled) {
            this.entityExtraction = enabled;
            return this;
        }

        public Builder chapterization(boolean enabled) {
            this.chapterization = enabled;
            return this;
        }

        public Builder speakerIdentification(boolean enabled) {
            this.speakerIdentification = enabled;
            return this;
        }

        public Builder translation(boolean enabled) {
            this.translation = enabled;
            return this;
        }

        public Builder targetLanguage(String targetLanguage) {
            this.targetLanguage = targetLanguage;
            return this;
        }

        public AudioConfiguration build() {
            return new AudioConfiguration(encoding, sampleRate, bitDepth, channels,
                    sentimentAnalysis, emotionAnalysis, summarization, entityExtraction, chapterization,
                    speakerIdentification, translation, targetLanguage);
        }
    }
}
