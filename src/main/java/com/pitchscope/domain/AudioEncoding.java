package com.pitchscope.domain;

import com.pitchscope.exception.ConfigurationException;

/**
 * Audio encodings accepted by the transcription provider, with their wire names.
 */
public enum AudioEncoding {
    WAV_PCM("wav/pcm"),
    MP3("mp3"),
    FLAC("flac"),
    OGG("ogg"),
    WEBM("webm");

    private final String wireName;

    AudioEncoding(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves an encoding from its wire name (e.g. {@code "wav/pcm"}).
     *
     * @throws ConfigurationException if the name is not a supported encoding
     */
    public static AudioEncoding fromWireName(String wireName) {
        for (AudioEncoding encoding : values()) {
            if (encoding.wireName.equalsIgnoreCase(wireName)) {
                return encoding;
            }
        }
        throw new ConfigurationException("Unsupported audio encoding: " + wireName, "encoding");
    }
}
