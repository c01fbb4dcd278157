package com.pitchscope.domain;

import java.util.Objects;

/**
 * Reference to a live session opened at the transcription provider.
 *
 * @param externalId provider-assigned session id
 * @param url        realtime endpoint for this session
 */
public record ProviderSession(String externalId, String url) {
    public ProviderSession {
        Objects.requireNonNull(externalId, "externalId");
        Objects.requireNonNull(url, "url");
    }
}
