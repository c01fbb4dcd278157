package com.pitchscope.service.session;

import com.pitchscope.domain.AudioSession;
import com.pitchscope.exception.SessionNotFoundException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions owned by one orchestrator instance, keyed by session id.
 *
 * <p>Each orchestrator gets its own registry; nothing here is static.
 */
public class SessionRegistry {

    /** Default per-session audio buffer limit (50 MB). */
    public static final long DEFAULT_MAX_BUFFER_BYTES = 50L * 1024 * 1024;

    private final Map<String, ManagedSession> sessions = new ConcurrentHashMap<>();
    private final long maxBufferBytes;

    public SessionRegistry() {
        this(DEFAULT_MAX_BUFFER_BYTES);
    }

    /**
     * @param maxBufferBytes audio buffer limit applied to every registered session
     */
    public SessionRegistry(long maxBufferBytes) {
        if (maxBufferBytes <= 0) {
            throw new IllegalArgumentException("maxBufferBytes must be positive: " + maxBufferBytes);
        }
        this.maxBufferBytes = maxBufferBytes;
    }

    public ManagedSession register(AudioSession session) {
        ManagedSession managed = new ManagedSession(session, maxBufferBytes);
        if (sessions.putIfAbsent(session.getSessionId(), managed) != null) {
            throw new IllegalStateException("Session already registered: " + session.getSessionId());
        }
        return managed;
    }

    public Optional<ManagedSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException if no session has this id
     */
    public ManagedSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<ManagedSession> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public Collection<ManagedSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public long activeCount() {
        return sessions.values().stream().filter(m -> m.session().isActive()).count();
    }
}
