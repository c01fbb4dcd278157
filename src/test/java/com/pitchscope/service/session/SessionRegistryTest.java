package com.pitchscope.service.session;

import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.AudioSession;
import com.pitchscope.domain.SessionStatus;
import com.pitchscope.exception.SessionNotFoundException;
import com.pitchscope.exception.SizeLimitExceededException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void shouldRegisterAndFindSessions() {
        ManagedSession managed = registry.register(new AudioSession("s1", AudioConfiguration.defaults()));

        assertThat(registry.find("s1")).containsSame(managed);
        assertThat(registry.require("s1")).isSameAs(managed);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateIds() {
        registry.register(new AudioSession("s1", AudioConfiguration.defaults()));

        assertThatThrownBy(() -> registry.register(new AudioSession("s1", AudioConfiguration.defaults())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void requireShouldThrowForUnknownId() {
        assertThatThrownBy(() -> registry.require("missing"))
                .isInstanceOf(SessionNotFoundException.class)
                .satisfies(e -> assertThat(((SessionNotFoundException) e).getSessionId()).isEqualTo("missing"));
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void shouldCountOnlyActiveSessions() {
        registry.register(new AudioSession("idle", AudioConfiguration.defaults()));
        AudioSession failed = new AudioSession("failed", AudioConfiguration.defaults());
        failed.fail("boom");
        registry.register(failed);

        assertThat(registry.activeCount()).isEqualTo(1);
        assertThat(registry.all()).hasSize(2);
    }

    @Test
    void separateRegistriesShouldNotShareSessions() {
        SessionRegistry other = new SessionRegistry();
        registry.register(new AudioSession("s1", AudioConfiguration.defaults()));

        assertThat(other.find("s1")).isEmpty();
    }

    @Test
    void removeShouldReturnEvictedSession() {
        registry.register(new AudioSession("s1", AudioConfiguration.defaults()));

        assertThat(registry.remove("s1")).isPresent();
        assertThat(registry.remove("s1")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void managedSessionShouldBufferAudioAndGuardStop() {
        AudioSession session = new AudioSession("s1", AudioConfiguration.defaults());
        session.transitionTo(SessionStatus.CONNECTED);
        ManagedSession managed = registry.register(session);

        managed.appendAudio(new byte[]{1, 2});
        managed.appendAudio(new byte[]{3});

        assertThat(managed.bufferedAudio()).containsExactly(1, 2, 3);
        assertThat(managed.bufferedBytes()).isEqualTo(3);
        assertThat(managed.requestStop()).isTrue();
        assertThat(managed.requestStop()).isFalse();
        assertThat(managed.isStopRequested()).isTrue();
    }

    @Test
    void shouldRejectAudioBeyondBufferLimitWithoutBuffering() {
        // Arrange
        SessionRegistry small = new SessionRegistry(4);
        ManagedSession managed = small.register(new AudioSession("s1", AudioConfiguration.defaults()));
        managed.appendAudio(new byte[]{1, 2, 3});

        // Act / Assert
        assertThatThrownBy(() -> managed.appendAudio(new byte[]{4, 5}))
                .isInstanceOf(SizeLimitExceededException.class)
                .satisfies(e -> {
                    SizeLimitExceededException ex = (SizeLimitExceededException) e;
                    assertThat(ex.getSize()).isEqualTo(5);
                    assertThat(ex.getLimit()).isEqualTo(4);
                });
        assertThat(managed.bufferedAudio()).containsExactly(1, 2, 3);

        managed.appendAudio(new byte[]{4});
        assertThat(managed.bufferedBytes()).isEqualTo(4);
        assertThat(managed.maxBufferBytes()).isEqualTo(4);
    }

    @Test
    void shouldUseDefaultBufferLimitAndRejectNonPositiveLimits() {
        ManagedSession managed = registry.register(new AudioSession("s1", AudioConfiguration.defaults()));

        assertThat(managed.maxBufferBytes()).isEqualTo(SessionRegistry.DEFAULT_MAX_BUFFER_BYTES);
        assertThatThrownBy(() -> new SessionRegistry(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
