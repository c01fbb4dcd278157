package com.pitchscope.domain;

import com.pitchscope.exception.InactiveSessionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.pitchscope.testutil.TestSegments.finalSegment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioSessionTest {

    @ParameterizedTest
    @EnumSource(value = SessionStatus.class, names = {"INITIALIZING", "CONNECTED", "RECORDING"})
    void shouldAcceptSegmentsWhileActive(SessionStatus status) {
        AudioSession session = SessionStatusTest.sessionIn(status);

        session.addSegment(finalSegment("a", "hello there", 0.0, 1.0));

        assertThat(session.getTranscript().size()).isEqualTo(1);
        assertThat(session.snapshot().hasTranscripts()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = SessionStatus.class, names = {"STOPPING", "STOPPED", "ERROR"})
    void shouldRejectSegmentsWhenInactiveWithoutChangingTranscript(SessionStatus status) {
        AudioSession session = SessionStatusTest.sessionIn(status);

        assertThatThrownBy(() -> session.addSegment(finalSegment("a", "late words", 0.0, 1.0)))
                .isInstanceOf(InactiveSessionException.class);
        assertThat(session.getTranscript().isEmpty()).isTrue();
    }

    @Test
    void shouldKeepTranscriptSortedByStartTime() {
        AudioSession session = SessionStatusTest.sessionIn(SessionStatus.RECORDING);

        session.addSegment(finalSegment("c", "third", 4.0, 5.0));
        session.addSegment(finalSegment("a", "first", 0.0, 1.0));
        session.addSegment(finalSegment("b", "second", 2.0, 3.0));

        assertThat(session.getTranscript().segments())
                .extracting(TranscriptSegment::id)
                .containsExactly("a", "b", "c");
    }

    @Test
    void shouldRecordErrorMessageAndTimestampFromClock() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        AudioSession session = new AudioSession("s1", "Demo", AudioConfiguration.defaults(), clock);

        session.fail("provider unreachable");

        SessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.status()).isEqualTo(SessionStatus.ERROR);
        assertThat(snapshot.error()).contains("provider unreachable");
        assertThat(snapshot.updatedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(snapshot.sessionName()).isEqualTo("Demo");
    }

    @Test
    void shouldExposeBoundProviderInSnapshot() {
        AudioSession session = new AudioSession("s1", AudioConfiguration.defaults());
        assertThat(session.snapshot().provider()).isEmpty();

        session.bindProvider(new ProviderSession("ext-1", "wss://example/live/1"));

        assertThat(session.snapshot().provider())
                .map(ProviderSession::url)
                .contains("wss://example/live/1");
    }

    @Test
    void audioAcceptanceShouldFollowStatus() {
        AudioSession session = new AudioSession("s1", AudioConfiguration.defaults());
        assertThat(session.canReceiveAudio()).isFalse();
        assertThat(session.isActive()).isTrue();

        session.transitionTo(SessionStatus.CONNECTED);
        assertThat(session.canReceiveAudio()).isTrue();

        session.beginStopping();
        assertThat(session.canReceiveAudio()).isFalse();
        assertThat(session.isActive()).isFalse();
    }
}
