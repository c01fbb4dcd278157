package com.pitchscope.service.orchestration;

import com.pitchscope.testutil.EventCapturingPublisher;
import com.pitchscope.testutil.RejectingExecutor;
import com.pitchscope.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SessionEventPublisherTest {

    @Test
    void shouldDeliverEventsThroughExecutor() {
        EventCapturingPublisher captured = new EventCapturingPublisher();
        SessionEventPublisher publisher = new SessionEventPublisher(captured, new SyncExecutor());

        boolean queued = publisher.publish("hello");

        assertThat(queued).isTrue();
        assertThat(captured.all()).containsExactly("hello");
    }

    @Test
    void shouldDropEventsWhenExecutorIsSaturated() {
        EventCapturingPublisher captured = new EventCapturingPublisher();
        RejectingExecutor executor = new RejectingExecutor();
        SessionEventPublisher publisher = new SessionEventPublisher(captured, executor);

        boolean queued = publisher.publish("dropped");

        assertThat(queued).isFalse();
        assertThat(executor.rejectedCount()).isEqualTo(1);
        assertThat(captured.all()).isEmpty();
    }

    @Test
    void failingListenerShouldNotReachCaller() {
        ApplicationEventPublisher throwing = event -> {
            throw new IllegalStateException("listener bug");
        };
        SessionEventPublisher publisher = new SessionEventPublisher(throwing, new SyncExecutor());

        assertThatCode(() -> publisher.publish("event")).doesNotThrowAnyException();
    }
}
