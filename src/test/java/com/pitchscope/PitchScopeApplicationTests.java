package com.pitchscope;

import com.pitchscope.service.orchestration.SessionOrchestrator;
import com.pitchscope.service.session.SessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "stt.provider.api-key=test-key",
        "stt.provider.base-url=http://127.0.0.1:1", // never contacted during context load
        "session.reaper-interval-ms=600000"
    }
)
class PitchScopeApplicationTests {

    @Autowired
    private SessionOrchestrator orchestrator;

    @Autowired
    private SessionRegistry registry;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(orchestrator.activeSessionCount()).isZero();
        assertThat(registry.size()).isZero();
    }
}
