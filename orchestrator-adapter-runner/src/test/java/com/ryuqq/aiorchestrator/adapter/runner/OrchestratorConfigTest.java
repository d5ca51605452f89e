package com.ryuqq.aiorchestrator.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestratorConfigTest {

    @Test
    void 기본값() {
        // when
        OrchestratorConfig config = new OrchestratorConfig();

        // then
        assertThat(config.failureThreshold()).isEqualTo(3);
        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.dispatchConcurrency()).isEqualTo(16);
        assertThat(config.selectionPolicy()).isEqualTo(SelectionPolicy.LEAST_PRIVILEGE);
    }

    @Test
    void withX_해당_값만_변경() {
        // when
        OrchestratorConfig config = new OrchestratorConfig()
            .withFailureThreshold(5)
            .withSelectionPolicy(SelectionPolicy.REGISTRY_ORDER);

        // then
        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.selectionPolicy()).isEqualTo(SelectionPolicy.REGISTRY_ORDER);
        assertThat(config.defaultTimeoutMs()).isEqualTo(60000);
    }

    @Test
    void 생성_실패_failureThreshold_0() {
        assertThatThrownBy(() -> new OrchestratorConfig().withFailureThreshold(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("failureThreshold must be positive (current: 0)");
    }

    @Test
    void 생성_실패_음수_타임아웃() {
        assertThatThrownBy(() -> new OrchestratorConfig().withDefaultTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 생성_실패_null_selectionPolicy() {
        assertThatThrownBy(() -> new OrchestratorConfig().withSelectionPolicy(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("selectionPolicy cannot be null");
    }
}
