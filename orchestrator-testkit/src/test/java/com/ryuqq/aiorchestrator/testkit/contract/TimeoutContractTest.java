package com.ryuqq.aiorchestrator.testkit.contract;

import com.ryuqq.aiorchestrator.adapter.runner.OrchestratorConfig;
import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.contract.QueryResponse;
import com.ryuqq.aiorchestrator.core.exception.BackendUnavailableException;
import com.ryuqq.aiorchestrator.core.model.HealthState;
import com.ryuqq.aiorchestrator.core.model.Tier;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: a backend call that exceeds its timeout is a transient failure.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TimeoutContractTest extends AbstractOrchestratorContractTest {

    @Override
    protected OrchestratorConfig config() {
        return new OrchestratorConfig().withDefaultTimeoutMs(300);
    }

    @Test
    void testSlowBackend_TimesOutAsTransient_Degraded() {
        // Given
        register(ModelFixtures.modelA());
        chatBackend.delay(ModelFixtures.MODEL_A, Duration.ofSeconds(5));

        // When
        long start = System.nanoTime();
        assertThrows(BackendUnavailableException.class,
            () -> orchestrator.query(ModelFixtures.chat("hello", Tier.BASIC)));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        // Then
        assertTrue(elapsedMs < 2000, "query should return near its timeout but took " + elapsedMs + " ms");
        assertHealth(ModelFixtures.MODEL_A, HealthState.DEGRADED);
    }

    @Test
    void testSlowBackend_PerRequestTimeoutOverridesDefault() {
        // Given
        register(ModelFixtures.modelA());
        chatBackend.delay(ModelFixtures.MODEL_A, Duration.ofMillis(500));
        QueryRequest request = QueryRequest.builder(new QueryInput.Text("hello"), Tier.BASIC)
            .timeout(Duration.ofSeconds(5))
            .build();

        // When
        QueryResponse response = orchestrator.query(request);

        // Then
        assertServedBy(response, ModelFixtures.MODEL_A);
        assertHealth(ModelFixtures.MODEL_A, HealthState.HEALTHY);
    }

    @Test
    void testSlowBackend_FailsOverWithinRemainingBudget() {
        // Given
        reconfigure(new OrchestratorConfig().withDefaultTimeoutMs(2000));
        register(ModelFixtures.modelA(), ModelFixtures.modelB());
        QueryRequest request = QueryRequest.builder(new QueryInput.Text("hello"), Tier.ADMIN)
            .timeout(Duration.ofMillis(1500))
            .build();
        chatBackend.delay(ModelFixtures.MODEL_A, Duration.ofSeconds(5));

        // When: A exhausts the budget, so no time remains for B
        assertThrows(BackendUnavailableException.class, () -> orchestrator.query(request));

        // Then
        assertEquals(0, chatBackend.invocations(ModelFixtures.MODEL_B));
        assertHealth(ModelFixtures.MODEL_A, HealthState.DEGRADED);
    }
}
