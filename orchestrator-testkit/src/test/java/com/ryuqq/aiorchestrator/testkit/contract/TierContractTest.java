package com.ryuqq.aiorchestrator.testkit.contract;

import com.ryuqq.aiorchestrator.core.exception.PermissionDeniedException;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.Tier;
import com.ryuqq.aiorchestrator.core.permission.TierChecker;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: tier authorization.
 *
 * <p>A caller may use a model if and only if its tier is at least the model's required tier.
 * Undefined tier levels are denied.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TierContractTest extends AbstractOrchestratorContractTest {

    private final TierChecker tierChecker = new TierChecker();

    @Test
    void testAuthorize_EveryTierPair_AllowedIffCallerAtLeastRequired() {
        for (Tier required : Tier.values()) {
            ModelDescriptor descriptor = ModelFixtures.chatModel("m-" + required.level(), required);
            for (Tier caller : Tier.values()) {
                assertEquals(caller.level() >= required.level(), tierChecker.authorize(caller, descriptor),
                    String.format("caller %s vs required %s", caller, required));
            }
        }
    }

    @Test
    void testExplicitQuery_EveryTierPair_MatchesAuthorize() {
        // Given: one chat model per tier
        for (Tier required : Tier.values()) {
            register(ModelFixtures.chatModel("m-" + required.level(), required));
        }

        // When / Then
        for (Tier required : Tier.values()) {
            ModelId modelId = ModelId.of("m-" + required.level());
            for (Tier caller : Tier.values()) {
                if (caller.isAtLeast(required)) {
                    assertServedBy(orchestrator.query(ModelFixtures.explicit(modelId, "hi", caller)), modelId);
                } else {
                    PermissionDeniedException denied = assertThrows(PermissionDeniedException.class,
                        () -> orchestrator.query(ModelFixtures.explicit(modelId, "hi", caller)));
                    assertEquals(required, denied.requiredTier());
                    assertEquals(caller, denied.callerTier());
                }
            }
        }
    }

    @Test
    void testAuthorize_UndefinedLevel_FailsClosed() {
        // Given
        ModelDescriptor guestModel = ModelFixtures.chatModel("open", Tier.GUEST);

        // When / Then
        assertFalse(tierChecker.authorize(-1, guestModel));
        assertFalse(tierChecker.authorize(5, guestModel));
        assertTrue(tierChecker.authorize(0, guestModel));
    }
}
