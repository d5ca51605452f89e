package com.ryuqq.aiorchestrator.core.outcome;

import com.ryuqq.aiorchestrator.core.exception.ErrorKind;
import com.ryuqq.aiorchestrator.core.exception.PermissionDeniedException;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.Tier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fail Record 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FailTest {

    @Test
    void constructor_ValidValues_CreatesFail() {
        // When
        Fail fail = new Fail(ErrorKind.BACKEND_UNAVAILABLE, "llama2 timed out");

        // Then
        assertEquals(ErrorKind.BACKEND_UNAVAILABLE, fail.kind());
        assertEquals("BACKEND-503", fail.errorCode());
        assertTrue(fail.isFail());
        assertFalse(fail.isOk());
    }

    @Test
    void constructor_NullKind_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Fail(null, "message")
        );
        assertTrue(exception.getMessage().contains("kind cannot be null"));
    }

    @Test
    void constructor_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Fail(ErrorKind.UNKNOWN_MODEL, " "));
    }

    @Test
    void from_Exception_CopiesKindAndMessage() {
        // Given
        PermissionDeniedException exception = new PermissionDeniedException(ModelId.of("gpt-4"), Tier.GUEST, Tier.ADMIN);

        // When
        Fail fail = Fail.from(exception);

        // Then
        assertEquals(ErrorKind.PERMISSION_DENIED, fail.kind());
        assertEquals("TIER-403", fail.errorCode());
        assertTrue(fail.message().contains("gpt-4"));
    }
}
