package com.ryuqq.discovery.core.credential;

import com.ryuqq.discovery.core.model.ServiceName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Credential 상태 규칙 테스트.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
class CredentialTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");
    private static final Duration COOLDOWN = Duration.ofMinutes(60);

    private final Credential credential = new Credential(ServiceName.of("Gemini"), 0, "secret-a");

    @Test
    void id_UsesServiceAndOneBasedOrder() {
        assertEquals("gemini-1", credential.getId());
        assertEquals(ServiceName.of("gemini"), credential.getService());
    }

    @Test
    void recordSuccess_ResetsErrorCount() {
        // Given
        credential.recordTransientFailure(NOW, 3);
        credential.recordTransientFailure(NOW, 3);

        // When
        credential.recordSuccess();

        // Then
        assertEquals(0, credential.getConsecutiveErrorCount());
        assertEquals(1, credential.getUsageCount());
    }

    @Test
    void recordTransientFailure_DisablesAtThreshold() {
        // When
        boolean first = credential.recordTransientFailure(NOW, 3);
        boolean second = credential.recordTransientFailure(NOW, 3);
        boolean third = credential.recordTransientFailure(NOW, 3);

        // Then
        assertFalse(first);
        assertFalse(second);
        assertTrue(third);
        assertTrue(credential.isDisabled());
        assertFalse(credential.refreshAndCheckSelectable(NOW, COOLDOWN));
    }

    @Test
    void disabledCredential_ReEnabledAfterCooldown() {
        // Given
        for (int i = 0; i < 3; i++) {
            credential.recordTransientFailure(NOW, 3);
        }

        // When & Then
        assertFalse(credential.refreshAndCheckSelectable(NOW.plus(COOLDOWN).minusSeconds(1), COOLDOWN));
        assertTrue(credential.refreshAndCheckSelectable(NOW.plus(COOLDOWN), COOLDOWN));
        assertFalse(credential.isDisabled());
        assertEquals(0, credential.getConsecutiveErrorCount());
    }

    @Test
    void rateLimited_ClearedWhenWindowExpires() {
        // Given
        credential.recordRateLimited(NOW, COOLDOWN);

        // When & Then
        assertTrue(credential.snapshot(NOW).isRateLimited());
        assertFalse(credential.refreshAndCheckSelectable(NOW.plusSeconds(60), COOLDOWN));
        assertTrue(credential.refreshAndCheckSelectable(NOW.plus(COOLDOWN), COOLDOWN));
        assertNull(credential.getRateLimitedUntil());
    }

    @Test
    void snapshot_NeverExposesSecret() {
        // When
        CredentialStatus status = credential.snapshot(NOW);

        // Then
        assertFalse(status.toString().contains("secret-a"));
        assertTrue(status.isSelectable());
    }

    @Test
    void constructor_BlankSecret_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Credential(ServiceName.of("gemini"), 0, " "));
        assertThrows(IllegalArgumentException.class, () -> new Credential(ServiceName.of("gemini"), -1, "x"));
    }
}
