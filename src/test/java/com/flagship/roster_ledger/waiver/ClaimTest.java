package com.flagship.roster_ledger.waiver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ClaimTest {

    private static final Instant NOW = Instant.parse("2024-09-10T08:00:00Z");
    private static final Instant LATER = NOW.plusSeconds(3600);

    private Claim pending() {
        return Claim.submit(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "p-1", "p-2", 3, NOW);
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        void submit_createsPendingClaim() {
            Claim claim = pending();

            assertEquals(ClaimStatus.PENDING, claim.getStatus());
            assertEquals(3, claim.getPriority());
            assertEquals(NOW, claim.getCreatedAt());
            assertNull(claim.getProcessedAt());
            assertTrue(claim.hasDropPlayer());
        }

        @Test
        void submit_blankDropMeansNoDrop() {
            Claim claim = Claim.submit(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), " p-1 ", "  ", 1, NOW);

            assertEquals("p-1", claim.getPlayerId());
            assertNull(claim.getDropPlayerId());
            assertFalse(claim.hasDropPlayer());
        }

        @Test
        void submit_requiresPlayer() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> Claim.submit(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), " ", null, 1, NOW));
            assertEquals("Player to claim is required", e.getMessage());
        }

        @Test
        void submit_rejectsSamePlayer() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> Claim.submit(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "p-1", "p-1", 1, NOW));
            assertEquals("Cannot claim and drop the same player", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void succeed_setsProcessedAt() {
            Claim done = pending().succeed(LATER);

            assertEquals(ClaimStatus.SUCCESSFUL, done.getStatus());
            assertEquals(LATER, done.getProcessedAt());
            assertNull(done.getFailureReason());
            assertTrue(done.isTerminal());
        }

        @Test
        void fail_keepsReason() {
            Claim failed = pending().fail("Player already rostered", LATER);

            assertEquals(ClaimStatus.FAILED, failed.getStatus());
            assertEquals("Player already rostered", failed.getFailureReason());
            assertEquals(LATER, failed.getProcessedAt());
        }

        @Test
        void cancel_isNotProcessing() {
            Claim cancelled = pending().cancel(LATER);

            assertEquals(ClaimStatus.CANCELLED, cancelled.getStatus());
            assertNull(cancelled.getProcessedAt());
            assertEquals(LATER, cancelled.getUpdatedAt());
        }

        @Test
        void terminalClaims_cannotChange() {
            Claim done = pending().succeed(LATER);

            IllegalStateException e = assertThrows(IllegalStateException.class, () -> done.cancel(LATER));
            assertTrue(e.getMessage().contains("Only PENDING claims can change"));
            assertThrows(IllegalStateException.class, () -> done.fail("late", LATER));
            assertThrows(IllegalStateException.class, () -> pending().cancel(NOW).succeed(LATER));
        }

        @Test
        void canTransitionTo() {
            Claim claim = pending();
            Claim done = claim.fail("x", LATER);

            assertTrue(claim.canTransitionTo(ClaimStatus.SUCCESSFUL));
            assertTrue(claim.canTransitionTo(ClaimStatus.CANCELLED));
            assertTrue(done.canTransitionTo(ClaimStatus.FAILED));
            assertFalse(done.canTransitionTo(ClaimStatus.PENDING));
            assertFalse(done.canTransitionTo(ClaimStatus.SUCCESSFUL));
        }
    }
}
