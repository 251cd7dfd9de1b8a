package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.audit.FailureCategory;
import com.flagship.roster_ledger.audit.TransactionLedgerEntry;
import com.flagship.roster_ledger.audit.TransactionLog;
import com.flagship.roster_ledger.audit.TransactionType;
import com.flagship.roster_ledger.expiry.ExpiryTracker;
import com.flagship.roster_ledger.league.LeagueDirectory;
import com.flagship.roster_ledger.outbox.OutboxService;
import com.flagship.roster_ledger.support.LeagueFixture;
import com.flagship.roster_ledger.support.LeagueFixture.Team;
import com.flagship.roster_ledger.waiver.event.ClaimProcessedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

/**
 * Waiver runs against a real PostgreSQL database.
 *
 * Verifies:
 * - claims resolve in policy order, fixed at the start of the run
 * - a contested player goes to the first claim in order; later claims fail
 * - every claim commits on its own; a failed claim does not undo earlier ones
 * - a second run on the same league is a no-op while the first holds the lock
 * - an unexpected error fails only the claim that raised it
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ClaimProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("roster_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("roster.waivers.scheduler.enabled", () -> "false");
    }

    @Autowired
    private ClaimProcessor claimProcessor;

    @SpyBean
    private TransactionLog transactionLog;

    @SpyBean
    private LeagueDirectory leagueDirectory;

    @Autowired
    private ExpiryTracker expiryTracker;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private DataSource dataSource;

    @MockBean
    private StringRedisTemplate redisTemplate;

    private LeagueFixture fixture;
    private Instant base;

    @BeforeEach
    void setUp() {
        fixture = new LeagueFixture(jdbcTemplate);
        base = Instant.now().minus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("WAIVER RUN: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private Team rankedTeam(UUID leagueId, int rank) {
        Team team = fixture.createTeam(leagueId);
        fixture.setPriority(team, rank);
        return team;
    }

    private UUID claim(Team team, String playerId, String dropPlayerId, long secondsAfterBase) {
        return fixture.insertClaim(team, playerId, dropPlayerId, fixture.priorityOf(team),
                base.plusSeconds(secondsAfterBase));
    }

    private List<UUID> claimIds(List<ClaimOutcome> outcomes) {
        return outcomes.stream().map(ClaimOutcome::getClaimId).toList();
    }

    // ========================================================================
    // ORDERING
    // ========================================================================

    @Nested
    @DisplayName("1. Processing order")
    class OrderingTests {

        @Test
        @DisplayName("1.1 Rotating: rank first, then claim time, order fixed for the run")
        void rotating_orderFixedAtStart() {
            printTestHeader("Rotating Order");

            UUID leagueId = fixture.createLeague();
            Team a = rankedTeam(leagueId, 1);
            Team c = rankedTeam(leagueId, 2);
            Team b = rankedTeam(leagueId, 3);

            UUID first = claim(a, "p-a1", null, 0);
            UUID third = claim(b, "p-b", null, 1);
            UUID second = claim(c, "p-c", null, 1);
            UUID last = claim(a, "p-a2", null, 2);

            List<ClaimOutcome> outcomes = claimProcessor.processClaims(leagueId, 100);

            // Team A rotates to the back after its first claim, but its second
            // claim keeps the slot it had when the run started.
            assertEquals(List.of(first, last, second, third), claimIds(outcomes));
            assertTrue(outcomes.stream().allMatch(ClaimOutcome::isSuccessful));
            assertEquals(a.teamId(), fixture.ownerOf(leagueId, "p-a2"));

            printSuccess("Order: A(t0), A(t2), C, B");
        }

        @Test
        @DisplayName("1.2 Contested player: first claim wins, winner rotates, loser fails")
        void contestedPlayer_firstClaimWins() {
            printTestHeader("Contested Player");

            UUID leagueId = fixture.createLeague();
            Team leader = rankedTeam(leagueId, 1);
            Team runnerUp = rankedTeam(leagueId, 2);

            UUID losing = claim(runnerUp, "star", null, 0);
            UUID winning = claim(leader, "star", null, 10);

            List<ClaimOutcome> outcomes = claimProcessor.processClaims(leagueId, 100);

            assertEquals(List.of(winning, losing), claimIds(outcomes));
            assertEquals("SUCCESSFUL", fixture.claimStatus(winning));
            assertEquals("FAILED", fixture.claimStatus(losing));
            assertEquals("Player already rostered", fixture.claimFailureReason(losing));
            assertEquals(FailureCategory.ALREADY_ROSTERED, outcomes.get(1).getFailureCategory());
            assertEquals(leader.teamId(), fixture.ownerOf(leagueId, "star"));

            assertEquals(2, fixture.priorityOf(leader), "Winner moves to the back");
            assertEquals(1, fixture.priorityOf(runnerUp));
            assertEquals(1, fixture.countFailures(leagueId, FailureCategory.ALREADY_ROSTERED.name()));

            printSuccess("Exactly one owner; rotation applied");
        }

        @Test
        @DisplayName("1.3 Reverse standings: worst team first, ranks untouched")
        void reverseStandings_noRotation() {
            UUID leagueId = fixture.createLeague(20, 3, "REVERSE_STANDINGS", 48);
            Team top = rankedTeam(leagueId, 1);
            Team bottom = rankedTeam(leagueId, 2);

            UUID topClaim = claim(top, "star", null, 0);
            UUID bottomClaim = claim(bottom, "star", null, 5);

            List<ClaimOutcome> outcomes = claimProcessor.processClaims(leagueId, 100);

            assertEquals(List.of(bottomClaim, topClaim), claimIds(outcomes));
            assertEquals(bottom.teamId(), fixture.ownerOf(leagueId, "star"));
            assertEquals(1, fixture.priorityOf(top));
            assertEquals(2, fixture.priorityOf(bottom));
        }

        @Test
        @DisplayName("1.4 Batch size limits the run; the rest stays pending")
        void batchSize_limitsRun() {
            UUID leagueId = fixture.createLeague();
            Team team = rankedTeam(leagueId, 1);
            claim(team, "p-1", null, 0);
            claim(team, "p-2", null, 1);
            UUID remaining = claim(team, "p-3", null, 2);

            List<ClaimOutcome> outcomes = claimProcessor.processClaims(leagueId, 2);

            assertEquals(2, outcomes.size());
            assertEquals("PENDING", fixture.claimStatus(remaining));
            assertThrows(IllegalArgumentException.class, () -> claimProcessor.processClaims(leagueId, 0));
        }

        @Test
        @DisplayName("1.5 Cancelled claims are not processed")
        void cancelledClaims_skipped() {
            UUID leagueId = fixture.createLeague();
            Team team = rankedTeam(leagueId, 1);
            UUID cancelled = claim(team, "p-1", null, 0);
            jdbcTemplate.update("UPDATE waiver_claims SET status = 'CANCELLED' WHERE id = ?", cancelled);

            List<ClaimOutcome> outcomes = claimProcessor.processClaims(leagueId, 100);

            assertTrue(outcomes.isEmpty());
            assertEquals("CANCELLED", fixture.claimStatus(cancelled));
            assertEquals(0, fixture.countAssignments(leagueId, "p-1"));
        }
    }

    // ========================================================================
    // CLAIM VALIDATION
    // ========================================================================

    @Nested
    @DisplayName("2. Claim resolution")
    class ResolutionTests {

        @Test
        @DisplayName("2.1 Full roster without a drop fails; with a drop it succeeds")
        void rosterFull() {
            UUID leagueId = fixture.createLeague(2, 0, "ROTATING", 48);
            Team noDrop = rankedTeam(leagueId, 1);
            Team withDrop = rankedTeam(leagueId, 2);
            fixture.fillRoster(noDrop, 2);
            fixture.fillRoster(withDrop, 2);
            String dropped = "filler-" + withDrop.teamId().toString().substring(0, 8) + "-0";

            UUID rejected = claim(noDrop, "p-1", null, 0);
            UUID accepted = claim(withDrop, "p-2", dropped, 0);

            claimProcessor.processClaims(leagueId, 100);

            assertEquals("FAILED", fixture.claimStatus(rejected));
            assertEquals("Roster full - no drop player specified", fixture.claimFailureReason(rejected));
            assertEquals("SUCCESSFUL", fixture.claimStatus(accepted));
            assertEquals(2, fixture.rosterSize(withDrop));
            assertNull(fixture.ownerOf(leagueId, dropped));
            assertTrue(expiryTracker.isOnCooldown(leagueId, dropped), "Dropped player goes on waivers");
        }

        @Test
        @DisplayName("2.2 Drop of a player the team does not own fails without acquiring")
        void dropNotOwned_rolledBackToSavepoint() {
            UUID leagueId = fixture.createLeague();
            Team team = rankedTeam(leagueId, 1);

            UUID claimId = claim(team, "p-1", "ghost", 0);
            List<ClaimOutcome> outcomes = claimProcessor.processClaims(leagueId, 100);

            assertEquals("FAILED", fixture.claimStatus(claimId));
            assertEquals("Player ghost is not on your roster", fixture.claimFailureReason(claimId));
            assertEquals(FailureCategory.NOT_OWNED, outcomes.get(0).getFailureCategory());
            assertEquals(0, fixture.countAssignments(leagueId, "p-1"));
            assertEquals(1, fixture.priorityOf(team), "Failed claims do not rotate");
        }

        @Test
        @DisplayName("2.3 Team without an owner fails")
        void teamWithoutOwner_fails() {
            UUID leagueId = fixture.createLeague();
            Team orphan = fixture.createTeam(leagueId, null);
            fixture.setPriority(orphan, 1);

            UUID claimId = claim(orphan, "p-1", null, 0);
            claimProcessor.processClaims(leagueId, 100);

            assertEquals("FAILED", fixture.claimStatus(claimId));
            assertEquals("Team has no owner", fixture.claimFailureReason(claimId));
            assertEquals(1, fixture.countFailures(leagueId, FailureCategory.NO_TEAM.name()));
        }

        @Test
        @DisplayName("2.4 Claims bypass the waiver window and close it")
        void claim_bypassesCooldown() {
            UUID leagueId = fixture.createLeague();
            Team team = rankedTeam(leagueId, 1);
            jdbcTemplate.update(
                "INSERT INTO player_waiver_status (league_id, player_id, dropped_at) VALUES (?, ?, NOW())",
                leagueId, "p-cool");
            assertTrue(expiryTracker.isOnCooldown(leagueId, "p-cool"));

            UUID claimId = claim(team, "p-cool", null, 0);
            claimProcessor.processClaims(leagueId, 100);

            assertEquals("SUCCESSFUL", fixture.claimStatus(claimId));
            assertEquals(team.teamId(), fixture.ownerOf(leagueId, "p-cool"));
            assertFalse(expiryTracker.isOnCooldown(leagueId, "p-cool"));
        }

        @Test
        @DisplayName("2.5 Successful claims are logged as waiver adds and published")
        void success_logAndEvents() {
            UUID leagueId = fixture.createLeague();
            Team team = rankedTeam(leagueId, 1);
            Team other = rankedTeam(leagueId, 2);
            claim(team, "p-1", null, 0);
            claim(other, "p-1", null, 1);

            claimProcessor.processClaims(leagueId, 100);

            List<TransactionLedgerEntry> entries = transactionLog.findForPlayer(leagueId, "p-1");
            assertEquals(1, entries.size());
            assertEquals(TransactionType.ADD, entries.get(0).getType());
            assertEquals(ClaimProcessor.SOURCE_WAIVERS, entries.get(0).getSource());
            assertEquals(team.ownerId(), entries.get(0).getUserId());

            assertEquals(2, outboxService.getEventsForLeague(leagueId, ClaimProcessedEvent.EVENT_TYPE).size());
        }
    }

    // ========================================================================
    // RUN GUARDS
    // ========================================================================

    @Nested
    @DisplayName("3. Run guards")
    class RunGuardTests {

        @Test
        @DisplayName("3.1 A second run while the league lock is held does nothing")
        void concurrentRun_isNoOp() throws Exception {
            printTestHeader("League Run Lock");

            UUID leagueId = fixture.createLeague();
            Team team = rankedTeam(leagueId, 1);
            UUID claimId = claim(team, "p-1", null, 0);

            try (Connection holder = dataSource.getConnection()) {
                holder.setAutoCommit(false);
                try (PreparedStatement lock = holder.prepareStatement("SELECT pg_advisory_xact_lock(hashtext(?))")) {
                    lock.setString(1, "waivers:" + leagueId);
                    lock.executeQuery().close();
                }

                List<ClaimOutcome> blocked = claimProcessor.processClaims(leagueId, 100);

                assertTrue(blocked.isEmpty());
                assertEquals("PENDING", fixture.claimStatus(claimId));

                holder.rollback();
            }

            List<ClaimOutcome> afterRelease = claimProcessor.processClaims(leagueId, 100);
            assertEquals(1, afterRelease.size());
            assertEquals("SUCCESSFUL", fixture.claimStatus(claimId));

            printSuccess("Locked run skipped; next run processed the claim");
        }

        @Test
        @DisplayName("3.2 Budget-bid leagues are skipped and keep their claims pending")
        void budgetBid_isNoOp() {
            UUID leagueId = fixture.createLeague(20, 3, "BUDGET_BID", 48);
            Team team = rankedTeam(leagueId, 1);
            UUID claimId = claim(team, "p-1", null, 0);

            assertTrue(claimProcessor.processClaims(leagueId, 100).isEmpty());
            assertEquals("PENDING", fixture.claimStatus(claimId));
        }
    }

    // ========================================================================
    // UNEXPECTED FAILURES
    // ========================================================================

    @Nested
    @DisplayName("4. Unexpected failures")
    class UnexpectedFailureTests {

        @Test
        @DisplayName("4.1 An unexpected error fails that claim only; the batch continues")
        void unexpectedError_isolatedToOneClaim() {
            printTestHeader("Unexpected Error Isolation");

            UUID leagueId = fixture.createLeague();
            Team first = rankedTeam(leagueId, 1);
            Team broken = rankedTeam(leagueId, 2);
            Team last = rankedTeam(leagueId, 3);

            UUID before = claim(first, "p-before", null, 0);
            UUID failing = claim(broken, "p-broken", null, 0);
            UUID after = claim(last, "p-after", null, 0);
            doThrow(new DataAccessResourceFailureException("connection reset"))
                    .when(transactionLog).append(eq(leagueId), any(), any(), eq(TransactionType.ADD), eq("p-broken"), any());

            List<ClaimOutcome> outcomes = assertDoesNotThrow(() -> claimProcessor.processClaims(leagueId, 100));

            assertEquals(List.of(before, failing, after), claimIds(outcomes));
            assertTrue(outcomes.get(0).isSuccessful());
            assertFalse(outcomes.get(1).isSuccessful());
            assertEquals(FailureCategory.UNEXPECTED, outcomes.get(1).getFailureCategory());
            assertTrue(outcomes.get(2).isSuccessful());

            assertEquals("SUCCESSFUL", fixture.claimStatus(before));
            assertEquals(first.teamId(), fixture.ownerOf(leagueId, "p-before"), "Earlier commit survives");
            assertEquals("FAILED", fixture.claimStatus(failing));
            assertEquals("Unexpected error: connection reset", fixture.claimFailureReason(failing));
            assertEquals(0, fixture.countAssignments(leagueId, "p-broken"));
            assertEquals("SUCCESSFUL", fixture.claimStatus(after));
            assertEquals(last.teamId(), fixture.ownerOf(leagueId, "p-after"));

            assertEquals(1, fixture.priorityOf(broken), "Failed claim does not rotate; the two winners moved behind it");
            assertEquals(1, fixture.countFailures(leagueId, FailureCategory.UNEXPECTED.name()));

            printSuccess("Failed claim isolated; claims before and after committed");
        }

        @Test
        @DisplayName("4.2 A storage failure before the run returns no outcomes instead of throwing")
        void settingsFailure_returnsEmpty() {
            UUID leagueId = fixture.createLeague();
            Team team = rankedTeam(leagueId, 1);
            UUID claimId = claim(team, "p-1", null, 0);
            doThrow(new DataAccessResourceFailureException("db down"))
                    .when(leagueDirectory).getSettings(leagueId);

            List<ClaimOutcome> outcomes = assertDoesNotThrow(() -> claimProcessor.processClaims(leagueId, 100));

            assertTrue(outcomes.isEmpty());
            assertEquals("PENDING", fixture.claimStatus(claimId));
        }
    }
}
