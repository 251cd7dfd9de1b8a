package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.support.LeagueFixture;
import com.flagship.roster_ledger.support.LeagueFixture.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ClaimServiceTest {

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
    private ClaimService claimService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private LeagueFixture fixture;
    private UUID leagueId;
    private Team team;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        fixture = new LeagueFixture(jdbcTemplate);
        leagueId = fixture.createLeague();
        team = fixture.createTeam(leagueId);
        fixture.setPriority(team, 4);
    }

    private String key() {
        return "claim-" + UUID.randomUUID();
    }

    @Nested
    @DisplayName("1. Submission")
    class SubmissionTests {

        @Test
        @DisplayName("1.1 New claim is pending with the team's current rank")
        void submit_snapshotsPriority() {
            SubmittedClaim submitted = claimService.submitClaim(leagueId, team.teamId(), "p-1", "p-2", null);

            assertTrue(submitted.isCreated());
            Claim claim = submitted.getClaim();
            assertEquals(ClaimStatus.PENDING, claim.getStatus());
            assertEquals(4, claim.getPriority());
            assertEquals("p-2", claim.getDropPlayerId());
            assertEquals("PENDING", fixture.claimStatus(claim.getId()));
        }

        @Test
        @DisplayName("1.2 Team from another league is rejected")
        void submit_foreignTeam_rejected() {
            UUID otherLeague = fixture.createLeague();

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> claimService.submitClaim(otherLeague, team.teamId(), "p-1", null, null));
            assertTrue(e.getMessage().contains("does not belong to league"));
        }

        @Test
        @DisplayName("1.3 Team without a waiver rank is rejected")
        void submit_unrankedTeam_rejected() {
            Team unranked = fixture.createTeam(leagueId);

            assertThrows(IllegalStateException.class,
                    () -> claimService.submitClaim(leagueId, unranked.teamId(), "p-1", null, null));
        }

        @Test
        @DisplayName("1.4 Claiming and dropping the same player is rejected")
        void submit_samePlayer_rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> claimService.submitClaim(leagueId, team.teamId(), "p-1", "p-1", null));
            assertTrue(claimService.findPendingClaims(leagueId, team.teamId()).isEmpty());
        }

        @Test
        @DisplayName("1.5 Repeating a key returns the first claim without filing another")
        void submit_sameKey_replays() {
            String key = key();

            SubmittedClaim first = claimService.submitClaim(leagueId, team.teamId(), "p-1", null, key);
            SubmittedClaim second = claimService.submitClaim(leagueId, team.teamId(), "p-9", null, key);

            assertTrue(first.isCreated());
            assertFalse(second.isCreated());
            assertEquals(first.getClaim().getId(), second.getClaim().getId());
            assertEquals("p-1", second.getClaim().getPlayerId());
            assertEquals(1, claimService.findPendingClaims(leagueId, team.teamId()).size());
            verify(valueOperations).set(eq("claim-idempotency:" + key), eq(first.getClaim().getId().toString()),
                    any(Duration.class));
        }

        @Test
        @DisplayName("1.6 Key found in Redis short-circuits the database lookup")
        void submit_keyCachedInRedis() {
            SubmittedClaim original = claimService.submitClaim(leagueId, team.teamId(), "p-1", null, null);
            String key = key();
            when(valueOperations.get("claim-idempotency:" + key)).thenReturn(original.getClaim().getId().toString());

            SubmittedClaim replay = claimService.submitClaim(leagueId, team.teamId(), "p-1", null, key);

            assertFalse(replay.isCreated());
            assertEquals(original.getClaim().getId(), replay.getClaim().getId());
        }

        @Test
        @DisplayName("1.7 Redis outage falls back to the database")
        void submit_redisDown_stillIdempotent() {
            when(valueOperations.get(anyString())).thenThrow(new RuntimeException("Redis connection refused"));
            doThrow(new RuntimeException("Redis connection refused"))
                    .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
            String key = key();

            SubmittedClaim first = claimService.submitClaim(leagueId, team.teamId(), "p-1", null, key);
            SubmittedClaim second = claimService.submitClaim(leagueId, team.teamId(), "p-1", null, key);

            assertTrue(first.isCreated());
            assertFalse(second.isCreated());
            assertEquals(first.getClaim().getId(), second.getClaim().getId());
        }

        @Test
        @DisplayName("1.8 A key is never replayed to another team or league")
        void submit_keyReusedByAnotherTeam_rejected() {
            String key = key();
            claimService.submitClaim(leagueId, team.teamId(), "p-1", null, key);
            Team rival = fixture.createTeam(leagueId);
            fixture.setPriority(rival, 5);
            UUID otherLeague = fixture.createLeague();
            Team stranger = fixture.createTeam(otherLeague);
            fixture.setPriority(stranger, 1);

            IllegalArgumentException sameLeague = assertThrows(IllegalArgumentException.class,
                    () -> claimService.submitClaim(leagueId, rival.teamId(), "p-1", null, key));
            assertThrows(IllegalArgumentException.class,
                    () -> claimService.submitClaim(otherLeague, stranger.teamId(), "p-1", null, key));

            assertTrue(sameLeague.getMessage().contains("another team"));
            assertTrue(claimService.findPendingClaims(leagueId, rival.teamId()).isEmpty());
            assertTrue(claimService.findPendingClaims(otherLeague, stranger.teamId()).isEmpty());
            assertEquals(1, claimService.findPendingClaims(leagueId, team.teamId()).size());
        }
    }

    @Nested
    @DisplayName("2. Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("2.1 Pending claim is cancelled")
        void cancel_pending() {
            UUID claimId = claimService.submitClaim(leagueId, team.teamId(), "p-1", null, null).getClaim().getId();

            assertEquals(CancelResult.CANCELLED, claimService.cancelClaim(leagueId, team.teamId(), claimId));
            assertEquals("CANCELLED", fixture.claimStatus(claimId));
            assertTrue(claimService.findPendingClaims(leagueId, team.teamId()).isEmpty());
        }

        @Test
        @DisplayName("2.2 Resolved claim stays resolved")
        void cancel_alreadyFinal() {
            UUID claimId = fixture.insertClaim(team, "p-1", null, 4, Instant.now());
            jdbcTemplate.update("UPDATE waiver_claims SET status = 'SUCCESSFUL', processed_at = NOW() WHERE id = ?",
                    claimId);

            assertEquals(CancelResult.ALREADY_FINAL, claimService.cancelClaim(leagueId, team.teamId(), claimId));
            assertEquals("SUCCESSFUL", fixture.claimStatus(claimId));
        }

        @Test
        @DisplayName("2.3 Another team's claim is not found")
        void cancel_otherTeam_notFound() {
            Team other = fixture.createTeam(leagueId);
            UUID claimId = claimService.submitClaim(leagueId, team.teamId(), "p-1", null, null).getClaim().getId();

            assertEquals(CancelResult.NOT_FOUND, claimService.cancelClaim(leagueId, other.teamId(), claimId));
            assertEquals(CancelResult.NOT_FOUND, claimService.cancelClaim(leagueId, team.teamId(), UUID.randomUUID()));
            assertEquals("PENDING", fixture.claimStatus(claimId));
        }

        @Test
        @DisplayName("2.4 The database refuses to reopen a terminal claim")
        void terminalClaim_cannotBeReopened() {
            UUID claimId = fixture.insertClaim(team, "p-1", null, 4, Instant.now());
            jdbcTemplate.update("UPDATE waiver_claims SET status = 'FAILED' WHERE id = ?", claimId);

            assertThrows(DataAccessException.class,
                    () -> jdbcTemplate.update("UPDATE waiver_claims SET status = 'PENDING' WHERE id = ?", claimId));
            assertEquals("FAILED", fixture.claimStatus(claimId));
        }
    }

    @Test
    @DisplayName("Pending claims are listed oldest first")
    void findPendingClaims_ordered() {
        UUID older = fixture.insertClaim(team, "p-1", null, 4, Instant.now().minusSeconds(60));
        UUID newer = fixture.insertClaim(team, "p-2", null, 4, Instant.now());

        List<UUID> ids = claimService.findPendingClaims(leagueId, team.teamId()).stream().map(Claim::getId).toList();

        assertEquals(List.of(older, newer), ids);
    }
}
