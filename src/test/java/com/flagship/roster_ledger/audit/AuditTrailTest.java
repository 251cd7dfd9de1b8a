package com.flagship.roster_ledger.audit;

import com.flagship.roster_ledger.support.LeagueFixture;
import com.flagship.roster_ledger.support.LeagueFixture.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The transaction log and failure sink are append-only at the database level.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class AuditTrailTest {

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
    private TransactionLog transactionLog;

    @Autowired
    private FailureSink failureSink;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @MockBean
    private StringRedisTemplate redisTemplate;

    private TransactionTemplate tx;
    private LeagueFixture fixture;
    private UUID leagueId;
    private Team team;

    @BeforeEach
    void setUp() {
        tx = new TransactionTemplate(transactionManager);
        fixture = new LeagueFixture(jdbcTemplate);
        leagueId = fixture.createLeague();
        team = fixture.createTeam(leagueId);
    }

    @Test
    @DisplayName("Log entries get increasing sequence numbers")
    void append_assignsSequence() {
        tx.executeWithoutResult(status -> {
            transactionLog.append(leagueId, team.teamId(), team.ownerId(), TransactionType.ADD, "p-1", "Free Agents");
            transactionLog.append(leagueId, team.teamId(), team.ownerId(), TransactionType.DROP, "p-1", "Free Agents");
        });

        List<TransactionLedgerEntry> history = transactionLog.findForPlayer(leagueId, "p-1");
        assertEquals(2, history.size());
        assertEquals(TransactionType.ADD, history.get(0).getType());
        assertEquals(TransactionType.DROP, history.get(1).getType());
        assertTrue(history.get(0).getSequenceNumber() < history.get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("Updating or deleting a log entry is rejected")
    void logEntries_areImmutable() {
        tx.executeWithoutResult(status -> transactionLog.append(
                leagueId, team.teamId(), team.ownerId(), TransactionType.ADD, "p-2", "Free Agents"));

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE transaction_ledger SET type = 'DROP' WHERE league_id = ?", leagueId));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM transaction_ledger WHERE league_id = ?", leagueId));

        assertEquals(TransactionType.ADD, transactionLog.findForPlayer(leagueId, "p-2").get(0).getType());
    }

    @Test
    @DisplayName("Failures survive a rolled back caller and cannot be edited")
    void failures_recordedIndependently() {
        FailedAttempt attempt = FailedAttempt.builder()
                .leagueId(leagueId)
                .teamId(team.teamId())
                .userId(team.ownerId())
                .operation(MoveOperation.ADD)
                .playerId("p-3")
                .category(FailureCategory.DUPLICATE_PLAYER)
                .message("Player is already on a team in this league")
                .attemptedAt(Instant.now())
                .build();

        tx.executeWithoutResult(status -> {
            failureSink.record(attempt);
            status.setRollbackOnly();
        });

        List<FailedAttempt> failures = failureSink.findRecent(leagueId, 10);
        assertEquals(1, failures.size());
        assertEquals(FailureCategory.DUPLICATE_PLAYER, failures.get(0).getCategory());
        assertEquals(MoveOperation.ADD, failures.get(0).getOperation());

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM failed_transactions WHERE league_id = ?", leagueId));
    }
}
