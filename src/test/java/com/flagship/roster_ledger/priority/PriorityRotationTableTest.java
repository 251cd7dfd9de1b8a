package com.flagship.roster_ledger.priority;

import com.flagship.roster_ledger.support.LeagueFixture;
import com.flagship.roster_ledger.support.LeagueFixture.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PriorityRotationTableTest {

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
    private PriorityRotationTable priorityTable;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @MockBean
    private StringRedisTemplate redisTemplate;

    private TransactionTemplate tx;
    private LeagueFixture fixture;
    private UUID leagueId;
    private Team first;
    private Team second;
    private Team third;
    private Team fourth;

    @BeforeEach
    void setUp() {
        tx = new TransactionTemplate(transactionManager);
        fixture = new LeagueFixture(jdbcTemplate);
        leagueId = fixture.createLeague();
        first = fixture.createTeam(leagueId);
        second = fixture.createTeam(leagueId);
        third = fixture.createTeam(leagueId);
        fourth = fixture.createTeam(leagueId);
        priorityTable.resetOrder(leagueId,
                List.of(first.teamId(), second.teamId(), third.teamId(), fourth.teamId()));
    }

    private List<UUID> order() {
        return priorityTable.findOrder(leagueId).stream().map(PriorityRank::getTeamId).toList();
    }

    @Test
    @DisplayName("Moving the leader to the back shifts everyone else up by one")
    void moveToBack_leader() {
        Boolean moved = tx.execute(status -> priorityTable.moveToBack(leagueId, first.teamId()));

        assertEquals(Boolean.TRUE, moved);
        assertEquals(List.of(second.teamId(), third.teamId(), fourth.teamId(), first.teamId()), order());
        assertEquals(4, fixture.priorityOf(first));
        assertEquals(1, fixture.priorityOf(second));
    }

    @Test
    @DisplayName("Teams ahead of the rotated team keep their rank")
    void moveToBack_middle() {
        tx.execute(status -> priorityTable.moveToBack(leagueId, third.teamId()));

        assertEquals(1, fixture.priorityOf(first));
        assertEquals(2, fixture.priorityOf(second));
        assertEquals(3, fixture.priorityOf(fourth));
        assertEquals(4, fixture.priorityOf(third));
    }

    @Test
    @DisplayName("Rotating the last team is a no-op on the order")
    void moveToBack_last() {
        tx.execute(status -> priorityTable.moveToBack(leagueId, fourth.teamId()));

        assertEquals(List.of(first.teamId(), second.teamId(), third.teamId(), fourth.teamId()), order());
    }

    @Test
    @DisplayName("Repeated rotations keep ranks a permutation of 1..n")
    void repeatedRotations_keepRanksDense() {
        tx.executeWithoutResult(status -> {
            priorityTable.moveToBack(leagueId, second.teamId());
            priorityTable.moveToBack(leagueId, first.teamId());
            priorityTable.moveToBack(leagueId, fourth.teamId());
        });

        List<Integer> ranks = priorityTable.findOrder(leagueId).stream().map(PriorityRank::getRank).toList();
        assertEquals(List.of(1, 2, 3, 4), ranks);
        assertEquals(List.of(third.teamId(), second.teamId(), first.teamId(), fourth.teamId()), order());
    }

    @Test
    @DisplayName("A team without a rank is not rotated")
    void moveToBack_unrankedTeam() {
        Team unranked = fixture.createTeam(leagueId);

        Boolean moved = tx.execute(status -> priorityTable.moveToBack(leagueId, unranked.teamId()));

        assertEquals(Boolean.FALSE, moved);
        assertTrue(priorityTable.findRank(leagueId, unranked.teamId()).isEmpty());
        assertEquals(4, order().size());
    }
}
