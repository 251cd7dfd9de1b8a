package com.flagship.roster_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes roster events to the transactional outbox.
 *
 * Events are saved in the caller's transaction: if the roster change
 * commits, its event is guaranteed to be there; if it rolls back, so does
 * the event. {@link OutboxPublisher} ships them to Kafka afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Saves an event within the current transaction.
     *
     * Must not be called inside a JDBC savepoint that may still be rolled
     * back: the JPA insert is only flushed at commit.
     *
     * @param source    "RosterMove" or "WaiverClaim"
     * @param leagueId  league the event belongs to, used as the Kafka key
     * @param eventType e.g. "PlayerAdded"
     * @param payload   serialized to JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String source, UUID leagueId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(leagueId, source, eventType, serializePayload(payload), clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.pending(event));

        log.debug("Saved outbox event: type={}, source={}, leagueId={}", eventType, source, leagueId);

        return saved.toEvent();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.recordPublishFailure(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one league in commit order, optionally filtered by type.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForLeague(UUID leagueId, String eventType) {
        List<OutboxEventEntity> entities = eventType == null
                ? repository.findByLeagueIdOrderBySequenceNumberAsc(leagueId)
                : repository.findByLeagueIdAndEventTypeOrderBySequenceNumberAsc(leagueId, eventType);
        return entities.stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
