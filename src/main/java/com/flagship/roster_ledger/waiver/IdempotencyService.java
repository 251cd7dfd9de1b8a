package com.flagship.roster_ledger.waiver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps claim idempotency keys to claim ids.
 *
 * Redis is the fast path; the {@code waiver_claims.idempotency_key} column is
 * the source of truth. Redis failures only cost a database lookup.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "claim-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ClaimRepository claimRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(ClaimRepository claimRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.claimRepository = claimRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the claim already filed under this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String claimId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (claimId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(claimId));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing;
        try {
            existing = claimRepository.findByIdempotencyKey(idempotencyKey).map(ClaimEntity::getId);
        } catch (DataAccessException e) {
            log.error("Database lookup failed for idempotency key: {}. Error: {}", idempotencyKey, e.getMessage());
            throw e;
        }

        existing.ifPresent(claimId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, claimId);
        });
        return existing;
    }

    public void storeIdempotencyKey(String idempotencyKey, UUID claimId) {
        requireKey(idempotencyKey);
        if (claimId == null) {
            throw new IllegalArgumentException("Claim ID cannot be null");
        }
        cache(idempotencyKey, claimId);
    }

    private void cache(String idempotencyKey, UUID claimId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, claimId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
