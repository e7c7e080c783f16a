package com.flagship.lease_ledger.receipt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for receipt creation.
 *
 * Redis is a fast path only. The unique idempotency_key column on receipts is the source of
 * truth, so a Redis outage degrades latency but never correctness.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "lease:receipt:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ReceiptRepository receiptRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(ReceiptRepository receiptRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.receiptRepository = receiptRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the receipt created earlier with this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String receiptId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (receiptId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(receiptId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing = receiptRepository.findByIdempotencyKey(idempotencyKey).map(ReceiptEntity::getId);
        existing.ifPresent(receiptId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, receiptId);
        });
        return existing;
    }

    /**
     * Caches the key after the receipt row (which holds the key) has been written.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID receiptId) {
        requireKey(idempotencyKey);
        if (receiptId == null) {
            throw new IllegalArgumentException("Receipt ID cannot be null");
        }
        cache(idempotencyKey, receiptId);
    }

    private void cache(String idempotencyKey, UUID receiptId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, receiptId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
