package com.eventledger.ledger.projection;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed account read model.
 *
 * The read model is a cache of the aggregate store: a Redis failure is logged
 * and reported as a miss, never propagated to the write path.
 */
@Slf4j
@Component
public class AccountReadModel {

    static final String KEY_PREFIX = "account:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public AccountReadModel(StringRedisTemplate redisTemplate,
                            ObjectMapper objectMapper,
                            @Value("${eventledger.read-model.ttl-hours:24}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public void save(AccountSnapshot snapshot) {
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(KEY_PREFIX + snapshot.getAccountId(), json, ttl);
        } catch (Exception e) {
            log.warn("Failed to update account read model: accountId={}, error={}",
                    snapshot.getAccountId(), e.getMessage());
        }
    }

    public Optional<AccountSnapshot> find(String accountId) {
        try {
            String json = redisTemplate.opsForValue().get(KEY_PREFIX + accountId);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, AccountSnapshot.class));
        } catch (Exception e) {
            log.warn("Failed to read account read model: accountId={}, error={}", accountId, e.getMessage());
            return Optional.empty();
        }
    }

    public void evict(String accountId) {
        try {
            redisTemplate.delete(KEY_PREFIX + accountId);
        } catch (Exception e) {
            log.warn("Failed to evict account read model: accountId={}, error={}", accountId, e.getMessage());
        }
    }
}
