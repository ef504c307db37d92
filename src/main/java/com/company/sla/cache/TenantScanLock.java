package com.company.sla.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Serializes scans of one tenant across instances and between the scheduled and manual paths.
 * <p>
 * The lock is a Redis key set with NX and a TTL, so a crashed holder cannot block a tenant
 * for longer than the TTL. When Redis is unreachable the scan goes ahead unlocked and the
 * partial unique index on active breaches is the only duplicate guard left.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantScanLock {

    private static final String KEY_PREFIX = "sla:scan-lock:";

    // Delete only if we still own the key
    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, Object> redisTemplate;

    @Value("${sla.scan.lock-ttl-ms:240000}")
    private long lockTtlMs;

    /**
     * @return false only when another holder owns the lock
     */
    public boolean tryAcquire(String tenantId, String token) {
        try {
            Boolean acquired = redisTemplate.opsForValue()
                    .setIfAbsent(key(tenantId), token, Duration.ofMillis(lockTtlMs));
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired scan lock for tenant {}", tenantId);
                return true;
            }
            log.info("Scan of tenant {} already in progress, skipping", tenantId);
            return false;
        } catch (Exception e) {
            log.warn("Redis unavailable for scan lock of tenant {}, scanning without it: {}",
                    tenantId, e.getMessage());
            return true;
        }
    }

    public void release(String tenantId, String token) {
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key(tenantId)), token);
            if (deleted == null || deleted == 0L) {
                log.debug("Scan lock for tenant {} expired or was taken over before release", tenantId);
            }
        } catch (Exception e) {
            log.warn("Failed to release scan lock for tenant {}, it will expire: {}", tenantId, e.getMessage());
        }
    }

    static String key(String tenantId) {
        return KEY_PREFIX + tenantId;
    }
}
