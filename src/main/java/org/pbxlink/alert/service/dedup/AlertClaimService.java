package org.pbxlink.alert.service.dedup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;

/**
 * Redis SET NX claims serializing concurrent deliveries of the same physical call.
 * When Redis is unreachable the claim is granted and the database check stands alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertClaimService {

    private static final String KEY_PREFIX = "alert-claim:";

    private final StringRedisTemplate redisTemplate;

    @Value("${pbx.alert.dedup.redis-enabled:true}")
    private boolean redisEnabled;

    @Value("${pbx.alert.dedup.claim-ttl-seconds:600}")
    private long claimTtlSeconds;

    /**
     * @return true if this caller now owns the key, false if another delivery holds it
     */
    public boolean claim(String key) {
        if (!redisEnabled) {
            return true;
        }
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(KEY_PREFIX + key, "1", Duration.ofSeconds(claimTtlSeconds));
            if (Boolean.FALSE.equals(claimed)) {
                log.info("Alert key already claimed: {}", key);
                return false;
            }
        } catch (Exception e) {
            log.warn("Redis claim failed, relying on DB check: {}", e.getMessage());
        }
        return true;
    }

    /**
     * Drop claims after a run that did not produce an alert, so redelivery is not mistaken for a duplicate.
     */
    public void release(Collection<String> keys) {
        if (!redisEnabled || keys.isEmpty()) {
            return;
        }
        try {
            redisTemplate.delete(keys.stream().map(k -> KEY_PREFIX + k).toList());
        } catch (Exception e) {
            log.warn("Failed to release alert claims {}: {}", keys, e.getMessage());
        }
    }
}
