package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.entity.Identity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Limits how many one-time codes are sent to one address within a window.
 * Counters live in Redis; when Redis is unreachable dispatches are allowed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitingService {

    static final String DISPATCH_PREFIX = "code-dispatch:";

    private final StringRedisTemplate redisTemplate;
    private final SecurityProperties securityProperties;

    /**
     * Count a dispatch to the address.
     *
     * @return false when the address already reached its limit for the current window
     */
    public boolean tryAcquireDispatch(String email) {
        String key = DISPATCH_PREFIX + Identity.normalizeEmail(email);
        SecurityProperties.Throttle throttle = securityProperties.getThrottle();
        try {
            Long dispatches = redisTemplate.opsForValue().increment(key);
            if (dispatches != null && dispatches == 1L) {
                redisTemplate.expire(key, throttle.getWindow());
            }
            if (dispatches != null && dispatches > throttle.getMaxDispatches()) {
                log.warn("Code dispatch throttled for {} ({} in window)", email, dispatches);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            log.warn("Dispatch throttle unavailable, allowing dispatch to {}: {}", email, e.getMessage());
            return true;
        }
    }
}
