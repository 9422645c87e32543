package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RateLimitingServiceTest {

    private static final String KEY = "code-dispatch:alice@bank.test";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private SecurityProperties properties;
    private RateLimitingService rateLimitingService;

    @BeforeEach
    void setUp() {
        properties = new SecurityProperties();
        properties.getThrottle().setMaxDispatches(2);
        properties.getThrottle().setWindow(Duration.ofMinutes(10));
        rateLimitingService = new RateLimitingService(redisTemplate, properties);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void firstDispatchStartsTheWindow() {
        when(valueOperations.increment(KEY)).thenReturn(1L);

        assertThat(rateLimitingService.tryAcquireDispatch(" Alice@Bank.test")).isTrue();
        verify(redisTemplate).expire(KEY, Duration.ofMinutes(10));
    }

    @Test
    void dispatchesBeyondTheLimitAreRefused() {
        when(valueOperations.increment(KEY)).thenReturn(2L, 3L);

        assertThat(rateLimitingService.tryAcquireDispatch("alice@bank.test")).isTrue();
        assertThat(rateLimitingService.tryAcquireDispatch("alice@bank.test")).isFalse();
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void allowsDispatchWhenRedisIsUnavailable() {
        when(valueOperations.increment(KEY)).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(rateLimitingService.tryAcquireDispatch("alice@bank.test")).isTrue();
    }
}
