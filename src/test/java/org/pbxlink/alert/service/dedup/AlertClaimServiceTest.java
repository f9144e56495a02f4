package org.pbxlink.alert.service.dedup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertClaimServiceTest {

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private ValueOperations<String, String> valueOperations;

    private AlertClaimService claims;

    @BeforeEach
    void setUp() {
        claims = new AlertClaimService(redisTemplate);
        ReflectionTestUtils.setField(claims, "redisEnabled", true);
        ReflectionTestUtils.setField(claims, "claimTtlSeconds", 600L);
    }

    @Test
    void shouldGrantFirstClaim() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent("alert-claim:9:42:ip:10.0.0.5", "1", Duration.ofSeconds(600)))
                .thenReturn(true);

        assertTrue(claims.claim("9:42:ip:10.0.0.5"));
    }

    @Test
    void shouldRefuseHeldClaim() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertFalse(claims.claim("9:42:ip:10.0.0.5"));
    }

    @Test
    void shouldGrantClaimWhenRedisIsDown() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("refused"));

        assertTrue(claims.claim("9:42:ip:10.0.0.5"));
    }

    @Test
    void shouldNotTouchRedisWhenDisabled() {
        ReflectionTestUtils.setField(claims, "redisEnabled", false);

        assertTrue(claims.claim("9:42:ip:10.0.0.5"));
        claims.release(List.of("9:42:ip:10.0.0.5"));

        verifyNoInteractions(redisTemplate);
    }

    @Test
    void shouldReleasePrefixedKeys() {
        claims.release(List.of("a", "b"));

        verify(redisTemplate).delete(List.of("alert-claim:a", "alert-claim:b"));
    }
}
