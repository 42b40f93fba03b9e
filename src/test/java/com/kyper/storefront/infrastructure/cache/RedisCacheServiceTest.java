package com.kyper.storefront.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyper.storefront.domain.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisCacheService.
 * The cache must never fail a request: Redis errors degrade to misses.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisCacheService Unit Tests")
class RedisCacheServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private RedisCacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheService = new RedisCacheService(redisTemplate, objectMapper, true);
    }

    @Test
    @DisplayName("getProduct - Cached JSON is deserialized")
    void getProduct_Hit() throws Exception {
        // Given
        Product product = Product.builder().id(1L).nameEn("Dragon").price(new BigDecimal("24.90")).stock(3).build();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("product:1")).thenReturn(objectMapper.writeValueAsString(product));

        // When
        Optional<Product> result = cacheService.getProduct(1L, Product.class);

        // Then
        assertThat(result).hasValueSatisfying(p -> {
            assertThat(p.getNameEn()).isEqualTo("Dragon");
            assertThat(p.getStock()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("getProduct - Redis outage is treated as a miss")
    void getProduct_RedisDown_Miss() {
        // Given
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("Connection refused"));

        // When
        Optional<Product> result = cacheService.getProduct(1L, Product.class);

        // Then
        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("cacheProduct - Stores JSON with a TTL")
    void cacheProduct_StoresWithTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        // When
        cacheService.cacheProduct(2L, Product.builder().id(2L).stock(1).build());

        // Then
        verify(valueOperations).set(eq("product:2"), contains("\"stock\":1"), any(Duration.class));
    }

    @Test
    @DisplayName("evictProducts - Deletes every key and swallows Redis failures")
    void evictProducts_DeletesKeys() {
        // Given
        when(redisTemplate.delete(anyCollection())).thenThrow(new RedisConnectionFailureException("down"));

        // When / Then
        assertThatCode(() -> cacheService.evictProducts(List.of(1L, 2L))).doesNotThrowAnyException();
        verify(redisTemplate).delete(List.of("product:1", "product:2"));
    }

    @Test
    @DisplayName("Disabled cache never touches Redis")
    void disabledCache_NoRedisCalls() {
        // Given
        RedisCacheService disabled = new RedisCacheService(redisTemplate, objectMapper, false);

        // When
        disabled.cacheProduct(1L, Product.builder().build());
        disabled.evictProducts(List.of(1L));

        // Then
        assertThat(disabled.getProduct(1L, Product.class)).isEmpty();
        verifyNoInteractions(redisTemplate);
    }
}
