package com.kyper.storefront.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Redis cache for catalog reads.
 * The cache is advisory: every failure is logged and treated as a miss, and the
 * database stays the source of truth.
 *
 * Cache Keys:
 * - product:{id} -> Product details (JSON)
 *
 * @author Storefront Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    private static final String PRODUCT_PREFIX = "product:";

    private static final Duration PRODUCT_TTL = Duration.ofMinutes(10);

    public RedisCacheService(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${spring.data.redis.enabled:true}") boolean enabled
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    /**
     * Cache product data as JSON.
     *
     * @param productId Product ID
     * @param productData Product object to cache
     */
    public <T> void cacheProduct(Long productId, T productData) {
        if (!enabled) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(productData);
            redisTemplate.opsForValue().set(PRODUCT_PREFIX + productId, json, PRODUCT_TTL);
            logger.debug("Cached product data for: {}", productId);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing product data for product: {}", productId, e);
        } catch (Exception e) {
            logger.error("Error caching product data for product: {}", productId, e);
        }
    }

    /**
     * Get cached product data.
     *
     * @param productId Product ID
     * @param clazz Product class type
     * @return Optional containing product if cached
     */
    public <T> Optional<T> getProduct(Long productId, Class<T> clazz) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.opsForValue().get(PRODUCT_PREFIX + productId);
            if (json != null) {
                logger.debug("Cache hit for product: {}", productId);
                return Optional.of(objectMapper.readValue(json, clazz));
            }
            logger.debug("Cache miss for product: {}", productId);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error getting product from cache for product: {}", productId, e);
            return Optional.empty();
        }
    }

    /**
     * Invalidate cached products, e.g. after their stock changed.
     *
     * @param productIds Product IDs
     */
    public void evictProducts(Collection<Long> productIds) {
        if (!enabled || productIds.isEmpty()) {
            return;
        }
        try {
            List<String> keys = productIds.stream()
                    .map(id -> PRODUCT_PREFIX + id)
                    .collect(Collectors.toList());
            redisTemplate.delete(keys);
            logger.debug("Invalidated product cache for: {}", productIds);
        } catch (Exception e) {
            logger.error("Error invalidating product cache for products: {}", productIds, e);
        }
    }
}
