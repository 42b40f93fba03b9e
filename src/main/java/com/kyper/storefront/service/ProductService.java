package com.kyper.storefront.service;

import com.kyper.storefront.domain.model.Product;
import com.kyper.storefront.exception.ResourceNotFoundException;
import com.kyper.storefront.infrastructure.cache.RedisCacheService;
import com.kyper.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.kyper.storefront.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for managing catalog products.
 * Single product reads go through the Redis cache (cache-aside).
 *
 * @author Storefront Team
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final RedisCacheService cacheService;
    private final StorefrontMetricsService metricsService;

    public ProductService(
            ProductRepository productRepository,
            RedisCacheService cacheService,
            StorefrontMetricsService metricsService
    ) {
        this.productRepository = productRepository;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
    }

    /**
     * Get all products, newest first.
     *
     * @return List of products
     */
    @Transactional(readOnly = true)
    public List<Product> getAllProducts() {
        return productRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Find product by ID with caching.
     *
     * @param productId Product ID
     * @return Product
     * @throws ResourceNotFoundException if the product does not exist
     */
    @Transactional(readOnly = true)
    public Product getProduct(Long productId) {
        logger.debug("Finding product by ID: {}", productId);

        Optional<Product> cachedProduct = cacheService.getProduct(productId, Product.class);
        if (cachedProduct.isPresent()) {
            metricsService.recordCacheHit("product");
            return cachedProduct.get();
        }

        metricsService.recordCacheMiss("product");
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
        cacheService.cacheProduct(productId, product);
        return product;
    }

    /**
     * Create a product.
     *
     * @param product Product to create
     * @return Saved product with generated ID
     */
    @Transactional
    public Product createProduct(Product product) {
        Product saved = productRepository.save(product);
        logger.info("Created product: {}", saved.getId());
        return saved;
    }

    /**
     * Delete a product. Deleting an unknown ID is not an error.
     *
     * @param productId Product ID
     */
    @Transactional
    public void deleteProduct(Long productId) {
        productRepository.deleteById(productId);
        cacheService.evictProducts(List.of(productId));
        logger.info("Deleted product: {}", productId);
    }
}
