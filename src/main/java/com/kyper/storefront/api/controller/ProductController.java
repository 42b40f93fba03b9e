package com.kyper.storefront.api.controller;

import com.kyper.storefront.api.dto.MessageResponse;
import com.kyper.storefront.api.dto.ProductRequest;
import com.kyper.storefront.api.dto.ProductResponse;
import com.kyper.storefront.service.ProductService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the product catalog.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> getAllProducts() {
        List<ProductResponse> products = productService.getAllProducts().stream()
                .map(ProductResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(products);
    }

    /**
     * Get product by ID. Served from the cache when present.
     *
     * @param productId Product ID
     * @return Product details
     */
    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable Long productId) {
        return ResponseEntity.ok(ProductResponse.fromEntity(productService.getProduct(productId)));
    }

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        return ResponseEntity.ok(ProductResponse.fromEntity(productService.createProduct(request.toEntity())));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<MessageResponse> deleteProduct(@PathVariable Long productId) {
        productService.deleteProduct(productId);
        return ResponseEntity.ok(new MessageResponse("Product deleted"));
    }
}
