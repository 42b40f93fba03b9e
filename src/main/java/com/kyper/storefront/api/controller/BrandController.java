package com.kyper.storefront.api.controller;

import com.kyper.storefront.api.dto.BrandRequest;
import com.kyper.storefront.api.dto.BrandResponse;
import com.kyper.storefront.api.dto.MessageResponse;
import com.kyper.storefront.service.BrandService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for brands.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/brands")
public class BrandController {

    private final BrandService brandService;

    public BrandController(BrandService brandService) {
        this.brandService = brandService;
    }

    @GetMapping
    public ResponseEntity<List<BrandResponse>> getAllBrands() {
        return ResponseEntity.ok(brandService.getAllBrands().stream()
                .map(BrandResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @PostMapping
    public ResponseEntity<BrandResponse> createBrand(@Valid @RequestBody BrandRequest request) {
        return ResponseEntity.ok(BrandResponse.fromEntity(brandService.createBrand(request.toEntity())));
    }

    @DeleteMapping("/{brandId}")
    public ResponseEntity<MessageResponse> deleteBrand(@PathVariable Long brandId) {
        brandService.deleteBrand(brandId);
        return ResponseEntity.ok(new MessageResponse("Brand deleted"));
    }
}
