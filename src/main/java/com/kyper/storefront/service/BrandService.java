package com.kyper.storefront.service;

import com.kyper.storefront.domain.model.Brand;
import com.kyper.storefront.repository.BrandRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for managing brands.
 *
 * @author Storefront Team
 */
@Service
public class BrandService {

    private static final Logger logger = LoggerFactory.getLogger(BrandService.class);

    private final BrandRepository brandRepository;

    public BrandService(BrandRepository brandRepository) {
        this.brandRepository = brandRepository;
    }

    @Transactional(readOnly = true)
    public List<Brand> getAllBrands() {
        return brandRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional
    public Brand createBrand(Brand brand) {
        Brand saved = brandRepository.save(brand);
        logger.info("Created brand: {}", saved.getId());
        return saved;
    }

    @Transactional
    public void deleteBrand(Long brandId) {
        brandRepository.deleteById(brandId);
        logger.info("Deleted brand: {}", brandId);
    }
}
