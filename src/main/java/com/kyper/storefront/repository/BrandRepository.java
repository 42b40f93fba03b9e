package com.kyper.storefront.repository;

import com.kyper.storefront.domain.model.Brand;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Brand entity.
 *
 * @author Storefront Team
 */
@Repository
public interface BrandRepository extends JpaRepository<Brand, Long> {

    List<Brand> findAllByOrderByCreatedAtDesc();
}
