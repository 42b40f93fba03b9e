package com.kyper.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the storefront data API.
 *
 * System Overview:
 * - CRUD endpoints over products, brands and users
 * - Transactional order submission: order header, line items and stock
 *   decrements written atomically on one pooled connection
 * - Product reads cached in Redis, order events published to Kafka after commit
 *
 * Architecture:
 * - API Layer: REST controllers, error mapping
 * - Service Layer: order submission engine, catalog and user services
 * - Data Access Layer: JPA repositories over a HikariCP pool
 * - Infrastructure Layer: Redis cache, Kafka messaging, Micrometer metrics
 *
 * @author Storefront Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }
}
