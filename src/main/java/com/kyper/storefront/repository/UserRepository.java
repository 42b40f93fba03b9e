package com.kyper.storefront.repository;

import com.kyper.storefront.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for User entity.
 *
 * @author Storefront Team
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find user by email (login lookup).
     *
     * @param email Email address
     * @return Optional containing the user if found
     */
    Optional<User> findByEmail(String email);

    /**
     * Check if an email is already registered.
     *
     * @param email Email address
     * @return true if a user with this email exists
     */
    boolean existsByEmail(String email);
}
