package com.kyper.storefront.service;

import com.kyper.storefront.domain.model.User;
import com.kyper.storefront.exception.DuplicateEmailException;
import com.kyper.storefront.exception.InvalidCredentialsException;
import com.kyper.storefront.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for user registration and login.
 * Passwords are stored as BCrypt hashes and compared with the encoder, never
 * as plain text.
 *
 * @author Storefront Team
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Register a new user with the default role and zero points.
     *
     * @param name Display name
     * @param email Email address (unique)
     * @param rawPassword Password as entered
     * @return Saved user
     * @throws DuplicateEmailException if the email is already registered
     */
    @Transactional
    public User register(String name, String email, String rawPassword) {
        if (userRepository.existsByEmail(email)) {
            logger.warn("Registration rejected, email already exists: {}", email);
            throw new DuplicateEmailException();
        }

        User user = User.builder()
                .name(name)
                .email(email)
                .passwordHash(passwordEncoder.encode(rawPassword))
                .role(User.DEFAULT_ROLE)
                .points(0)
                .build();

        User saved;
        try {
            saved = userRepository.save(user);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent registration of the same email
            throw new DuplicateEmailException(e);
        }
        logger.info("Registered user: {}", saved.getId());
        return saved;
    }

    /**
     * Authenticate by email and password.
     *
     * @param email Email address
     * @param rawPassword Password as entered
     * @return Matching user
     * @throws InvalidCredentialsException if no user matches
     */
    @Transactional(readOnly = true)
    public User login(String email, String rawPassword) {
        return userRepository.findByEmail(email)
                .filter(user -> passwordEncoder.matches(rawPassword, user.getPasswordHash()))
                .orElseThrow(() -> {
                    logger.warn("Failed login for email: {}", email);
                    return new InvalidCredentialsException();
                });
    }

    @Transactional(readOnly = true)
    public List<User> getAllUsers() {
        return userRepository.findAll();
    }
}
