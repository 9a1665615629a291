package com.pennywise.service;

import com.pennywise.domain.User;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Service for user registration and credential checks.
 *
 * Password hashing uses BCryptPasswordEncoder (cost factor 12).
 * Plaintext passwords are never stored or logged.
 */
@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public UserService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    /**
     * Register a new user with a BCrypt-hashed password.
     *
     * @param email optional, unique when present
     * @throws LedgerValidationException if the username or email is already registered
     */
    public User register(String username, String email, String plainPassword) {
        String normalizedEmail = (email == null || email.isBlank()) ? null : email.strip().toLowerCase();
        log.info("Registering user - username={}", username);

        if (userRepository.existsByUsername(username)) {
            log.warn("Registration rejected, username taken - username={}", username);
            throw new LedgerValidationException("username", "Username already registered: " + username);
        }
        if (normalizedEmail != null && userRepository.existsByEmail(normalizedEmail)) {
            log.warn("Registration rejected, email taken - email={}", normalizedEmail);
            throw new LedgerValidationException("email", "Email already registered: " + normalizedEmail);
        }

        String hash = passwordEncoder.encode(plainPassword);
        User user = userRepository.save(new User(username, normalizedEmail, hash, clock.instant()));
        log.info("User registered - userId={}, username={}", user.getId(), username);
        return user;
    }

    /**
     * Check credentials. Unknown user and wrong password fail identically.
     *
     * @throws BadCredentialsException if the credentials do not match
     */
    @Transactional(readOnly = true)
    public User authenticate(String username, String plainPassword) {
        User user = userRepository.findByUsername(username).orElse(null);
        if (user == null || !passwordEncoder.matches(plainPassword, user.getPasswordHash())) {
            log.warn("Login failed - username={}", username);
            throw new BadCredentialsException("Invalid username or password");
        }
        log.debug("Credentials verified - userId={}", user.getId());
        return user;
    }

    @Transactional(readOnly = true)
    public Optional<User> findById(Long userId) {
        return userRepository.findById(userId);
    }
}
