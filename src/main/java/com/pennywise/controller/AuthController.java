package com.pennywise.controller;

import com.pennywise.domain.User;
import com.pennywise.dto.ApiResponses;
import com.pennywise.dto.RegisterUserRequest;
import com.pennywise.security.JwtTokenProvider;
import com.pennywise.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Authentication controller.
 *
 * POST /auth/register : creates a user, returns the user and a signed JWT.
 * POST /auth/login    : validates credentials, returns a signed JWT.
 *
 * The JWT must be included in subsequent requests as:
 *   Authorization: Bearer <token>
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Registration and login")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final UserService      userService;
    private final JwtTokenProvider tokenProvider;

    public AuthController(UserService      userService,
                          JwtTokenProvider tokenProvider) {
        this.userService   = userService;
        this.tokenProvider = tokenProvider;
    }

    // ── Request / Response DTOs (local, no domain leakage) ───────────────────

    public record LoginRequest(
            @NotBlank String username,
            @NotBlank String password) {}

    public record LoginResponse(
            String  token,
            String  username,
            Long    userId,
            Instant expiresAt) {}

    public record RegistrationResponse(
            ApiResponses.UserResponse user,
            String  token,
            Instant expiresAt) {}

    // ── Endpoints ─────────────────────────────────────────────────────────────

    /**
     * HTTP Contract:
     *  201 Created     → user created, token returned
     *  400 Bad Request → invalid fields, username or email already registered
     */
    @PostMapping("/register")
    @Operation(summary = "Register", description = "Create a user and receive a Bearer JWT token.")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "User created"),
        @ApiResponse(responseCode = "400", description = "Invalid input or duplicate username/email")
    })
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        User user = userService.register(request.getUsername(), request.getEmail(), request.getPassword());
        String token = tokenProvider.generateToken(user.getId(), user.getUsername());

        return ResponseEntity.status(HttpStatus.CREATED).body(new RegistrationResponse(
                new ApiResponses.UserResponse(user),
                token,
                tokenProvider.expiresAt()));
    }

    /**
     * HTTP Contract:
     *  200 OK           → credentials valid, token returned
     *  401 Unauthorized → wrong username or password (same message for both)
     */
    @PostMapping("/login")
    @Operation(summary = "Login", description = "Validate credentials and receive a Bearer JWT token.")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        User user = userService.authenticate(request.username(), request.password());
        String token = tokenProvider.generateToken(user.getId(), user.getUsername());
        log.info("Login successful - userId={}", user.getId());

        return ResponseEntity.ok(new LoginResponse(
                token,
                user.getUsername(),
                user.getId(),
                tokenProvider.expiresAt()));
    }
}
