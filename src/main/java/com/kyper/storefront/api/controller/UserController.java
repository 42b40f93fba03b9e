package com.kyper.storefront.api.controller;

import com.kyper.storefront.api.dto.LoginRequest;
import com.kyper.storefront.api.dto.RegisterRequest;
import com.kyper.storefront.api.dto.UserResponse;
import com.kyper.storefront.domain.model.User;
import com.kyper.storefront.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for user registration, login and listing.
 * Login only verifies credentials; no session or token is issued.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = userService.register(request.getName(), request.getEmail(), request.getPassword());
        return ResponseEntity.ok(UserResponse.fromEntity(user));
    }

    @PostMapping("/login")
    public ResponseEntity<UserResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(UserResponse.fromEntity(userService.login(request.getEmail(), request.getPassword())));
    }

    @GetMapping
    public ResponseEntity<List<UserResponse>> getAllUsers() {
        return ResponseEntity.ok(userService.getAllUsers().stream()
                .map(UserResponse::fromEntity)
                .collect(Collectors.toList()));
    }
}
