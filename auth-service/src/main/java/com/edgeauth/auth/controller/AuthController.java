package com.edgeauth.auth.controller;

import com.edgeauth.auth.dto.request.LoginRequest;
import com.edgeauth.auth.dto.request.LogoutRequest;
import com.edgeauth.auth.dto.request.RefreshRequest;
import com.edgeauth.auth.dto.request.SignupRequest;
import com.edgeauth.auth.dto.request.UpdateProfileRequest;
import com.edgeauth.auth.dto.response.LogoutResponse;
import com.edgeauth.auth.dto.response.TokenResponse;
import com.edgeauth.auth.dto.response.UserResponse;
import com.edgeauth.auth.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Auth", description = "Credential validation & token issuance")
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    // set by the gateway from the verified access token
    static final String HEADER_USER_ID = "X-User-Id";

    private final AuthService authService;

    @Operation(summary = "Sign up", description = "Register a new user account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User created"),
            @ApiResponse(responseCode = "400", description = "Validation error"),
            @ApiResponse(responseCode = "409", description = "Email already exists")
    })
    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse signup(@Valid @RequestBody SignupRequest request) {
        return authService.signup(request);
    }

    @Operation(summary = "Login", description = "Authenticate and receive an access/refresh token pair")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Login successful"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @Operation(summary = "Refresh token", description = "Exchange a refresh token for a new token pair")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token refreshed"),
            @ApiResponse(responseCode = "401", description = "Invalid, expired or wrong-type refresh token")
    })
    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest request) {
        return authService.refresh(request);
    }

    @Operation(summary = "Logout", description = "Acknowledge logout; reports whether the refresh token was revoked")
    @PostMapping("/logout")
    public LogoutResponse logout(@Parameter(hidden = true) @RequestHeader(HEADER_USER_ID) Long userId,
                                 @Valid @RequestBody LogoutRequest request) {
        return authService.logout(userId, request.refreshToken());
    }

    @Operation(summary = "Current user", description = "Profile of the authenticated user")
    @GetMapping({"/me", "/users/profile"})
    public UserResponse me(@Parameter(hidden = true) @RequestHeader(HEADER_USER_ID) Long userId) {
        return authService.me(userId);
    }

    @Operation(summary = "Update profile", description = "Change the authenticated user's email and name")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile updated"),
            @ApiResponse(responseCode = "400", description = "Validation error"),
            @ApiResponse(responseCode = "409", description = "Email already exists")
    })
    @PutMapping("/users/profile")
    public UserResponse updateProfile(@Parameter(hidden = true) @RequestHeader(HEADER_USER_ID) Long userId,
                                      @Valid @RequestBody UpdateProfileRequest request) {
        return authService.updateProfile(userId, request);
    }
}
