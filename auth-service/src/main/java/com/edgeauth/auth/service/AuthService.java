package com.edgeauth.auth.service;

import com.edgeauth.auth.domain.User;
import com.edgeauth.auth.dto.request.LoginRequest;
import com.edgeauth.auth.dto.request.RefreshRequest;
import com.edgeauth.auth.dto.request.SignupRequest;
import com.edgeauth.auth.dto.request.UpdateProfileRequest;
import com.edgeauth.auth.dto.response.LogoutResponse;
import com.edgeauth.auth.dto.response.TokenResponse;
import com.edgeauth.auth.dto.response.UserResponse;
import com.edgeauth.auth.repository.UserRepository;
import com.edgeauth.common.exception.BusinessException;
import com.edgeauth.common.response.ErrorCode;
import com.edgeauth.common.token.TokenClaims;
import com.edgeauth.common.token.TokenKind;
import com.edgeauth.common.token.TokenValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final JwtTokenProvider jwtTokenProvider;
    private final PasswordEncoder passwordEncoder;
    private final TokenRevocationPolicy revocationPolicy;

    @Transactional
    public UserResponse signup(SignupRequest request) {
        if (userRepository.existsByEmail(request.email())) {
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }

        User user = User.builder()
                .email(request.email())
                .passwordHash(passwordEncoder.encode(request.password()))
                .name(request.name())
                .build();

        User saved = userRepository.save(user);
        log.info("User signed up: id={}", saved.getId());
        return UserResponse.from(saved);
    }

    /**
     * Unknown email and wrong password are logged apart but answered identically,
     * so the response never reveals which accounts exist.
     */
    @Transactional(readOnly = true)
    public TokenResponse login(LoginRequest request) {
        User user = userRepository.findByEmailAndDeletedAtIsNull(request.email())
                .orElseThrow(() -> {
                    log.warn("Login failed: no active user for email {}", request.email());
                    return new BusinessException(ErrorCode.LOGIN_FAILED);
                });

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.warn("Login failed: password mismatch for user id={}", user.getId());
            throw new BusinessException(ErrorCode.LOGIN_FAILED);
        }

        log.info("User logged in: id={}", user.getId());
        return issueTokens(user);
    }

    /**
     * Trusts any unexpired, correctly signed refresh token unless the revocation
     * policy says otherwise. The default policy never revokes.
     */
    @Transactional(readOnly = true)
    public TokenResponse refresh(RefreshRequest request) {
        TokenClaims claims = verifyRefreshToken(request.refreshToken());

        if (revocationPolicy.isRevoked(claims)) {
            log.warn("Refresh rejected: token revoked for subject={}", claims.subjectId());
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }

        User user = userRepository.findByIdAndDeletedAtIsNull(parseUserId(claims))
                .orElseThrow(() -> {
                    log.warn("Refresh rejected: no active user for subject={}", claims.subjectId());
                    return new BusinessException(ErrorCode.INVALID_TOKEN);
                });

        log.info("Tokens refreshed for user id={}", user.getId());
        return issueTokens(user);
    }

    public LogoutResponse logout(Long userId, String refreshToken) {
        boolean revoked = false;
        try {
            TokenClaims claims = verifyRefreshToken(refreshToken);
            if (claims.subjectId().equals(String.valueOf(userId))) {
                revoked = revocationPolicy.revoke(claims);
            } else {
                log.warn("Logout: refresh token subject={} does not match user id={}", claims.subjectId(), userId);
            }
        } catch (BusinessException e) {
            log.warn("Logout: refresh token not accepted for user id={}: {}", userId, e.getMessage());
        }

        log.info("User logout processed: id={}, tokenRevoked={}", userId, revoked);
        return LogoutResponse.of(revoked);
    }

    @Transactional(readOnly = true)
    public UserResponse me(Long userId) {
        return UserResponse.from(findActiveUser(userId));
    }

    /**
     * Tokens already issued keep the previous email claim until the next refresh.
     */
    @Transactional
    public UserResponse updateProfile(Long userId, UpdateProfileRequest request) {
        User user = findActiveUser(userId);

        if (!user.getEmail().equals(request.email()) && userRepository.existsByEmail(request.email())) {
            log.warn("Profile update rejected: email already taken, user id={}", userId);
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }

        user.updateProfile(request.email(), request.name());
        log.info("Profile updated: id={}", userId);
        return UserResponse.from(user);
    }

    private User findActiveUser(Long userId) {
        return userRepository.findByIdAndDeletedAtIsNull(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESOURCE_NOT_FOUND, "User not found: " + userId));
    }

    private TokenClaims verifyRefreshToken(String token) {
        TokenClaims claims;
        try {
            claims = jwtTokenProvider.parseToken(token);
        } catch (TokenValidationException e) {
            log.warn("Refresh token rejected: {} - {}", e.getError(), e.getMessage());
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }

        if (claims.kind() != TokenKind.REFRESH) {
            log.warn("Refresh token rejected: got {} token for subject={}", claims.kind(), claims.subjectId());
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }
        return claims;
    }

    private Long parseUserId(TokenClaims claims) {
        try {
            return Long.valueOf(claims.subjectId());
        } catch (NumberFormatException e) {
            log.warn("Refresh rejected: non-numeric subject={}", claims.subjectId());
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }
    }

    private TokenResponse issueTokens(User user) {
        String accessToken = jwtTokenProvider.createAccessToken(user);
        String refreshToken = jwtTokenProvider.createRefreshToken(user);
        return TokenResponse.of(accessToken, refreshToken, jwtTokenProvider.getAccessTokenExpirySeconds());
    }
}
