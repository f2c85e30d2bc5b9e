package com.edgeauth.auth.service;

import com.edgeauth.auth.TestFixtures;
import com.edgeauth.auth.domain.User;
import com.edgeauth.auth.dto.request.LoginRequest;
import com.edgeauth.auth.dto.request.RefreshRequest;
import com.edgeauth.auth.dto.response.TokenResponse;
import com.edgeauth.auth.repository.UserRepository;
import com.edgeauth.common.exception.BusinessException;
import com.edgeauth.common.response.ErrorCode;
import com.edgeauth.common.token.JwtTokenCodec;
import com.edgeauth.common.token.PemKeys;
import com.edgeauth.common.token.TokenClaims;
import com.edgeauth.common.token.TokenKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Clock;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

/**
 * Login and refresh with real keys, BCrypt and the stateless revocation policy;
 * only persistence is mocked.
 */
@ExtendWith(MockitoExtension.class)
class AuthServiceTokenFlowTest {

    private static final BCryptPasswordEncoder ENCODER = new BCryptPasswordEncoder();
    private static KeyManager keyManager;
    private static String aliceHash;

    @Mock
    private UserRepository userRepository;

    private AuthService authService;
    private JwtTokenCodec codec;
    private User alice;

    @BeforeAll
    static void createKeys() {
        keyManager = new KeyManager(KeyManager.generateKeyPair(2048));
        aliceHash = ENCODER.encode("correct-pw");
    }

    @BeforeEach
    void setUp() {
        codec = new JwtTokenCodec(Clock.systemUTC());
        JwtTokenProvider provider = new JwtTokenProvider(keyManager, codec, TestFixtures.jwtProperties());
        authService = new AuthService(userRepository, provider, ENCODER, new StatelessTokenRevocationPolicy());
        alice = TestFixtures.createUser(42L, "alice@example.com", aliceHash);
    }

    @Test
    void login_issuesTokensVerifiableWithPublishedKey() {
        given(userRepository.findByEmailAndDeletedAtIsNull("alice@example.com")).willReturn(Optional.of(alice));

        TokenResponse response = authService.login(new LoginRequest("alice@example.com", "correct-pw"));

        assertThat(response.tokenType()).isEqualTo("Bearer");
        assertThat(response.expiresIn()).isEqualTo(1800L);

        // verify against the key as a gateway would see it: parsed back from PEM
        var publishedKey = PemKeys.parsePublicKey(keyManager.exportPublicKeyPem());
        TokenClaims access = codec.verify(response.accessToken(), publishedKey);
        assertThat(access.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(access.subjectId()).isEqualTo("42");
        assertThat(access.email()).isEqualTo("alice@example.com");

        TokenClaims refresh = codec.verify(response.refreshToken(), publishedKey);
        assertThat(refresh.kind()).isEqualTo(TokenKind.REFRESH);
    }

    @Test
    void login_wrongPassword_fails() {
        given(userRepository.findByEmailAndDeletedAtIsNull("alice@example.com")).willReturn(Optional.of(alice));

        assertThatThrownBy(() -> authService.login(new LoginRequest("alice@example.com", "wrong-pw")))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.LOGIN_FAILED);
    }

    @Test
    void refresh_acceptsRefreshTokenAndRejectsAccessToken() {
        given(userRepository.findByEmailAndDeletedAtIsNull("alice@example.com")).willReturn(Optional.of(alice));
        given(userRepository.findByIdAndDeletedAtIsNull(42L)).willReturn(Optional.of(alice));
        TokenResponse pair = authService.login(new LoginRequest("alice@example.com", "correct-pw"));

        TokenResponse refreshed = authService.refresh(new RefreshRequest(pair.refreshToken()));
        assertThat(codec.verify(refreshed.accessToken(), keyManager.getPublicKey()).kind())
                .isEqualTo(TokenKind.ACCESS);

        assertThatThrownBy(() -> authService.refresh(new RefreshRequest(pair.accessToken())))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_TOKEN);
    }
}
