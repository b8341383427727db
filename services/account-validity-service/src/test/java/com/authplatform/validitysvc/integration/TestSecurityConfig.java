package com.authplatform.validitysvc.integration;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * Accepts any bearer token: the token value is the base64url-encoded subject, and an
 * {@code admin.} prefix adds the server admin claim. Account ids carry {@code @} and
 * {@code :}, which are not valid in a bearer token, hence the encoding.
 */
@TestConfiguration
public class TestSecurityConfig {

    static final String ADMIN_PREFIX = "admin.";

    @Bean
    @Primary
    public JwtDecoder testJwtDecoder() {
        return token -> {
            boolean admin = token.startsWith(ADMIN_PREFIX);
            String subject = decode(admin ? token.substring(ADMIN_PREFIX.length()) : token);
            return Jwt.withTokenValue(token)
                    .header("alg", "RS256")
                    .subject(subject)
                    .issuedAt(Instant.now())
                    .expiresAt(Instant.now().plusSeconds(3600))
                    .claim("scope", "openid profile email")
                    .claim("server_admin", admin)
                    .build();
        };
    }

    static String bearer(String userId) {
        return "Bearer " + encode(userId);
    }

    static String adminBearer(String userId) {
        return "Bearer " + ADMIN_PREFIX + encode(userId);
    }

    private static String encode(String userId) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(userId.getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(String token) {
        return new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
    }
}
