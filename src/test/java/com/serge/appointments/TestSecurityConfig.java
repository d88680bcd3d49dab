package com.serge.appointments;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * Accepts the unsigned tokens built by {@link JwtTestUtil} instead of fetching a JWK set.
 */
@TestConfiguration
public class TestSecurityConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Bean
    @Primary
    JwtDecoder testJwtDecoder() {
        return token -> {
            String[] parts = token.split("\\.");
            if (parts.length < 2) {
                throw new BadJwtException("Invalid token");
            }
            String payloadJson = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            Map<String, Object> claims;
            try {
                claims = MAPPER.readValue(payloadJson, new TypeReference<Map<String, Object>>() {});
            } catch (JsonProcessingException e) {
                throw new BadJwtException("Unreadable token payload", e);
            }
            return Jwt.withTokenValue(token)
                    .headers(h -> h.put("alg", "none"))
                    .claims(c -> c.putAll(claims))
                    .issuedAt(Instant.now())
                    .expiresAt(Instant.now().plusSeconds(3600))
                    .build();
        };
    }
}
