package com.serge.appointments.config;

import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtBusinessAccessGateTest {

    private final JwtBusinessAccessGate gate = new JwtBusinessAccessGate();
    private final UUID mine = UUID.randomUUID();
    private final UUID theirs = UUID.randomUUID();

    private static Jwt jwt(Object businessIds) {
        Jwt.Builder b = Jwt.withTokenValue("token").header("alg", "none").subject("owner-1");
        if (businessIds != null) b.claim(JwtBusinessAccessGate.CLAIM, businessIds);
        return b.build();
    }

    @Test
    void list_claim() {
        Jwt token = jwt(List.of(mine.toString()));
        assertThatCode(() -> gate.requireAccess(token, mine)).doesNotThrowAnyException();
        assertThatThrownBy(() -> gate.requireAccess(token, theirs)).isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void separated_string_claim() {
        Jwt token = jwt(theirs + ", " + mine);
        assertThatCode(() -> gate.requireAccess(token, mine)).doesNotThrowAnyException();
        assertThatCode(() -> gate.requireAccess(token, theirs)).doesNotThrowAnyException();
    }

    @Test
    void missing_claim_or_token_denies() {
        assertThatThrownBy(() -> gate.requireAccess(jwt(null), mine)).isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> gate.requireAccess(null, mine)).isInstanceOf(AccessDeniedException.class);
    }
}
