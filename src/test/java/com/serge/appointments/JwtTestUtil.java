package com.serge.appointments;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Minimal JWT builder for tests (NOT cryptographically signed).
 * Decoded by {@link TestSecurityConfig}.
 */
public class JwtTestUtil {
    public static String minimalJwt(String subject, String scope) {
        return token("{\"sub\":\"" + subject + "\",\"scope\":\"" + scope + "\"}");
    }

    public static String businessJwt(String subject, UUID... businessIds) {
        String ids = Stream.of(businessIds).map(id -> "\"" + id + "\"").collect(Collectors.joining(","));
        return token("{\"sub\":\"" + subject + "\",\"scope\":\"business:manage\",\"business_ids\":[" + ids + "]}");
    }

    private static String token(String payloadJson) {
        return base64Url("{\"alg\":\"none\"}") + "." + base64Url(payloadJson) + ".";
    }

    private static String base64Url(String s) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(s.getBytes(StandardCharsets.UTF_8));
    }
}
