package com.serge.appointments.config;

import com.serge.appointments.service.BusinessAccessGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Allows the businesses listed in the {@code business_ids} claim, given either as a JSON array
 * or as a space/comma separated string.
 */
@Component
public class JwtBusinessAccessGate implements BusinessAccessGate {
    private static final Logger log = LoggerFactory.getLogger(JwtBusinessAccessGate.class);
    static final String CLAIM = "business_ids";

    @Override
    public void requireAccess(Jwt caller, UUID businessId) {
        if (caller == null || !allowedBusinesses(caller).contains(businessId.toString())) {
            log.info("security.business_denied sub={} businessId={}", caller == null ? "-" : caller.getSubject(), businessId);
            throw new AccessDeniedException("Not allowed to manage business " + businessId);
        }
    }

    private static Set<String> allowedBusinesses(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM);
        if (claim instanceof Collection) {
            return ((Collection<?>) claim).stream().map(String::valueOf).map(String::trim).collect(Collectors.toSet());
        }
        if (claim instanceof String) {
            return Arrays.stream(((String) claim).split("[\\s,]+"))
                    .filter(s -> !s.isBlank())
                    .collect(Collectors.toSet());
        }
        return Set.of();
    }
}
