package com.serge.appointments.service;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.UUID;

/**
 * Decides whether the caller may manage a business.
 */
public interface BusinessAccessGate {

    /**
     * @throws org.springframework.security.access.AccessDeniedException when not allowed
     */
    void requireAccess(Jwt caller, UUID businessId);
}
