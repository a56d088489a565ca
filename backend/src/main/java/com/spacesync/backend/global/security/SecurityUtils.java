package com.spacesync.backend.global.security;

import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "auth.missing_token");
        }
        return principal;
    }

    public static TenantContext currentTenantContext(UUID requestedTenantId) {
        return getCurrentPrincipal().tenantContext(requestedTenantId);
    }
}
