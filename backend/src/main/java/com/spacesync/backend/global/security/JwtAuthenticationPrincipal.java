package com.spacesync.backend.global.security;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.web.server.ResponseStatusException;

/**
 * Operator identity carried by an access token. Platform admins get the extra
 * {@code ROLE_PLATFORM_ADMIN} authority on top of the roles in the token.
 */
public record JwtAuthenticationPrincipal(UUID userId, UUID tenantId, boolean platformAdmin, List<String> roles) {

    public static final String PLATFORM_ADMIN_AUTHORITY = "ROLE_PLATFORM_ADMIN";

    public JwtAuthenticationPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public List<GrantedAuthority> authorities() {
        List<GrantedAuthority> authorities = new ArrayList<>(roles.size() + 1);
        roles.forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));
        if (platformAdmin) {
            authorities.add(new SimpleGrantedAuthority(PLATFORM_ADMIN_AUTHORITY));
        }
        return authorities;
    }

    /**
     * Resolves the tenant this request acts for. Only a platform admin may name a tenant other than
     * its own; the admin flag stays on so the context still reads across tenants.
     */
    public TenantContext tenantContext(UUID requestedTenantId) {
        if (platformAdmin) {
            return new TenantContext(requestedTenantId != null ? requestedTenantId : tenantId, userId, true);
        }
        if (requestedTenantId != null && !requestedTenantId.equals(tenantId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "tenant.switch_not_allowed");
        }
        return TenantContext.of(tenantId, userId);
    }
}
