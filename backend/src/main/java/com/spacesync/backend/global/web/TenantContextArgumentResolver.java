package com.spacesync.backend.global.web;

import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.security.SecurityUtils;
import com.spacesync.backend.global.tenant.TenantContext;

import org.springframework.core.MethodParameter;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Lets controller methods declare a {@link TenantContext} parameter instead of reading the
 * security context themselves.
 */
public class TenantContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String TENANT_HEADER = "X-Tenant-Id";

    @Override
    public boolean supportsParameter(@NonNull MethodParameter parameter) {
        return TenantContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(@NonNull MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  @NonNull NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(TENANT_HEADER);
        UUID requested = null;
        if (StringUtils.hasText(header)) {
            try {
                requested = UUID.fromString(header.trim());
            } catch (IllegalArgumentException ex) {
                throw ProblemException.validation("tenant.invalid_header", TENANT_HEADER + " must be a UUID");
            }
        }
        return SecurityUtils.currentTenantContext(requested);
    }
}
