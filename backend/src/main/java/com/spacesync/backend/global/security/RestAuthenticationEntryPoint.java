package com.spacesync.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final SecurityProblemWriter problemWriter;

    public RestAuthenticationEntryPoint(SecurityProblemWriter problemWriter) {
        this.problemWriter = problemWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        if (request.getAttribute(JwtAuthenticationFilter.REJECTED_TOKEN_ATTRIBUTE) != null) {
            problemWriter.write(request, response, HttpStatus.UNAUTHORIZED, "auth.invalid_token",
                    "Access token is expired or its signature does not verify");
            return;
        }
        problemWriter.write(request, response, HttpStatus.UNAUTHORIZED, "auth.missing_token",
                "A bearer access token is required");
    }
}
