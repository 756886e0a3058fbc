package com.demo.lending.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards operator endpoints with a shared bearer token. Reads pass; with no token
 * configured the operator surface is closed.
 */
public class AdminTokenInterceptor implements HandlerInterceptor {

    private static final String BEARER = "Bearer ";

    private final String adminToken;

    public AdminTokenInterceptor(String adminToken) {
        this.adminToken = adminToken;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("GET".equals(request.getMethod()) || "OPTIONS".equals(request.getMethod())) {
            return true;
        }
        requireAdmin(request);
        return true;
    }

    /** Throws 401, or 503 when no token is configured, unless the request carries the admin token. */
    public void requireAdmin(HttpServletRequest request) {
        if (!StringUtils.hasText(adminToken)) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Admin operations are disabled: app.admin-token not set");
        }
        String header = request.getHeader("Authorization");
        String presented = header != null && header.startsWith(BEARER) ? header.substring(BEARER.length()).trim() : "";
        if (!MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), adminToken.getBytes(StandardCharsets.UTF_8))) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Admin token required");
        }
    }
}
