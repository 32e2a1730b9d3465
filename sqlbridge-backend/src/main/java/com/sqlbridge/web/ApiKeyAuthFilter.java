package com.sqlbridge.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqlbridge.api.GatewayResponse;
import com.sqlbridge.config.GatewayProperties;
import com.sqlbridge.service.AuthException;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires the shared API key in {@code x-api-key} on every {@code /v1} request. Runs after
 * {@link TraceIdFilter} so rejections are traceable.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ApiKeyAuthFilter implements Filter {

    static final String API_KEY_HEADER = "x-api-key";
    private static final String PROTECTED_PREFIX = "/v1/";

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    public ApiKeyAuthFilter(GatewayProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (request instanceof HttpServletRequest httpRequest
                && response instanceof HttpServletResponse httpResponse
                && isProtected(httpRequest)) {
            try {
                authenticate(httpRequest.getHeader(API_KEY_HEADER));
            } catch (AuthException e) {
                reject(httpRequest, httpResponse, e);
                return;
            }
        }
        chain.doFilter(request, response);
    }

    void authenticate(String providedKey) {
        String expected = properties.getApiToken();
        if (expected == null || expected.isBlank()) {
            log.error("API token is not configured; rejecting request");
            throw new AuthException("Server configuration error", true);
        }
        if (providedKey == null || providedKey.isEmpty()) {
            throw new AuthException("Missing API key. Include x-api-key header.");
        }
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                providedKey.getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            throw new AuthException("Invalid API key.");
        }
    }

    private boolean isProtected(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.startsWith(PROTECTED_PREFIX) || path.equals("/v1");
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, AuthException e) throws IOException {
        HttpStatus status = e.isMisconfigured() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.UNAUTHORIZED;
        if (!e.isMisconfigured()) {
            log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        }
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(),
                GatewayResponse.failure(e.getCode(), e.getMessage(), MDC.get(TraceIdFilter.MDC_TRACE_ID)));
    }
}
