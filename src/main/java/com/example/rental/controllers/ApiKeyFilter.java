package com.example.rental.controllers;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * API key check for {@code /api/**}. Each client sends {@code X-API-Key} and {@code X-API-Extra};
 * clients are configured as {@code key:extra[:perm1;perm2]} in {@code api.auth.keys}.
 * A client without permissions may call every endpoint.
 */
@Slf4j
@Component
public class ApiKeyFilter extends OncePerRequestFilter {

    static final String API_KEY_HEADER = "X-API-Key";
    static final String EXTRA_HEADER = "X-API-Extra";
    private static final String API_PREFIX = "/api/";

    private final boolean enabled;
    private final Map<String, ApiClient> clients = new HashMap<>();

    public ApiKeyFilter(@Value("${api.auth.enabled:false}") boolean enabled,
                        @Value("${api.auth.keys:}") List<String> keys) {
        this.enabled = enabled;
        for (String entry : keys) {
            ApiClient client = ApiClient.parse(entry);
            if (client != null) {
                clients.put(client.key(), client);
            } else if (!entry.isBlank()) {
                log.warn("Ignoring malformed api.auth.keys entry, expected key:extra[:permissions]");
            }
        }
        if (enabled && clients.isEmpty()) {
            log.warn("api.auth.enabled is set but no api.auth.keys are configured, every API call will be refused");
        }
        log.info("API key check {}, {} clients", enabled ? "enabled" : "disabled", clients.size());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled || !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String key = trimmed(request.getHeader(API_KEY_HEADER));
        String extra = trimmed(request.getHeader(EXTRA_HEADER));
        if (key.isEmpty() || extra.isEmpty()) {
            reject(response, HttpStatus.UNAUTHORIZED, "missing api key headers");
            return;
        }
        ApiClient client = clients.get(key);
        if (client == null || !constantTimeEquals(client.extra(), extra)) {
            log.warn("Rejected API call to {} from {}", request.getRequestURI(), request.getRemoteAddr());
            reject(response, HttpStatus.UNAUTHORIZED, "invalid api key");
            return;
        }
        String required = requiredPermission(request.getRequestURI());
        if (required != null && !client.permissions().isEmpty() && !client.permissions().contains(required)) {
            reject(response, HttpStatus.FORBIDDEN, "permission denied");
            return;
        }
        filterChain.doFilter(request, response);
    }

    static String requiredPermission(String path) {
        if (path.startsWith("/api/v1/items")) return "read:items";
        if (path.startsWith("/api/v1/availability")) return "read:availability";
        return null;
    }

    private static void reject(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType("application/json");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("{\"error\":\"" + message + "\"}");
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    private static String trimmed(String header) {
        return header == null ? "" : header.trim();
    }

    record ApiClient(String key, String extra, Set<String> permissions) {

        static ApiClient parse(String entry) {
            String[] parts = entry.trim().split(":", 3);
            if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
                return null;
            }
            Set<String> permissions = parts.length == 3 && !parts[2].isBlank()
                    ? Set.copyOf(Arrays.asList(parts[2].trim().split("\\s*;\\s*")))
                    : Set.of();
            return new ApiClient(parts[0].trim(), parts[1].trim(), permissions);
        }
    }
}
