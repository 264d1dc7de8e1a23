package com.modellifecycle.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Resolves {@code X-Request-ID} (or generates one), echoes it on the response and exposes it
 * to log lines as the {@code requestId} MDC key.
 */
@Slf4j
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-ID";
    public static final String MDC_KEY = "requestId";

    private static final int MAX_LENGTH = 128;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        response.setHeader(HEADER, requestId);
        MDC.put(MDC_KEY, requestId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} | status={} | tookMs={}", request.getMethod(), request.getRequestURI(),
                      response.getStatus(), (System.nanoTime() - started) / 1_000_000);
            MDC.remove(MDC_KEY);
        }
    }

    /** Request id of the request being served on this thread, or null outside one. */
    public static String currentRequestId() {
        return MDC.get(MDC_KEY);
    }

    static String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader(HEADER);
        if (existing == null || existing.isBlank() || existing.length() > MAX_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return existing.trim();
    }
}
