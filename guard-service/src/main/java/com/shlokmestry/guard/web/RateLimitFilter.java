package com.shlokmestry.guard.web;

import java.io.IOException;
import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.guard.config.RateLimitProps;
import com.shlokmestry.guard.observability.RateLimitMetrics;
import com.shlokmestry.guard.ratelimit.FixedWindowRateLimiter;
import com.shlokmestry.guard.ratelimit.RateLimitResult;
import com.shlokmestry.guard.ratelimit.RateLimitTier;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Counts every inbound request against its {@link RateLimitTier} before it reaches a
 * handler. Requests are keyed by the authenticated user, falling back to the client address.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";

    private final FixedWindowRateLimiter limiter;
    private final RateLimitProps props;
    private final RateLimitMetrics metrics;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(FixedWindowRateLimiter limiter,
                           RateLimitProps props,
                           RateLimitMetrics metrics,
                           ObjectMapper objectMapper) {
        this.limiter = limiter;
        this.props = props;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return props.excludedPaths().stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String path = request.getRequestURI();
        RateLimitTier tier = RateLimitTier.forPath(path);
        String identifier = identifier(request);

        RateLimitResult r = limiter.check(identifier, tier.limit(), tier.windowMs());
        metrics.decision(tier.name(), r.limited());

        response.setHeader(HEADER_LIMIT, String.valueOf(tier.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(Math.max(0, r.remaining())));
        response.setHeader(HEADER_RESET, String.valueOf(r.resetTime()));

        if (!r.limited()) {
            chain.doFilter(request, response);
            return;
        }

        log.info("ratelimit limited identifier={} tier={} path={} retryAfter={}",
                identifier, tier, path, r.retryAfterSeconds());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Too many requests");
        body.put("message", "Please try again later");
        body.put("retryAfter", r.retryAfterSeconds());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(r.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    static String identifier(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return principal.getName();
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? "unknown" : remote;
    }
}
