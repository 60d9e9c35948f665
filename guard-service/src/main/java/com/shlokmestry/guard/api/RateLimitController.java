package com.shlokmestry.guard.api;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.guard.observability.RateLimitMetrics;
import com.shlokmestry.guard.ratelimit.FixedWindowRateLimiter;
import com.shlokmestry.guard.ratelimit.RateLimitResult;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/ratelimit")
public class RateLimitController {

    private static final String TIER = "custom";

    private final FixedWindowRateLimiter limiter;
    private final RateLimitMetrics metrics;

    public RateLimitController(FixedWindowRateLimiter limiter, RateLimitMetrics metrics) {
        this.limiter = limiter;
        this.metrics = metrics;
    }

    @PostMapping("/check")
    public CheckRateLimitResponse check(@Valid @RequestBody CheckRateLimitRequest req) {
        RateLimitResult r = limiter.check(req.identifier(), req.limit(), req.windowMs());
        metrics.decision(TIER, r.limited());
        return CheckRateLimitResponse.from(r);
    }

    @PostMapping("/status")
    public CheckRateLimitResponse status(@Valid @RequestBody CheckRateLimitRequest req) {
        return CheckRateLimitResponse.from(limiter.status(req.identifier(), req.limit(), req.windowMs()));
    }

    @DeleteMapping("/{identifier}")
    public ClearRateLimitResponse clear(@PathVariable String identifier) {
        int removed = limiter.clear(identifier);
        return new ClearRateLimitResponse(identifier, limiter.storageType(), removed);
    }
}
