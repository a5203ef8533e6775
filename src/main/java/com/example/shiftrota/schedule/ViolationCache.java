package com.example.shiftrota.schedule;

import com.example.shiftrota.schedule.validation.ValidationReport;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Last validation result per team, used when a fresh validation misses its deadline.
 */
@Component
public class ViolationCache {

    public static final String CACHE_NAME = "team-violations";

    private final CacheManager cacheManager;
    private final Clock clock;

    public ViolationCache(CacheManager cacheManager, Clock clock) {
        this.cacheManager = cacheManager;
        this.clock = clock;
    }

    public void put(Long teamId, ValidationReport report) {
        cache().put(teamId, new CachedViolations(report, LocalDateTime.now(clock)));
    }

    public Optional<CachedViolations> get(Long teamId) {
        return Optional.ofNullable(cache().get(teamId, CachedViolations.class));
    }

    public void evict(Long teamId) {
        cache().evict(teamId);
    }

    private Cache cache() {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            throw new IllegalStateException("Cache not configured: " + CACHE_NAME);
        }
        return cache;
    }

    public record CachedViolations(ValidationReport report, LocalDateTime checkedAt) {
    }
}
