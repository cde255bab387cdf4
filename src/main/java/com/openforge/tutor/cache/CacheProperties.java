package com.openforge.tutor.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds tutor.cache.* from application.yml.
 *
 * baseUrl / apiKey address the provider's cached-content endpoint.  The
 * remaining values are TTLs for the in-process read caches.
 */
@ConfigurationProperties(prefix = "tutor.cache")
public record CacheProperties(
        @DefaultValue("https://generativelanguage.googleapis.com/v1beta") String baseUrl,
        String apiKey,
        @DefaultValue("7200") long ttlSeconds,
        @DefaultValue("90")   long renewalThresholdMinutes,
        @DefaultValue("5")    long agentTtlMinutes,
        @DefaultValue("60")   long masteryTtlSeconds,
        @DefaultValue("5")    long profileTtlMinutes,
        @DefaultValue("30")   int timeoutSeconds
) {}
