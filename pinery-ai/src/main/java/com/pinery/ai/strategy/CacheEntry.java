package com.pinery.ai.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Accepted conversion stored under the hash of its normalized source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
    String hash,
    String code,
    String className,
    String strategyUsed,
    double costUsd,
    Instant createdAt,
    int ttlDays,
    List<String> indicatorsUsed
) {

    public CacheEntry {
        indicatorsUsed = indicatorsUsed == null ? List.of() : List.copyOf(indicatorsUsed);
    }

    public boolean isExpired(Instant now) {
        return createdAt == null || now.isAfter(createdAt.plus(Duration.ofDays(ttlDays)));
    }
}
