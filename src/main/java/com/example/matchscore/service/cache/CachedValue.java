package com.example.matchscore.service.cache;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

@Getter
@AllArgsConstructor
public class CachedValue {
    private final Object value;
    private final Duration ttl;
    private final Instant createdAt;
}
