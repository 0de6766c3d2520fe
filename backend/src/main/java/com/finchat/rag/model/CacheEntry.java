package com.finchat.rag.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Value
public class CacheEntry {

    Map<String, Object> value;
    Instant createdAt;
    Duration ttl;

    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
