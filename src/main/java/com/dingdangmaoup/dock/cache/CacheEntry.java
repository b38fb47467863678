package com.dingdangmaoup.dock.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry<T> {
    private T value;
    private Instant insertedAt;

    public static <T> CacheEntry<T> of(T value) {
        return new CacheEntry<>(value, Instant.now());
    }
}
