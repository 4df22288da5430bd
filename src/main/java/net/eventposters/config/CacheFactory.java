package net.eventposters.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 */
@Configuration
public class CacheFactory {

    private static final int MAX_CACHED_ASSETS = 64;

    /**
     * Create a cache with specified configuration.
     */
    public <K, V> Cache<K, V> createCache(int maxSize, Duration ttl) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a cache with size limit only (no TTL).
     */
    public <K, V> Cache<K, V> createCacheWithSize(int maxSize) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }

    /**
     * Raw asset bytes keyed by logical asset name. Assets are immutable, so entries never expire.
     */
    @Bean
    public Cache<String, byte[]> assetBytesCache() {
        return createCacheWithSize(MAX_CACHED_ASSETS);
    }
}
