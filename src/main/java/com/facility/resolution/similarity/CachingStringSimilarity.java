package com.facility.resolution.similarity;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Caffeine-backed memoization of another {@link StringSimilarity}.
 * Pairs are cached unordered since every backend is symmetric.
 */
public class CachingStringSimilarity implements StringSimilarity {
    private static final Logger log = LoggerFactory.getLogger(CachingStringSimilarity.class);

    private final StringSimilarity delegate;
    private final Cache<PairKey, Double> cache;

    public CachingStringSimilarity(StringSimilarity delegate, CacheConfig config) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingStringSimilarity initialized: backend={}, maxSize={}, ttl={}s",
                delegate.getName(), config.maxSize(), config.ttlSeconds());
    }

    /**
     * Wraps {@code delegate} when caching is enabled, otherwise returns it unchanged.
     */
    public static StringSimilarity wrap(StringSimilarity delegate, CacheConfig config) {
        return config.enabled() ? new CachingStringSimilarity(delegate, config) : delegate;
    }

    @Override
    public double ratio(String a, String b) {
        if (a == null || b == null) {
            return delegate.ratio(a, b);
        }
        return cache.get(PairKey.of(a, b), key -> delegate.ratio(key.first(), key.second()));
    }

    @Override
    public String getName() {
        return "Cached(" + delegate.getName() + ")";
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    record PairKey(String first, String second) {
        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }
}
