package com.csd.bizintel.service;

import com.csd.bizintel.model.TrendsBundle;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Time-bounded store of trend bundles keyed by industry and location. An entry is served
 * while its age is below the TTL; after that it counts as absent and the next lookup
 * recomputes and overwrites it. Computation for one key runs at most once at a time.
 */
@Slf4j
@Component
public class TrendsCache {

    private final Cache<Key, TrendsBundle> cache;
    private final Duration ttl;

    public TrendsCache(Clock clock,
                       @Value("${bizintel.market.cache-ttl:PT6H}") Duration ttl,
                       @Value("${bizintel.market.cache-max-entries:1000}") long maxEntries) {
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .build();
        log.info("Trends cache configured with ttl={} maxEntries={}", ttl, maxEntries);
    }

    /**
     * Returns the live entry for the key or computes, stores and returns a new one. A
     * failing computation propagates and leaves nothing behind.
     */
    public TrendsBundle getOrCompute(Key key, Function<Key, TrendsBundle> loader) {
        return cache.get(key, k -> {
            log.info("Computing market trends for industry={} location={}", k.getIndustry(), k.getLocation());
            return loader.apply(k);
        });
    }

    public TrendsBundle getIfPresent(Key key) {
        return cache.getIfPresent(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public Duration getTtl() {
        return ttl;
    }

    public static final class Key {
        private final String industry;
        private final String location;

        private Key(String industry, String location) {
            this.industry = industry;
            this.location = location;
        }

        public static Key of(String industry, String location) {
            Objects.requireNonNull(industry, "industry");
            return new Key(industry.trim().toLowerCase(Locale.ROOT), location);
        }

        public String getIndustry() {
            return industry;
        }

        public String getLocation() {
            return location;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return industry.equals(other.industry) && Objects.equals(location, other.location);
        }

        @Override
        public int hashCode() {
            return Objects.hash(industry, location);
        }

        @Override
        public String toString() {
            return industry + "_" + location;
        }
    }
}
