package com.example.prism.cache;

import com.example.prism.model.Price;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-provider price cache with a fixed TTL.
 *
 * <p>Reads run concurrently, writes are exclusive. Entries are never evicted:
 * an expired entry is no longer fresh but still serves as the last known
 * price when the source fails. Writes go through to the snapshot store.
 *
 * <p>A key can also be marked absent: the source was asked and had nothing
 * for it. Absent keys count as fresh until the TTL passes but carry no price.
 */
public class PriceCache {

    private final String source;
    private final Duration ttl;
    private final Clock clock;
    private final PriceSnapshotStore mirror;

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public PriceCache(String source, Duration ttl, Clock clock, PriceSnapshotStore mirror) {
        this.source = source;
        this.ttl = ttl;
        this.clock = clock;
        this.mirror = mirror;
    }

    /**
     * All requested entries, or empty if any of them is missing or older than the TTL.
     */
    public Optional<List<Price>> getFresh(Collection<String> keys) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            List<Price> prices = new ArrayList<>(keys.size());
            for (String key : keys) {
                Entry entry = entries.get(key);
                if (entry == null || !isFresh(entry, now)) {
                    return Optional.empty();
                }
                if (entry.price() != null) {
                    prices.add(entry.price());
                }
            }
            return Optional.of(prices);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Splits the keys into fresh prices and keys that need fetching. Keys
     * freshly marked absent land in neither.
     */
    public Lookup lookup(Collection<String> keys) {
        Instant now = clock.instant();
        Map<String, Price> fresh = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (String key : keys) {
                Entry entry = entries.get(key);
                if (entry == null || !isFresh(entry, now)) {
                    missing.add(key);
                } else if (entry.price() != null) {
                    fresh.put(key, entry.price());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return new Lookup(fresh, missing);
    }

    /**
     * Most recent entry for the key regardless of age, falling back to the snapshot store.
     */
    public Optional<Price> getLastKnown(String key) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(key);
            if (entry != null && entry.price() != null) {
                return Optional.of(entry.price());
            }
        } finally {
            lock.readLock().unlock();
        }
        return mirror.load(source, key);
    }

    public void put(String key, Price price) {
        lock.writeLock().lock();
        try {
            entries.put(key, new Entry(price, clock.instant()));
        } finally {
            lock.writeLock().unlock();
        }
        mirror.save(source, key, price);
    }

    public void putAll(Map<String, Price> prices) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            prices.forEach((key, price) -> entries.put(key, new Entry(price, now)));
        } finally {
            lock.writeLock().unlock();
        }
        prices.forEach((key, price) -> mirror.save(source, key, price));
    }

    /**
     * Records that the source has no price for these keys. Not mirrored, and
     * an earlier price for the key is no longer reported as last known.
     */
    public void markAbsent(Collection<String> keys) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            keys.forEach(key -> entries.put(key, new Entry(null, now)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isFresh(Entry entry, Instant now) {
        return now.isBefore(entry.cachedAt().plus(ttl));
    }

    public record Lookup(Map<String, Price> fresh, List<String> missing) {

        public boolean isComplete() {
            return missing.isEmpty();
        }
    }

    // A null price marks a key the source had nothing for
    private record Entry(Price price, Instant cachedAt) {
    }
}
