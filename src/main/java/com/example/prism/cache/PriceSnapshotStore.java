package com.example.prism.cache;

import com.example.prism.model.Price;

import java.util.Optional;

/**
 * Second-level store for last known prices, consulted when the in-memory
 * cache has nothing for a symbol (for example after a restart).
 */
public interface PriceSnapshotStore {

    void save(String source, String key, Price price);

    Optional<Price> load(String source, String key);
}
