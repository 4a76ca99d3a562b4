package com.carescore.resilience;

/**
 * Creates named caches so each service gets its own typed cache over a shared backing policy.
 */
public interface ResultCacheFactory {

    <V> ResultCache<String, V> create(String name);
}
