package com.ringai.infrastructure.store;

import com.google.common.cache.Cache;
import com.ringai.domain.call.adapter.repository.IExpiringStore;

/**
 * 基于 Guava Cache 的过期存储，淘汰策略由传入的 Cache 决定。
 */
public class GuavaExpiringStore<K, V> implements IExpiringStore<K, V> {

    private final Cache<K, V> cache;

    public GuavaExpiringStore(Cache<K, V> cache) {
        this.cache = cache;
    }

    @Override
    public void put(K key, V value) {
        if (key == null || value == null) {
            return;
        }
        cache.put(key, value);
    }

    @Override
    public V get(K key) {
        return key == null ? null : cache.getIfPresent(key);
    }

    @Override
    public V delete(K key) {
        if (key == null) {
            return null;
        }
        // asMap().remove 不检查过期，先按存活条目读取
        V value = cache.getIfPresent(key);
        cache.invalidate(key);
        return value;
    }

    public long size() {
        return cache.size();
    }
}
