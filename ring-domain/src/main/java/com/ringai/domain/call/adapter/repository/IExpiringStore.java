package com.ringai.domain.call.adapter.repository;

/**
 * 带过期淘汰策略的键值存储。淘汰策略（写入后过期、容量上限）由实现方决定。
 *
 * @param <K> 键类型
 * @param <V> 值类型
 */
public interface IExpiringStore<K, V> {

    void put(K key, V value);

    /**
     * @return 不存在或已过期时返回 null
     */
    V get(K key);

    /**
     * 删除并返回原值，不存在时返回 null。
     */
    V delete(K key);
}
