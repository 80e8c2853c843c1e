package com.ubi.dbal.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 带单条过期时间的LRU存储（访问顺序LinkedHashMap）
 * 非线程安全，由外层缓存加锁
 */
final class TtlStore<K, V> {
    private final int maxEntries;
    private final LongSupplier nowMillis;
    private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

    private static final class Entry<V> {
        final V value;
        // 0表示永不过期
        final long expireAt;

        Entry(V value, long expireAt) {
            this.value = value;
            this.expireAt = expireAt;
        }
    }

    TtlStore(int maxEntries, LongSupplier nowMillis) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
        this.maxEntries = maxEntries;
        this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    }

    V get(K key) {
        Entry<V> e = map.get(key);
        if (e == null) return null;
        if (isExpired(e, nowMillis.getAsLong())) {
            map.remove(key);
            return null;
        }
        return e.value;
    }

    void put(K key, V value, long ttlMillis) {
        long expireAt = ttlMillis > 0 ? nowMillis.getAsLong() + ttlMillis : 0;
        map.put(key, new Entry<>(value, expireAt));
        while (map.size() > maxEntries) {
            Iterator<K> it = map.keySet().iterator();
            it.next();
            it.remove();
        }
    }

    void remove(K key) {
        map.remove(key);
    }

    int size() {
        return map.size();
    }

    /**
     * 清理过期条目
     * @return 清理的条目数
     */
    int pruneExpired() {
        long now = nowMillis.getAsLong();
        int removed = 0;
        Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            if (isExpired(it.next().getValue(), now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private boolean isExpired(Entry<V> e, long now) {
        return e.expireAt > 0 && now >= e.expireAt;
    }
}
