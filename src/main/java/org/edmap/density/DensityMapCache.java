package org.edmap.density;

import org.edmap.density.map.DensityMap;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 已解析密度图的内存缓存（带 TTL 的 LRU）。
 * <p>
 * 说明：
 * <ul>
 *   <li>key 为来源标识（例如 {@code file:root0:maps/1abc.ccp4}、{@code pdb:1abc}、{@code url:...}）。</li>
 *   <li>密度图解析后只读，可被多个工具调用并发共享。</li>
 *   <li>这是“性能优化”缓存，不保证与磁盘/远端强一致；调用方可通过 refresh 跳过缓存。</li>
 * </ul>
 */
public class DensityMapCache {

    private final boolean enabled;
    private final TtlLruCache<String, DensityMap> maps;

    public DensityMapCache(DensityServerProperties properties) {
        this.enabled = properties.isCacheEnabled();
        Duration ttl = Objects.requireNonNullElse(properties.getCacheTtl(), Duration.ofMinutes(30));
        this.maps = new TtlLruCache<>(Math.max(1, properties.getCacheMaxMaps()), ttl);
    }

    public DensityMap get(String key) {
        return enabled ? maps.get(key) : null;
    }

    public void put(String key, DensityMap map) {
        if (enabled) {
            maps.put(key, map);
        }
    }

    public void invalidate(String key) {
        maps.remove(key);
    }

    public int size() {
        return maps.size();
    }

    private static long safeToMillis(Duration duration, Duration fallback) {
        Duration d = (duration == null || duration.isNegative() || duration.isZero()) ? fallback : duration;
        return d.toMillis();
    }

    /**
     * 带 TTL 的 LRU 缓存。
     * <p>
     * 写入频率很低（每个来源只解析一次），使用 synchronized + LinkedHashMap（accessOrder=true）即可。
     */
    private static final class TtlLruCache<K, V> {
        private final int maxEntries;
        private final long ttlMillis;
        private final Object lock = new Object();

        // accessOrder=true：每次 get 会把条目移到末尾，实现近似 LRU
        private final LinkedHashMap<K, CacheValue<V>> map = new LinkedHashMap<>(16, 0.75f, true);

        TtlLruCache(int maxEntries, Duration ttl) {
            this.maxEntries = Math.max(1, maxEntries);
            this.ttlMillis = safeToMillis(ttl, Duration.ofMinutes(10));
        }

        V get(K key) {
            if (key == null) {
                return null;
            }
            long now = System.currentTimeMillis();
            synchronized (lock) {
                CacheValue<V> value = map.get(key);
                if (value == null) {
                    return null;
                }
                if (value.expiresAtMs() <= now) {
                    map.remove(key);
                    return null;
                }
                return value.value();
            }
        }

        void put(K key, V value) {
            if (key == null || value == null) {
                return;
            }
            long expiresAt = System.currentTimeMillis() + ttlMillis;
            synchronized (lock) {
                map.put(key, new CacheValue<>(value, expiresAt));
                // 超出容量则淘汰最久未访问的条目
                Iterator<Map.Entry<K, CacheValue<V>>> it = map.entrySet().iterator();
                while (map.size() > maxEntries && it.hasNext()) {
                    it.next();
                    it.remove();
                }
            }
        }

        void remove(K key) {
            if (key == null) {
                return;
            }
            synchronized (lock) {
                map.remove(key);
            }
        }

        int size() {
            synchronized (lock) {
                return map.size();
            }
        }

        private record CacheValue<V>(V value, long expiresAtMs) {
        }
    }
}
