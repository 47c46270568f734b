package com.asiainfo.semantic.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * L1 Caffeine 查询结果缓存
 * 缓存单值与分组查询结果。快照不可变，结果只随模型版本失效。
 */
@ApplicationScoped
public class QueryResultCache {

    private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);

    @Inject
    CacheConfig config;

    private Cache<QueryCacheKey, Object> cache;

    @PostConstruct
    void init() {
        cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(config.getMaxSize())
                .recordStats()
                .build();

        log.info("[L1 Cache] Initialized with TTL={}s, MaxSize={}",
                config.getTtlSeconds(), config.getMaxSize());
    }

    /**
     * 读缓存，未命中时计算并写入。计算抛出的异常原样传播，不缓存失败结果。
     */
    @SuppressWarnings("unchecked")
    public <T> T get(QueryCacheKey key, Supplier<T> loader) {
        if (!config.isEnabled()) {
            return loader.get();
        }
        Object value = cache.getIfPresent(key);
        if (value != null) {
            log.debug("[L1 Cache] Hit: {}", key);
            return (T) value;
        }
        log.debug("[L1 Cache] Miss: {}", key);
        T computed = loader.get();
        cache.put(key, computed);
        return computed;
    }

    /**
     * 失效指定模型版本之前的全部缓存
     */
    public void invalidateBefore(long modelVersion) {
        List<QueryCacheKey> stale = cache.asMap().keySet().stream()
                .filter(k -> k.modelVersion() < modelVersion)
                .collect(Collectors.toList());
        if (!stale.isEmpty()) {
            cache.invalidateAll(stale);
            log.info("[L1 Cache] Invalidated {} keys older than model version {}", stale.size(), modelVersion);
        }
    }

    /**
     * 清空所有缓存
     */
    public void invalidateAll() {
        cache.invalidateAll();
        log.info("[L1 Cache] Invalidated all");
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * 获取缓存统计
     */
    public String getStats() {
        var stats = cache.stats();
        return String.format("L1 Stats: hitRate=%.2f%%, size=%d, hits=%d, misses=%d",
                stats.hitRate() * 100,
                cache.estimatedSize(),
                stats.hitCount(),
                stats.missCount());
    }
}
