package com.asiainfo.semantic.infra.cache;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 查询结果缓存配置
 */
@ApplicationScoped
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @ConfigProperty(name = "semantic.cache.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "semantic.cache.ttl-seconds", defaultValue = "300")
    int ttlSeconds;

    @ConfigProperty(name = "semantic.cache.max-size", defaultValue = "10000")
    int maxSize;

    @PostConstruct
    void init() {
        log.info("=== Query Cache Configuration ===");
        log.info("L1 (Caffeine): {} (TTL: {}s, MaxSize: {})",
                enabled ? "ENABLED" : "DISABLED", ttlSeconds, maxSize);
        log.info("=================================");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
