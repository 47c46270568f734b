package com.asiainfo.semantic.infra.cache;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheConfig 单元测试
 */
@QuarkusTest
class CacheConfigTest {

    @Inject
    CacheConfig config;

    @Test
    void testCacheConfigLoaded() {
        assertNotNull(config);

        // 默认启用
        assertTrue(config.isEnabled(), "Query cache should be enabled by default");

        assertEquals(300, config.getTtlSeconds());
        assertEquals(10000, config.getMaxSize());
    }
}
