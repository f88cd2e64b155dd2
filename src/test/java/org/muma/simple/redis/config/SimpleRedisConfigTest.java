package org.muma.simple.redis.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.simple.redis.protocol.RespCodec;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimpleRedisConfigTest {

    private SimpleRedisConfig config;

    @BeforeEach
    void setUp() {
        config = new SimpleRedisConfig();
        // 不受宿主机环境变量影响
        config.setEnvironment(Map.of());
    }

    @Test
    void testDefaults() {
        assertEquals(SimpleRedisConfig.DEFAULT_PORT, config.getPort());
        assertEquals(0, config.getWorkerThreads());
        assertEquals(RespCodec.DEFAULT_MAX_NESTING_DEPTH, config.getMaxNestingDepth());
        assertEquals(RespCodec.DEFAULT_MAX_INLINE_LENGTH, config.getMaxInlineLength());
    }

    @Test
    void testLoadFromClasspath() {
        config.loadConfig("test-redis.properties");

        assertEquals(7001, config.getPort());
        assertEquals(2, config.getWorkerThreads());
        assertEquals(4, config.getMaxNestingDepth());
        // 非法值回退到默认
        assertEquals(RespCodec.DEFAULT_MAX_INLINE_LENGTH, config.getMaxInlineLength());
        // 文件里没写的保持默认
        assertEquals(RespCodec.DEFAULT_MAX_BULK_LENGTH, config.getMaxBulkLength());
    }

    @Test
    void testOutOfRangeLimitsFallBackToDefaults() {
        config.loadConfig("bad-limits.properties");

        assertEquals(RespCodec.DEFAULT_MAX_NESTING_DEPTH, config.getMaxNestingDepth());
        assertEquals(RespCodec.DEFAULT_MAX_BULK_LENGTH, config.getMaxBulkLength());
        assertEquals(10, config.getMaxArrayLength());
        assertEquals(RespCodec.DEFAULT_MAX_INLINE_LENGTH, config.getMaxInlineLength());

        // 校验后的配置可以直接构造 codec
        assertDoesNotThrow(() -> RespCodec.fromConfig(config));
    }

    @Test
    void testMissingFileKeepsDefaults() {
        config.loadConfig("definitely-not-here.properties");
        assertEquals(SimpleRedisConfig.DEFAULT_PORT, config.getPort());
    }

    @Test
    void testEnvOverridesFile() {
        config.setEnvironment(Map.of("REDIS_PORT", "7100"));
        config.loadConfig("test-redis.properties");
        assertEquals(7100, config.getPort());
    }

    @Test
    void testArgsOverrideEverything() {
        config.setEnvironment(Map.of("REDIS_PORT", "7100"));
        config.loadConfig("test-redis.properties");
        config.parseArgs(new String[]{"--port", "7200", "--workers", "8", "--verbose"});

        assertEquals(7200, config.getPort());
        assertEquals(8, config.getWorkerThreads());
    }

    @Test
    void testInvalidArgKeepsPreviousValue() {
        config.parseArgs(new String[]{"--port", "abc"});
        assertEquals(SimpleRedisConfig.DEFAULT_PORT, config.getPort());
    }

    @Test
    void testCodecLimitsFollowConfig() {
        config.setMaxNestingDepth(1);
        RespCodec codec = RespCodec.fromConfig(config);

        assertTrue(codec.decode("*1\r\n:1\r\n".getBytes()).isComplete());
        assertThrows(RuntimeException.class, () -> codec.decode("*1\r\n*0\r\n".getBytes()));
    }
}
