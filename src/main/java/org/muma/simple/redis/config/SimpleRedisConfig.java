package org.muma.simple.redis.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.simple.redis.protocol.RespCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (redis.properties) > 默认值
 */
@Getter
@Setter
public class SimpleRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(SimpleRedisConfig.class);

    public static final int DEFAULT_PORT = 6500;

    // --- Core Settings ---
    private int port = DEFAULT_PORT;
    private int workerThreads = 0; // 0 = Netty default

    // --- Protocol Limits ---
    private int maxNestingDepth = RespCodec.DEFAULT_MAX_NESTING_DEPTH;
    private int maxBulkLength = RespCodec.DEFAULT_MAX_BULK_LENGTH;
    private int maxArrayLength = RespCodec.DEFAULT_MAX_ARRAY_LENGTH;
    private int maxInlineLength = RespCodec.DEFAULT_MAX_INLINE_LENGTH;

    private String configFilePath = "redis.properties"; // 默认

    // 环境变量来源，测试时可以替换
    private Map<String, String> environment = System.getenv();

    /**
     * 启动入口：先找 --config，再依次叠加配置文件、环境变量、命令行参数
     */
    public static SimpleRedisConfig load(String[] args) {
        SimpleRedisConfig config = new SimpleRedisConfig();
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config.setConfigFilePath(args[i + 1]);
            }
        }
        config.loadConfig(config.getConfigFilePath());
        config.parseArgs(args);
        return config;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                this.configFilePath = args[++i];
            } else if ("--port".equals(arg) && i + 1 < args.length) {
                this.port = parseInt("--port", args[++i], this.port);
            } else if ("--workers".equals(arg) && i + 1 < args.length) {
                this.workerThreads = parseInt("--workers", args[++i], this.workerThreads);
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
        log.info("Config loaded from args: port={}, workers={}", port, workerThreads);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Protocol
        this.maxNestingDepth = getLimit(props, "protocol.max_nesting_depth", this.maxNestingDepth, 1);
        this.maxBulkLength = getLimit(props, "protocol.max_bulk_length", this.maxBulkLength, 0);
        this.maxArrayLength = getLimit(props, "protocol.max_array_length", this.maxArrayLength, 0);
        this.maxInlineLength = getLimit(props, "protocol.max_inline_length", this.maxInlineLength, 1);

        // 3. Env Vars Override
        applyEnvOverrides();

        log.info("SimpleRedisConfig initialized: {}", this);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private void applyEnvOverrides() {
        String envPort = environment.get("REDIS_PORT");
        if (envPort != null) {
            this.port = parseInt("REDIS_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val.trim(), defaultValue) : defaultValue;
    }

    // 下限与 RespCodec 构造函数的校验一致，越界时保留原值
    private int getLimit(Properties props, String key, int defaultValue, int min) {
        int value = getInt(props, key, defaultValue);
        if (value < min) {
            log.warn("Invalid {} value {}, must be >= {}, using {}.", key, value, min, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private int parseInt(String source, String value, int defaultValue) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", source, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", workers=" + workerThreads
                + ", maxNestingDepth=" + maxNestingDepth + ", maxBulkLength=" + maxBulkLength
                + ", maxArrayLength=" + maxArrayLength + ", maxInlineLength=" + maxInlineLength + "}";
    }
}
