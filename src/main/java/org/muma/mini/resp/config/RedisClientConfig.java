package org.muma.mini.resp.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.mini.resp.protocol.RespDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * 客户端配置
 * 优先级: 环境变量 > 配置文件 (redis-client.properties) > 默认值
 * 只有显式调用 {@link #loadConfig(String)} 才会读取文件和环境变量。
 */
@Getter
@Setter
public class RedisClientConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisClientConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "redis-client.properties";

    // --- Server ---
    private String host = "127.0.0.1";
    private int port = 6379;

    // --- Timeouts ---
    private int connectTimeoutMillis = 3000;
    // 0 = 不限时
    private long commandTimeoutMillis = 30_000;

    // --- Netty ---
    private int ioThreads = 1;
    private boolean tcpNoDelay = true;
    private boolean wireLogging = false;

    // --- Protocol ---
    private int maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;
    private int maxLineLength = RespDecoder.DEFAULT_MAX_LINE_LENGTH;

    public RedisClientConfig loadConfig() {
        return loadConfig(DEFAULT_CONFIG_FILE);
    }

    public RedisClientConfig loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Server
        this.host = getString(props, "redis.host", this.host);
        this.port = getValue(props, "redis.port", this.port, Integer::parseInt);

        // 2. Client
        this.connectTimeoutMillis = getValue(props, "client.connect_timeout_ms", this.connectTimeoutMillis, Integer::parseInt);
        this.commandTimeoutMillis = getValue(props, "client.command_timeout_ms", this.commandTimeoutMillis, Long::parseLong);
        this.ioThreads = getValue(props, "client.io_threads", this.ioThreads, Integer::parseInt);
        this.tcpNoDelay = getValue(props, "client.tcp_nodelay", this.tcpNoDelay, RedisClientConfig::parseYesNo);
        this.wireLogging = getValue(props, "client.wire_logging", this.wireLogging, RedisClientConfig::parseYesNo);
        this.maxBulkLength = getValue(props, "client.max_bulk_length", this.maxBulkLength, RedisClientConfig::parseSize);
        this.maxLineLength = getValue(props, "client.max_line_length", this.maxLineLength, RedisClientConfig::parseSize);

        // 3. Env Vars Override
        applyEnvOverrides();

        log.info("RedisClientConfig initialized: {}", this);
        return this;
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
        String envHost = System.getenv("REDIS_HOST");
        if (envHost != null && !envHost.isBlank()) {
            this.host = envHost.trim();
            log.info("Host overridden by ENV: {}", this.host);
        }

        String envPort = System.getenv("REDIS_PORT");
        if (envPort != null) {
            try {
                this.port = Integer.parseInt(envPort.trim());
                log.info("Port overridden by ENV: {}", this.port);
            } catch (NumberFormatException e) {
                log.warn("Invalid REDIS_PORT '{}', keeping {}.", envPort, this.port);
            }
        }
    }

    // 辅助：解析带单位的大小 (64kb, 512mb, 1gb)
    static int parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        long size = Long.parseLong(s.trim()) * multiplier;
        if (size <= 0 || size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Size out of range: " + sizeStr);
        }
        return (int) size;
    }

    static boolean parseYesNo(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if ("yes".equals(v) || "true".equals(v)) {
            return true;
        }
        if ("no".equals(v) || "false".equals(v)) {
            return false;
        }
        throw new IllegalArgumentException("Expected yes/no: " + value);
    }

    // 非法值只打警告，保留原值
    private <T> T getValue(Properties props, String key, T defaultValue, Function<String, T> parser) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return parser.apply(val.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} value '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue).trim();
    }

    @Override
    public String toString() {
        return "Config{host=" + host + ", port=" + port + ", connectTimeout=" + connectTimeoutMillis
                + "ms, commandTimeout=" + commandTimeoutMillis + "ms, ioThreads=" + ioThreads + "}";
    }
}
