package com.marketobserver.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：合并内置默认值、classpath 配置与工作目录下的 config.properties。
 * 使用建议：分析阈值为固定常量，不在此处配置；这里只放路径、时区等运行参数。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置。
 * 处理流程：classpath 上的 config.properties 先生效，工作目录下的同名文件覆盖之。
 * 维护提示：读取失败时沿用默认值，不中断启动。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * Defaults only; used by tests and embedded callers.
     */
    public static Config defaults(Path workingDir) {
        return new Config(workingDir);
    }

    public Config with(String key, String value) {
        putBoundValue(this, key, value);
        return this;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

/**
 * 方法说明：getPath，负责把相对路径解析到工作目录下。
 * 处理流程：值为空时返回工作目录本身。
 * 维护提示：调用方需自行区分“未配置”与“配置为工作目录”。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public ZoneId zone() {
        String raw = getString("app.zone", "Asia/Tokyo");
        try {
            return ZoneId.of(raw);
        } catch (Exception e) {
            System.err.println("WARN: invalid app.zone=" + raw + ", fallback to Asia/Tokyo");
            return ZoneId.of("Asia/Tokyo");
        }
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        String local = nonBlank(overrideProps.getProperty(key));
        if (!local.isEmpty()) {
            return "override";
        }
        String resource = nonBlank(resourceProps.getProperty(key));
        if (!resource.isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("app.zone", "Asia/Tokyo");
        defaults.put("outputs.dir", "outputs");
        defaults.put("history.path", "data/logs/history.json");
        defaults.put("keywords.path", "");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
