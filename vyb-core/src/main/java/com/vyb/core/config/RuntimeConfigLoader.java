package com.vyb.core.config;

import com.vyb.api.exception.ConfigValidationException;
import com.vyb.core.security.SecurityLevel;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 运行时配置加载器
 * 读取 {@code vyb-runtime.yml}，未出现的键保留默认值
 * <pre>
 * autoDiscovery: true
 * discoveryInterval: 30s
 * searchPaths: [./plugins]
 * security:
 *   level: strict
 *   trustedHashes: {/opt/plugins/a.jar: 9f86d0...}
 * </pre>
 */
@Slf4j
public final class RuntimeConfigLoader {

    public static final String DEFAULT_FILE = "vyb-runtime.yml";

    private RuntimeConfigLoader() {
    }

    /**
     * 文件不存在时返回默认配置
     */
    public static RuntimeConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("Runtime config {} not found, using defaults", file);
            return RuntimeConfig.defaults();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, Object> raw = new Yaml(new LoaderOptions()).load(reader);
            log.info("Loaded runtime config from {}", file);
            return fromMap(raw);
        } catch (IOException e) {
            throw new ConfigValidationException("cannot read runtime config " + file + ": " + e.getMessage(), e);
        }
    }

    public static RuntimeConfig load(InputStream inputStream) {
        Map<String, Object> raw = new Yaml(new LoaderOptions()).load(inputStream);
        return fromMap(raw);
    }

    @SuppressWarnings("unchecked")
    static RuntimeConfig fromMap(Map<String, Object> raw) {
        RuntimeConfig.RuntimeConfigBuilder builder = RuntimeConfig.builder();
        if (raw == null) {
            return builder.build();
        }
        try {
            if (raw.containsKey("autoDiscovery")) {
                builder.autoDiscovery(asBoolean(raw.get("autoDiscovery")));
            }
            if (raw.containsKey("autoLoad")) {
                builder.autoLoad(asBoolean(raw.get("autoLoad")));
            }
            if (raw.containsKey("discoveryInterval")) {
                builder.discoveryInterval(parseDuration(raw.get("discoveryInterval")));
            }
            if (raw.containsKey("operationTimeout")) {
                builder.operationTimeout(parseDuration(raw.get("operationTimeout")));
            }
            if (raw.containsKey("healthTimeout")) {
                builder.healthTimeout(parseDuration(raw.get("healthTimeout")));
            }
            if (raw.containsKey("restartDelay")) {
                builder.restartDelay(parseDuration(raw.get("restartDelay")));
            }
            if (raw.containsKey("maxConcurrent")) {
                builder.maxConcurrent(((Number) raw.get("maxConcurrent")).intValue());
            }
            if (raw.containsKey("searchPaths")) {
                List<Path> paths = new ArrayList<>();
                for (Object p : (List<Object>) raw.get("searchPaths")) {
                    paths.add(expandHome(String.valueOf(p)));
                }
                builder.searchPaths(paths);
            }
            if (raw.containsKey("configDir")) {
                builder.configDir(expandHome(String.valueOf(raw.get("configDir"))));
            }

            Object security = raw.get("security");
            if (security instanceof Map) {
                applySecurity(builder, (Map<String, Object>) security);
            }
        } catch (ClassCastException e) {
            throw new ConfigValidationException("malformed runtime config: " + e.getMessage(), e);
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static void applySecurity(RuntimeConfig.RuntimeConfigBuilder builder, Map<String, Object> security) {
        if (security.containsKey("level")) {
            builder.securityLevel(SecurityLevel.parse(String.valueOf(security.get("level"))));
        }
        if (security.containsKey("requireHashCheck")) {
            builder.requireHashCheck(asBoolean(security.get("requireHashCheck")));
        }
        if (security.containsKey("maxPluginSize")) {
            builder.maxPluginSize(((Number) security.get("maxPluginSize")).longValue());
        }
        if (security.containsKey("trustedHashes")) {
            Map<String, String> hashes = new LinkedHashMap<>();
            ((Map<Object, Object>) security.get("trustedHashes"))
                    .forEach((k, v) -> hashes.put(String.valueOf(k), String.valueOf(v)));
            builder.trustedHashes(hashes);
        }
        if (security.containsKey("blacklist")) {
            List<String> names = new ArrayList<>();
            ((List<Object>) security.get("blacklist")).forEach(n -> names.add(String.valueOf(n)));
            builder.blacklist(names);
        }
    }

    private static boolean asBoolean(Object value) {
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * 支持纯数字（秒）、{@code 500ms}/{@code 30s}/{@code 5m} 以及 ISO-8601
     */
    static Duration parseDuration(Object value) {
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        try {
            if (text.startsWith("pt")) {
                return Duration.parse(text.toUpperCase(Locale.ROOT));
            }
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            }
            if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            return Duration.ofSeconds(Long.parseLong(text));
        } catch (RuntimeException e) {
            throw new ConfigValidationException("invalid duration '" + value + "'", e);
        }
    }

    private static Path expandHome(String path) {
        if (path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(2));
        }
        return Paths.get(path);
    }
}
