package com.vyb.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vyb.api.exception.ConfigValidationException;
import com.vyb.api.exception.NotFoundException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 插件配置存储
 * <p>
 * 职责：缓存 + 每插件一份 JSON 文档。读取顺序：缓存 -> 文件 -> 默认值（默认值不落盘）。
 * 写入先写临时文件再原子替换，读者不会看到半份文档。
 */
@Slf4j
public class PluginConfigStore {

    private static final String SUFFIX = ".json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Getter
    private final Path configDir;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, PluginConfig> cache = new HashMap<>();

    public PluginConfigStore(Path configDir) {
        this.configDir = configDir;
    }

    /**
     * 创建配置目录并加载已有文档，单个损坏文档只记录日志
     */
    public void initialize() throws IOException {
        Files.createDirectories(configDir);
        int loaded = 0;
        lock.writeLock().lock();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(configDir, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    PluginConfig config = read(file);
                    cache.put(config.getName(), config);
                    loaded++;
                } catch (ConfigValidationException e) {
                    log.warn("Skipping plugin config {}: {}", file, e.getMessage());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Plugin config store ready at {}: {} document(s) loaded", configDir, loaded);
    }

    /**
     * 获取插件配置副本
     *
     * @throws ConfigValidationException 持久化文档格式错误
     */
    public PluginConfig getPluginConfig(String name) {
        checkName(name);
        lock.readLock().lock();
        try {
            PluginConfig cached = cache.get(name);
            if (cached != null) {
                return copy(cached);
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            PluginConfig cached = cache.get(name);
            if (cached != null) {
                return copy(cached);
            }
            Path file = fileOf(name);
            if (Files.isRegularFile(file)) {
                PluginConfig config = read(file);
                cache.put(name, config);
                return copy(config);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return PluginConfig.defaults(name);
    }

    public void savePluginConfig(PluginConfig config) {
        validatePluginConfig(config);
        lock.writeLock().lock();
        try {
            PluginConfig stored = copy(config);
            stored.setUpdatedAt(Instant.now());
            write(stored);
            cache.put(stored.getName(), stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Plugin config saved", config.getName());
    }

    /**
     * 合并设置项
     */
    public void updatePluginSettings(String name, Map<String, Object> settings) {
        lock.writeLock().lock();
        try {
            PluginConfig config = getPluginConfig(name);
            config.getSettings().putAll(settings);
            savePluginConfig(config);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setPluginSetting(String name, String key, Object value) {
        lock.writeLock().lock();
        try {
            PluginConfig config = getPluginConfig(name);
            config.getSettings().put(key, value);
            savePluginConfig(config);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws NotFoundException 设置项不存在
     */
    public Object getPluginSetting(String name, String key) {
        PluginConfig config = getPluginConfig(name);
        if (!config.getSettings().containsKey(key)) {
            throw new NotFoundException("setting '" + key + "' not found for plugin '" + name + "'");
        }
        return config.getSettings().get(key);
    }

    /**
     * 持久化启用标记
     */
    public void setEnabled(String name, boolean enabled) {
        lock.writeLock().lock();
        try {
            PluginConfig config = getPluginConfig(name);
            config.getMetadata().setEnabled(enabled);
            savePluginConfig(config);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isEnabled(String name) {
        return getPluginConfig(name).isEnabled();
    }

    /**
     * 同时删除缓存与文件
     */
    public void deletePluginConfig(String name) {
        checkName(name);
        lock.writeLock().lock();
        try {
            cache.remove(name);
            Files.deleteIfExists(fileOf(name));
        } catch (IOException e) {
            throw new ConfigValidationException("cannot delete config for plugin '" + name + "': " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Plugin config deleted", name);
    }

    public List<String> listPluginConfigs() {
        lock.readLock().lock();
        try {
            List<String> names = new ArrayList<>(cache.keySet());
            Collections.sort(names);
            return names;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ConfigStats getConfigStats() {
        lock.readLock().lock();
        try {
            int enabled = (int) cache.values().stream().filter(PluginConfig::isEnabled).count();
            return new ConfigStats(cache.size(), enabled, configDir);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 校验配置：名称非空，内存上限为正，CPU 上限在 [0,1]，超时为正
     */
    public static void validatePluginConfig(PluginConfig config) {
        if (config == null) {
            throw new ConfigValidationException("plugin config is null");
        }
        String name = config.getName();
        if (name == null || name.isBlank()) {
            throw new ConfigValidationException("plugin config: name must not be empty");
        }
        AdvancedPluginConfig advanced = config.getAdvanced();
        if (advanced == null) {
            throw new ConfigValidationException("plugin " + name + ": advanced config missing");
        }
        if (advanced.getMemoryLimit() <= 0) {
            throw new ConfigValidationException("plugin " + name + ": memory limit must be positive");
        }
        if (advanced.getCpuLimit() < 0 || advanced.getCpuLimit() > 1) {
            throw new ConfigValidationException("plugin " + name + ": cpu limit must be between 0 and 1");
        }
        if (advanced.getTimeout() <= 0) {
            throw new ConfigValidationException("plugin " + name + ": timeout must be positive");
        }
    }

    // ==================== 内部方法 ====================

    private Path fileOf(String name) {
        return configDir.resolve(name + SUFFIX);
    }

    private static void checkName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigValidationException("plugin config: name must not be empty");
        }
        if (name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new ConfigValidationException("plugin config: illegal name '" + name + "'");
        }
    }

    private static PluginConfig read(Path file) {
        PluginConfig config;
        try {
            config = MAPPER.readValue(file.toFile(), PluginConfig.class);
        } catch (IOException e) {
            throw new ConfigValidationException("malformed plugin config " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigValidationException("empty plugin config " + file);
        }
        if (config.getName() == null) {
            String fileName = file.getFileName().toString();
            config.setName(fileName.substring(0, fileName.length() - SUFFIX.length()));
        }
        if (config.getMetadata() == null) {
            config.setMetadata(PluginConfig.defaults(config.getName()).getMetadata());
        }
        if (config.getSettings() == null) {
            config.setSettings(new HashMap<>());
        }
        validatePluginConfig(config);
        return config;
    }

    private void write(PluginConfig config) {
        Path target = fileOf(config.getName());
        Path temp = null;
        try {
            Files.createDirectories(configDir);
            temp = Files.createTempFile(configDir, config.getName(), ".tmp");
            MAPPER.writeValue(temp.toFile(), config);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTemp(temp);
            throw new ConfigValidationException(
                    "cannot write config for plugin '" + config.getName() + "': " + e.getMessage(), e);
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", temp, e.getMessage());
        }
    }

    private static PluginConfig copy(PluginConfig config) {
        return MAPPER.convertValue(config, PluginConfig.class);
    }
}
