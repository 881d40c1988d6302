package com.vyb.core.loader;

import com.vyb.core.plugin.PluginManifest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 插件发现服务
 * <p>
 * 职责：
 * 1. 扫描单个搜索目录（不递归）
 * 2. 按扩展名识别插件文件，跳过隐藏、备份和测试文件
 * 3. 解析清单
 * <p>
 * 单个文件失败只记录日志，不影响其余文件。
 */
@Slf4j
public class PluginDiscoveryService {

    private final List<String> extensions;

    public PluginDiscoveryService(Collection<String> extensions) {
        this.extensions = extensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 扫描目录
     *
     * @return 按文件名排序的发现结果
     * @throws IOException 目录无法列出
     */
    public List<DiscoveredPlugin> scan(Path root) throws IOException {
        if (!isValidRoot(root)) {
            return List.of();
        }

        List<Path> candidates;
        try (Stream<Path> files = Files.list(root)) {
            candidates = files
                    .filter(Files::isRegularFile)
                    .filter(this::hasPluginExtension)
                    .filter(file -> !shouldSkip(file))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<DiscoveredPlugin> discovered = new ArrayList<>();
        for (Path file : candidates) {
            try {
                PluginManifest manifest = PluginManifestLoader.load(file);
                discovered.add(new DiscoveredPlugin(manifest, file));
            } catch (Exception e) {
                log.warn("Failed to read manifest for {}: {}", file, e.getMessage());
            }
        }
        log.debug("Scanned {}: {} candidate(s), {} discovered", root, candidates.size(), discovered.size());
        return discovered;
    }

    /**
     * 隐藏文件、编辑器备份、测试产物一律跳过
     */
    static boolean shouldSkip(Path file) {
        String base = file.getFileName().toString();
        if (base.startsWith(".") || base.endsWith("~")) {
            return true;
        }
        return base.contains("_test") || base.contains("test_");
    }

    private boolean hasPluginExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    private boolean isValidRoot(Path root) {
        if (!Files.exists(root)) {
            log.debug("Plugin root does not exist: {}", root.toAbsolutePath());
            return false;
        }
        if (!Files.isDirectory(root)) {
            log.warn("Plugin root is not a directory: {}", root.toAbsolutePath());
            return false;
        }
        if (!Files.isReadable(root)) {
            log.error("Plugin root is not readable: {}", root.toAbsolutePath());
            return false;
        }
        return true;
    }
}
