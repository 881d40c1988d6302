package com.vyb.core.loader;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vyb.core.plugin.PluginManifest;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * 插件清单加载器
 * 查找顺序：同目录 {@code <name>.json} -> Jar 内 {@code plugin.yml} -> 按文件名合成
 */
@Slf4j
public class PluginManifestLoader {

    public static final String EMBEDDED_MANIFEST = "plugin.yml";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PluginManifestLoader() {
    }

    /**
     * 为插件文件解析清单
     *
     * @throws IOException 清单存在但无法解析
     */
    public static PluginManifest load(Path pluginFile) throws IOException {
        String baseName = baseName(pluginFile);

        Path sidecar = sidecarPath(pluginFile);
        if (Files.isRegularFile(sidecar)) {
            log.debug("[{}] Reading manifest {}", baseName, sidecar);
            return MAPPER.readValue(sidecar.toFile(), PluginManifest.class).normalize(baseName);
        }

        PluginManifest embedded = readEmbedded(pluginFile);
        if (embedded != null) {
            log.debug("[{}] Using embedded {}", baseName, EMBEDDED_MANIFEST);
            return embedded.normalize(baseName);
        }

        log.debug("[{}] No manifest found, synthesizing default", baseName);
        return PluginManifest.synthesize(baseName);
    }

    /**
     * 解析 YAML 清单
     */
    public static PluginManifest loadYaml(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions，不放开全局标签
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(PluginManifest.class, options);
        Yaml yaml = new Yaml(constructor);
        return yaml.load(inputStream);
    }

    public static Path sidecarPath(Path pluginFile) {
        return pluginFile.resolveSibling(baseName(pluginFile) + ".json");
    }

    public static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static PluginManifest readEmbedded(Path pluginFile) throws IOException {
        if (!pluginFile.getFileName().toString().toLowerCase().endsWith(".jar")) {
            return null;
        }
        try (JarFile jar = new JarFile(pluginFile.toFile())) {
            JarEntry entry = jar.getJarEntry(EMBEDDED_MANIFEST);
            if (entry == null) {
                return null;
            }
            try (InputStream in = jar.getInputStream(entry)) {
                return loadYaml(in);
            }
        }
    }
}
