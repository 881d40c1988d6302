package com.vyb.core.config;

import com.vyb.api.exception.ConfigValidationException;
import com.vyb.core.security.SecurityLevel;
import com.vyb.core.security.SecurityPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RuntimeConfigLoader 单元测试")
class RuntimeConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("文件不存在时返回默认值")
    void defaultsWhenMissing() {
        RuntimeConfig config = RuntimeConfigLoader.load(tempDir.resolve("absent.yml"));

        assertTrue(config.isAutoDiscovery());
        assertFalse(config.isAutoLoad());
        assertEquals(Duration.ofSeconds(30), config.getOperationTimeout());
        assertEquals(Duration.ofSeconds(5), config.getHealthTimeout());
        assertEquals(Duration.ofSeconds(1), config.getRestartDelay());
        assertEquals(10, config.getMaxConcurrent());
        assertEquals(SecurityLevel.MODERATE, config.getSecurityLevel());
        assertEquals(4, config.getSearchPaths().size());
    }

    @Test
    @DisplayName("解析 YAML，未出现的键保留默认值")
    void parsesYaml() throws Exception {
        Path file = tempDir.resolve(RuntimeConfigLoader.DEFAULT_FILE);
        Files.writeString(file, String.join("\n",
                "autoLoad: true",
                "discoveryInterval: 500ms",
                "operationTimeout: PT10S",
                "maxConcurrent: 4",
                "searchPaths: [./plugins, /opt/vyb]",
                "configDir: /srv/vyb/configs",
                "security:",
                "  level: strict",
                "  requireHashCheck: false",
                "  maxPluginSize: 1024",
                "  trustedHashes: {/opt/vyb/a.jar: abc}",
                "  blacklist: [evil]",
                ""));

        RuntimeConfig config = RuntimeConfigLoader.load(file);

        assertTrue(config.isAutoDiscovery());
        assertTrue(config.isAutoLoad());
        assertEquals(Duration.ofMillis(500), config.getDiscoveryInterval());
        assertEquals(Duration.ofSeconds(10), config.getOperationTimeout());
        assertEquals(Duration.ofSeconds(5), config.getHealthTimeout());
        assertEquals(4, config.getMaxConcurrent());
        assertEquals(List.of(Paths.get("./plugins"), Paths.get("/opt/vyb")), config.getSearchPaths());
        assertEquals(Paths.get("/srv/vyb/configs"), config.getConfigDir());
        assertEquals(SecurityLevel.STRICT, config.getSecurityLevel());
        assertEquals("abc", config.getTrustedHashes().get("/opt/vyb/a.jar"));
        assertEquals(List.of("evil"), config.getBlacklist());

        SecurityPolicy policy = config.toSecurityPolicy();
        assertFalse(policy.isRequireHashCheck());
        assertEquals(1024, policy.getMaxPluginSize());
    }

    @Test
    @DisplayName("空文档返回默认值")
    void emptyDocument() {
        RuntimeConfig config = RuntimeConfigLoader.load(new ByteArrayInputStream(new byte[0]));

        assertEquals(RuntimeConfig.defaults().getOperationTimeout(), config.getOperationTimeout());
    }

    @Test
    @DisplayName("类型错误抛 ConfigValidationException")
    void malformed() {
        String yaml = "maxConcurrent: lots\n";

        assertThrows(ConfigValidationException.class, () -> RuntimeConfigLoader.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    @DisplayName("~/ 展开为用户目录")
    void expandsHome() {
        String yaml = "configDir: ~/vyb-configs\n";

        RuntimeConfig config = RuntimeConfigLoader.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(Paths.get(System.getProperty("user.home"), "vyb-configs"), config.getConfigDir());
    }

    @ParameterizedTest(name = "{0} -> {1}ms")
    @CsvSource({
            "250ms, 250",
            "30s, 30000",
            "2m, 120000",
            "PT1.5S, 1500",
            "7, 7000"
    })
    @DisplayName("时长格式")
    void durations(String text, long millis) {
        assertEquals(Duration.ofMillis(millis), RuntimeConfigLoader.parseDuration(text));
    }

    @Test
    @DisplayName("非法时长")
    void invalidDuration() {
        assertThrows(ConfigValidationException.class, () -> RuntimeConfigLoader.parseDuration("soon"));
        assertEquals(Duration.ofSeconds(3), RuntimeConfigLoader.parseDuration(3));
    }
}
