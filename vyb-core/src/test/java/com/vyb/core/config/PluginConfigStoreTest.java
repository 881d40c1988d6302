package com.vyb.core.config;

import com.vyb.api.exception.ConfigValidationException;
import com.vyb.api.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginConfigStore 单元测试")
class PluginConfigStoreTest {

    @TempDir
    Path tempDir;

    private Path configDir;
    private PluginConfigStore store;

    @BeforeEach
    void setUp() throws Exception {
        configDir = tempDir.resolve("configs");
        store = new PluginConfigStore(configDir);
        store.initialize();
    }

    @Nested
    @DisplayName("读写")
    class ReadWriteTests {

        @Test
        @DisplayName("未保存过的插件返回默认值且不落盘")
        void defaultsNotPersisted() {
            PluginConfig config = store.getPluginConfig("weather");

            assertEquals("weather", config.getName());
            assertTrue(config.isEnabled());
            assertEquals(0.8, config.getAdvanced().getCpuLimit());
            assertFalse(config.getAdvanced().getNetworkAccess().isAllowed());
            assertEquals(List.of("/tmp"), config.getAdvanced().getFileSystemAccess().getWritablePaths());
            assertFalse(Files.exists(configDir.resolve("weather.json")));
            assertTrue(store.listPluginConfigs().isEmpty());
        }

        @Test
        @DisplayName("保存后写入 JSON 文档并可由新实例读回")
        void saveAndReload() throws Exception {
            PluginConfig config = PluginConfig.defaults("weather");
            config.getSettings().put("city", "Berlin");
            config.getAdvanced().setTimeout(12);
            store.savePluginConfig(config);

            assertTrue(Files.isRegularFile(configDir.resolve("weather.json")));

            PluginConfigStore reopened = new PluginConfigStore(configDir);
            reopened.initialize();
            PluginConfig loaded = reopened.getPluginConfig("weather");

            assertEquals("Berlin", loaded.getSettings().get("city"));
            assertEquals(12, loaded.getAdvanced().getTimeout());
            assertNotNull(loaded.getUpdatedAt());
            assertEquals(List.of("weather"), reopened.listPluginConfigs());
        }

        @Test
        @DisplayName("返回副本，修改不影响存储")
        void returnsCopy() {
            store.setPluginSetting("weather", "city", "Paris");

            store.getPluginConfig("weather").getSettings().put("city", "Rome");

            assertEquals("Paris", store.getPluginSetting("weather", "city"));
        }

        @Test
        @DisplayName("合并设置项保留已有键")
        void updateSettingsMerges() {
            store.setPluginSetting("weather", "city", "Paris");
            store.updatePluginSettings("weather", Map.of("units", "metric"));

            Map<String, Object> settings = store.getPluginConfig("weather").getSettings();
            assertEquals("Paris", settings.get("city"));
            assertEquals("metric", settings.get("units"));
        }

        @Test
        @DisplayName("读取不存在的设置项抛 NotFoundException")
        void missingSetting() {
            NotFoundException ex = assertThrows(NotFoundException.class,
                    () -> store.getPluginSetting("weather", "city"));
            assertTrue(ex.getMessage().contains("setting 'city' not found for plugin 'weather'"));
        }

        @Test
        @DisplayName("删除同时清理缓存与文件")
        void delete() {
            store.setPluginSetting("weather", "city", "Paris");

            store.deletePluginConfig("weather");

            assertFalse(Files.exists(configDir.resolve("weather.json")));
            assertTrue(store.listPluginConfigs().isEmpty());
            assertTrue(store.getPluginConfig("weather").getSettings().isEmpty());
        }
    }

    @Nested
    @DisplayName("启用标记与统计")
    class EnabledTests {

        @Test
        @DisplayName("启用标记持久化")
        void enabledFlag() {
            store.setEnabled("weather", false);
            store.setEnabled("clock", true);

            assertFalse(store.isEnabled("weather"));
            assertTrue(store.isEnabled("clock"));
            assertTrue(store.isEnabled("never-seen"));

            ConfigStats stats = store.getConfigStats();
            assertEquals(2, stats.totalConfigs());
            assertEquals(1, stats.enabledConfigs());
            assertEquals(configDir, stats.configDir());
        }
    }

    @Nested
    @DisplayName("校验")
    class ValidationTests {

        @Test
        @DisplayName("非法配置被拒绝且不落盘")
        void invalidRejected() {
            PluginConfig cpu = PluginConfig.defaults("a");
            cpu.getAdvanced().setCpuLimit(1.5);
            PluginConfig memory = PluginConfig.defaults("b");
            memory.getAdvanced().setMemoryLimit(0);
            PluginConfig timeout = PluginConfig.defaults("c");
            timeout.getAdvanced().setTimeout(-1);
            PluginConfig unnamed = PluginConfig.defaults("");

            assertTrue(assertThrows(ConfigValidationException.class, () -> store.savePluginConfig(cpu))
                    .getMessage().contains("cpu limit must be between 0 and 1"));
            assertTrue(assertThrows(ConfigValidationException.class, () -> store.savePluginConfig(memory))
                    .getMessage().contains("memory limit must be positive"));
            assertTrue(assertThrows(ConfigValidationException.class, () -> store.savePluginConfig(timeout))
                    .getMessage().contains("timeout must be positive"));
            assertThrows(ConfigValidationException.class, () -> store.savePluginConfig(unnamed));
            assertEquals(0, store.getConfigStats().totalConfigs());
        }

        @Test
        @DisplayName("名称不能包含路径分隔符")
        void illegalName() {
            assertThrows(ConfigValidationException.class, () -> store.getPluginConfig("../escape"));
            assertThrows(ConfigValidationException.class, () -> store.getPluginConfig("a/b"));
        }

        @Test
        @DisplayName("初始化时跳过损坏文档")
        void corruptDocumentSkipped() throws Exception {
            Files.writeString(configDir.resolve("broken.json"), "{ nope");
            Files.writeString(configDir.resolve("ok.json"), "{\"settings\":{\"k\":1}}");

            PluginConfigStore reopened = new PluginConfigStore(configDir);
            reopened.initialize();

            assertEquals(List.of("ok"), reopened.listPluginConfigs());
            assertEquals(1, reopened.getPluginSetting("ok", "k"));
        }
    }
}
