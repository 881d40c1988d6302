package com.vyb.runtime;

import com.vyb.api.component.ComponentType;
import com.vyb.api.component.Extension;
import com.vyb.api.config.HostConfig;
import com.vyb.core.config.RuntimeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NativeVyb 启动器测试")
class NativeVybTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        NativeVyb.stop();
    }

    private RuntimeConfig config() {
        return RuntimeConfig.builder()
                .searchPaths(List.of(tempDir.resolve("plugins")))
                .configDir(tempDir.resolve("configs"))
                .build();
    }

    @Test
    @DisplayName("启动后可获取当前实例，重复启动返回同一实例")
    void startOnce() {
        PluginIntegration first = NativeVyb.start(config(), HostConfig.defaults(), List.of(
                BuiltinPlugin.of("counter", ComponentType.EXTENSION,
                        (logger, host) -> new PluginIntegrationTest.CounterExtension("counter"))));

        PluginIntegration second = NativeVyb.start(config(), HostConfig.defaults(), List.of());

        assertSame(first, second);
        assertSame(first, NativeVyb.current());
        assertTrue(first.listPlugins().containsKey("counter"));
        assertInstanceOf(Extension.class, first.listPlugins().get("counter").getComponent());
    }

    @Test
    @DisplayName("停止后实例被关闭且不可再获取")
    void stop() {
        PluginIntegration integration = NativeVyb.start(config(), HostConfig.defaults(), List.of());

        NativeVyb.stop();

        assertFalse(integration.isEnabled());
        assertThrows(IllegalStateException.class, NativeVyb::current);
        assertDoesNotThrow(NativeVyb::stop);
    }
}
