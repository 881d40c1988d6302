package com.vyb.core.loader;

import com.vyb.api.exception.PluginLoadException;
import com.vyb.api.plugin.ComponentFactory;
import com.vyb.core.classloader.PluginClassLoader;
import com.vyb.core.plugin.PluginManifest;
import com.vyb.core.testing.TestComponents;
import com.vyb.core.testing.TestJars;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntryPointResolver 单元测试")
class EntryPointResolverTest {

    @TempDir
    Path tempDir;

    private PluginClassLoader loader;

    @AfterEach
    void tearDown() throws IOException {
        if (loader != null) {
            loader.close();
        }
    }

    @Test
    @DisplayName("唯一的服务注册解析为工厂实例")
    void singleProvider() throws Exception {
        open(TestJars.jar().factories(TestComponents.EchoFactory.class));

        ComponentFactory factory = EntryPointResolver.resolve("echo", PluginManifest.synthesize("echo"), loader);

        assertEquals(TestComponents.EchoFactory.class.getName(), factory.getClass().getName());
    }

    @Test
    @DisplayName("没有入口时加载失败")
    void noProvider() throws Exception {
        open(TestJars.jar());

        PluginLoadException ex = assertThrows(PluginLoadException.class,
                () -> EntryPointResolver.resolve("empty", PluginManifest.synthesize("empty"), loader));
        assertTrue(ex.getMessage().startsWith("plugin empty:"));
    }

    @Test
    @DisplayName("多个入口时加载失败")
    void multipleProviders() throws Exception {
        open(TestJars.jar().factories(TestComponents.EchoFactory.class, TestComponents.NullFactory.class));

        assertThrows(PluginLoadException.class,
                () -> EntryPointResolver.resolve("two", PluginManifest.synthesize("two"), loader));
    }

    @Test
    @DisplayName("清单 entryPoint 优先于服务注册")
    void manifestEntryPointOverrides() throws Exception {
        open(TestJars.jar().factories(TestComponents.EchoFactory.class));
        PluginManifest manifest = PluginManifest.synthesize("echo");
        manifest.setEntryPoint(TestComponents.NullFactory.class.getName());

        ComponentFactory factory = EntryPointResolver.resolve("echo", manifest, loader);

        assertEquals(TestComponents.NullFactory.class.getName(), factory.getClass().getName());
    }

    @Test
    @DisplayName("入口类签名不符时加载失败")
    void wrongSignature() throws Exception {
        open(TestJars.jar());
        PluginManifest manifest = PluginManifest.synthesize("bad");
        manifest.setEntryPoint(TestComponents.NotAFactory.class.getName());

        PluginLoadException ex = assertThrows(PluginLoadException.class,
                () -> EntryPointResolver.resolve("bad", manifest, loader));
        assertTrue(ex.getMessage().contains("invalid entry point signature"));
    }

    @Test
    @DisplayName("入口类不存在时加载失败")
    void missingClass() throws Exception {
        open(TestJars.jar());
        PluginManifest manifest = PluginManifest.synthesize("ghost");
        manifest.setEntryPoint("com.example.DoesNotExist");

        assertThrows(PluginLoadException.class, () -> EntryPointResolver.resolve("ghost", manifest, loader));
    }

    private void open(TestJars jar) throws IOException {
        Path file = jar.writeTo(tempDir.resolve("plugin.jar"));
        loader = new PluginClassLoader("test", new URL[]{file.toUri().toURL()}, getClass().getClassLoader());
    }
}
