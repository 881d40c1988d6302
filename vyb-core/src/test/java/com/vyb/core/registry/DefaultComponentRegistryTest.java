package com.vyb.core.registry;

import com.vyb.api.component.Bridge;
import com.vyb.api.component.Component;
import com.vyb.api.component.ComponentStatus;
import com.vyb.api.component.Extension;
import com.vyb.api.exception.DependencyCycleException;
import com.vyb.api.exception.DependencyUnsatisfiedException;
import com.vyb.api.exception.DuplicateNameException;
import com.vyb.api.exception.NotFoundException;
import com.vyb.api.exception.ShutdownException;
import com.vyb.api.exception.VybException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultComponentRegistry 单元测试")
class DefaultComponentRegistryTest {

    private DefaultModuleManager registry;
    private List<String> events;

    @BeforeEach
    void setUp() {
        registry = new DefaultModuleManager();
        events = Collections.synchronizedList(new ArrayList<>());
    }

    @Nested
    @DisplayName("注册")
    class RegistrationTests {

        @Test
        @DisplayName("同名组件跨层级重复注册应失败，原组件保持不变")
        void duplicateNameRejected() {
            Core logger = new Core("logger");
            registry.registerCore(logger);

            assertThrows(DuplicateNameException.class, () -> registry.registerCore(new Core("logger")));
            assertThrows(DuplicateNameException.class, () -> registry.registerExtension(new Ext("logger", 1)));
            assertThrows(DuplicateNameException.class, () -> registry.registerBridge(new Link("logger", true)));

            assertSame(logger, registry.getComponent("logger"));
        }

        @Test
        @DisplayName("未注册的名称查找失败")
        void unknownNameNotFound() {
            assertThrows(NotFoundException.class, () -> registry.getComponent("missing"));
        }

        @Test
        @DisplayName("注册后状态为未运行且不健康")
        void initialStatus() {
            registry.registerCore(new Core("config"));

            ComponentStatus status = registry.getStatus("config");
            assertFalse(status.running());
            assertFalse(status.healthy());
            assertNull(status.error());
        }

        @Test
        @DisplayName("形成依赖环的扩展应被拒绝")
        void cycleRejected() {
            registry.registerExtension(new Ext("a", 1, "b"));
            registry.registerExtension(new Ext("b", 2, "c"));

            DependencyCycleException ex = assertThrows(DependencyCycleException.class,
                    () -> registry.registerExtension(new Ext("c", 3, "a")));
            assertTrue(ex.getCycle().contains("c"));
            assertThrows(NotFoundException.class, () -> registry.getComponent("c"));
        }

        @Test
        @DisplayName("自依赖也是环")
        void selfDependencyRejected() {
            assertThrows(DependencyCycleException.class, () -> registry.registerExtension(new Ext("self", 1, "self")));
        }

        @Test
        @DisplayName("注销后可按同名重新注册")
        void unregisterThenRegisterAgain() {
            Core first = new Core("cache");
            registry.registerCore(first);

            assertSame(first, registry.unregister("cache"));
            assertNull(registry.unregister("cache"));
            assertEquals("component not found", registry.getStatus("cache").error());

            registry.registerCore(new Core("cache"));
            assertEquals(1, registry.listComponents().size());
        }
    }

    @Nested
    @DisplayName("启动")
    class InitializeTests {

        @Test
        @DisplayName("Core 先于依赖它们的扩展启动")
        void coresBeforeExtension() {
            registry.registerCore(new Core("logger"));
            registry.registerCore(new Core("config"));
            registry.registerExtension(new Ext("ai", 10, "config", "logger"));

            registry.initializeAll();

            assertEquals(List.of("init:logger", "init:config", "init:ai"), events);
            ComponentStatus ai = registry.getStatus("ai");
            assertTrue(ai.running());
            assertTrue(ai.healthy());
            assertNotNull(ai.startTime());
        }

        @Test
        @DisplayName("扩展按优先级升序启动，桥接在扩展之前")
        void priorityOrder() {
            registry.registerExtension(new Ext("late", 50));
            registry.registerExtension(new Ext("early", 5));
            registry.registerBridge(new Link("link", false));
            registry.registerCore(new Core("core"));

            registry.initializeAll();

            assertEquals(List.of("init:core", "init:link", "init:early", "init:late"), events);
        }

        @Test
        @DisplayName("依赖未注册时中止且不调用扩展的 initialize")
        void missingDependencyAborts() {
            registry.registerExtension(new Ext("ai", 10, "config"));

            DependencyUnsatisfiedException ex =
                    assertThrows(DependencyUnsatisfiedException.class, () -> registry.initializeAll());
            assertTrue(ex.getMessage().contains("config"));
            assertFalse(events.contains("init:ai"));
        }

        @Test
        @DisplayName("依赖启动失败时中止，已启动的组件不回滚")
        void failedDependencyAbortsWithoutRollback() {
            registry.registerCore(new Core("logger"));
            Ext broken = new Ext("db", 1);
            broken.failInit = true;
            registry.registerExtension(broken);
            registry.registerExtension(new Ext("ai", 10, "db"));

            assertThrows(VybException.class, () -> registry.initializeAll());

            assertTrue(registry.getStatus("logger").running());
            assertFalse(registry.getStatus("db").running());
            assertNotNull(registry.getStatus("db").error());
            assertFalse(events.contains("init:ai"));
            assertFalse(events.contains("shutdown:logger"));
        }

        @Test
        @DisplayName("禁用的扩展被跳过而不是失败")
        void disabledExtensionSkipped() {
            Ext off = new Ext("off", 1, "missing");
            off.enabled = false;
            registry.registerExtension(off);
            registry.registerExtension(new Ext("on", 2));

            assertDoesNotThrow(() -> registry.initializeAll());
            assertEquals(List.of("init:on"), events);
            assertFalse(registry.getStatus("off").running());
        }
    }

    @Nested
    @DisplayName("关闭")
    class ShutdownTests {

        @Test
        @DisplayName("按启动的逆序关闭每个组件恰好一次")
        void reverseOrder() {
            registry.registerCore(new Core("logger"));
            registry.registerBridge(new Link("link", true));
            registry.registerExtension(new Ext("b", 20));
            registry.registerExtension(new Ext("a", 10));
            registry.initializeAll();
            events.clear();

            registry.shutdownAll();

            assertEquals(List.of("shutdown:b", "shutdown:a", "shutdown:link", "shutdown:logger"), events);
            assertFalse(registry.getStatus("a").running());
        }

        @Test
        @DisplayName("单个组件关闭失败不影响其余组件，错误被聚合")
        void errorsAggregated() {
            Core first = new Core("first");
            first.failShutdown = true;
            registry.registerCore(first);
            Ext ext = new Ext("ext", 1);
            ext.failShutdown = true;
            registry.registerExtension(ext);
            registry.registerCore(new Core("second"));
            registry.initializeAll();
            events.clear();

            ShutdownException ex = assertThrows(ShutdownException.class, () -> registry.shutdownAll());

            assertEquals(List.of("shutdown:ext", "shutdown:second", "shutdown:first"), events);
            assertEquals(2, ex.getFailures().size());
            assertTrue(ex.getFailures().containsKey("first"));
            assertTrue(ex.getFailures().containsKey("ext"));
            assertEquals(2, ex.getSuppressed().length);
        }
    }

    // ==================== 测试组件 ====================

    private class Core implements Component {
        final String name;
        boolean failShutdown;

        Core(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void initialize() throws Exception {
            events.add("init:" + name);
        }

        @Override
        public void shutdown() throws Exception {
            events.add("shutdown:" + name);
            if (failShutdown) {
                throw new IllegalStateException(name + " refused to stop");
            }
        }

        @Override
        public void health() {
        }
    }

    private class Ext extends Core implements Extension {
        final int priority;
        final List<String> deps;
        boolean enabled = true;
        boolean failInit;

        Ext(String name, int priority, String... deps) {
            super(name);
            this.priority = priority;
            this.deps = List.of(deps);
        }

        @Override
        public void initialize() throws Exception {
            if (failInit) {
                throw new IllegalStateException(name + " cannot start");
            }
            super.initialize();
        }

        @Override
        public List<String> getDependencies() {
            return deps;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public int getPriority() {
            return priority;
        }
    }

    private class Link extends Core implements Bridge {
        final boolean required;

        Link(String name, boolean required) {
            super(name);
            this.required = required;
        }

        @Override
        public List<String> getConnectsTo() {
            return List.of("a", "b");
        }

        @Override
        public boolean isRequired() {
            return required;
        }
    }
}
