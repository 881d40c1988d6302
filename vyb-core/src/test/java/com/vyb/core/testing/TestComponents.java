package com.vyb.core.testing;

import com.vyb.api.component.Bridge;
import com.vyb.api.component.Component;
import com.vyb.api.component.Extension;
import com.vyb.api.config.HostConfig;
import com.vyb.api.plugin.ComponentFactory;
import org.slf4j.Logger;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件测试用组件与工厂
 */
public final class TestComponents {

    private TestComponents() {
    }

    /**
     * 可配置的扩展组件
     */
    public static class EchoExtension implements Extension {

        public final AtomicInteger initialized = new AtomicInteger();
        public final AtomicInteger shutdowns = new AtomicInteger();

        private final String name;
        private final List<String> dependencies;
        private volatile boolean running;
        private volatile boolean failShutdown;

        public EchoExtension(String name, List<String> dependencies) {
            this.name = name;
            this.dependencies = dependencies;
        }

        public void failOnShutdown() {
            this.failShutdown = true;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void initialize() {
            initialized.incrementAndGet();
            running = true;
        }

        @Override
        public void shutdown() throws Exception {
            shutdowns.incrementAndGet();
            running = false;
            if (failShutdown) {
                throw new Exception("shutdown failed");
            }
        }

        @Override
        public void health() {
            if (!running) {
                throw new IllegalStateException(name + " not running");
            }
        }

        @Override
        public List<String> getDependencies() {
            return dependencies;
        }

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public int getPriority() {
            return 10;
        }
    }

    /**
     * 只实现 Component 的组件
     */
    public static class PlainComponent implements Component {

        private final String name;

        public PlainComponent(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void initialize() {
        }

        @Override
        public void shutdown() {
        }

        @Override
        public void health() {
        }
    }

    public static class EchoBridge extends PlainComponent implements Bridge {

        public EchoBridge(String name) {
            super(name);
        }

        @Override
        public List<String> getConnectsTo() {
            return List.of("echo");
        }

        @Override
        public boolean isRequired() {
            return false;
        }
    }

    // ==================== 工厂 ====================

    public static class EchoFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) {
            logger.info("creating echo");
            return new EchoExtension("echo", List.of());
        }
    }

    public static class FailingFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) throws Exception {
            throw new Exception("boom");
        }
    }

    public static class NullFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) {
            return null;
        }
    }

    /**
     * 返回名为 echo 的普通组件，声明为扩展时层级不匹配
     */
    public static class PlainFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) {
            return new PlainComponent("echo");
        }
    }

    public static class SlowFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) throws Exception {
            Thread.sleep(2_000);
            return new EchoExtension("slow", List.of());
        }
    }

    /**
     * 插件自身缺类时工厂抛出的链接错误
     */
    public static class MissingClassFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) {
            throw new NoClassDefFoundError("com/missing/Dep");
        }
    }

    /**
     * 返回的组件在取名时抛出 Error
     */
    public static class BrokenNameFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) {
            return new PlainComponent("echo") {
                @Override
                public String getName() {
                    throw new AssertionError("name unavailable");
                }
            };
        }
    }

    /**
     * 关闭时长时间阻塞的扩展，直到被中断
     */
    public static class HangingExtension extends EchoExtension {

        public HangingExtension(String name) {
            super(name, List.of());
        }

        @Override
        public void shutdown() throws Exception {
            super.shutdown();
            Thread.sleep(30_000);
        }
    }

    public static class HangingFactory implements ComponentFactory {

        public static final AtomicInteger CREATED = new AtomicInteger();

        @Override
        public Component create(Logger logger, HostConfig config) {
            CREATED.incrementAndGet();
            return new HangingExtension("hang");
        }
    }

    /**
     * 调用 System.exit，供字节码扫描测试
     */
    public static class ExitingFactory implements ComponentFactory {
        @Override
        public Component create(Logger logger, HostConfig config) {
            if (config.isFeatureEnabled("exit")) {
                System.exit(1);
            }
            return new EchoExtension("echo", List.of());
        }
    }

    /**
     * 不实现 ComponentFactory
     */
    public static class NotAFactory {
    }
}
