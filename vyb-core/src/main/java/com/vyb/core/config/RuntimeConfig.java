package com.vyb.core.config;

import com.vyb.core.security.SecurityLevel;
import com.vyb.core.security.SecurityPolicy;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 插件运行时全局配置
 * <p>
 * 职责：作为 Core 层的唯一配置入口，由宿主构建后显式传入各组件，不做全局单例。
 * 包含：
 * 1. 发现与自动加载开关
 * 2. 超时设置
 * 3. 安全策略初值（等级、可信哈希、黑名单）
 */
@Data
@Builder
@ToString
public class RuntimeConfig {

    // ================= 发现与加载 =================

    /**
     * 初始化时扫描搜索路径，并按 {@link #discoveryInterval} 周期性重扫
     */
    @Builder.Default
    private boolean autoDiscovery = true;

    /**
     * 初始化时自动加载已启用的插件
     */
    @Builder.Default
    private boolean autoLoad = false;

    @Builder.Default
    private Duration discoveryInterval = Duration.ofSeconds(30);

    /**
     * 插件搜索路径，按顺序扫描
     */
    @Builder.Default
    private List<Path> searchPaths = defaultSearchPaths();

    /**
     * 每插件配置文档目录
     */
    @Builder.Default
    private Path configDir = userHome().resolve(".vyb").resolve("plugin-configs");

    // ================= 超时 =================

    @Builder.Default
    private Duration operationTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private Duration healthTimeout = Duration.ofSeconds(5);

    /**
     * 重启时卸载与重新加载之间的间隔
     */
    @Builder.Default
    private Duration restartDelay = Duration.ofSeconds(1);

    /**
     * 管理器工作线程数
     */
    @Builder.Default
    private int maxConcurrent = 10;

    // ================= 安全 =================

    @Builder.Default
    private SecurityLevel securityLevel = SecurityLevel.MODERATE;

    @Builder.Default
    private boolean requireHashCheck = true;

    @Builder.Default
    private long maxPluginSize = SecurityPolicy.DEFAULT_MAX_PLUGIN_SIZE;

    /**
     * 插件文件路径 -> SHA-256（十六进制）
     */
    @Builder.Default
    private Map<String, String> trustedHashes = new HashMap<>();

    @Builder.Default
    private List<String> blacklist = new ArrayList<>();

    /**
     * 由配置派生安全策略初值
     */
    public SecurityPolicy toSecurityPolicy() {
        return SecurityPolicy.builder()
                .level(securityLevel)
                .requireHashCheck(requireHashCheck)
                .maxPluginSize(maxPluginSize)
                .build();
    }

    public static RuntimeConfig defaults() {
        return RuntimeConfig.builder().build();
    }

    static List<Path> defaultSearchPaths() {
        List<Path> paths = new ArrayList<>();
        paths.add(userHome().resolve(".vyb").resolve("plugins"));
        paths.add(Paths.get("plugins"));
        paths.add(Paths.get("extensions"));
        paths.add(Paths.get("/usr/local/lib/vyb-plugins"));
        return paths;
    }

    private static Path userHome() {
        return Paths.get(System.getProperty("user.home"));
    }
}
