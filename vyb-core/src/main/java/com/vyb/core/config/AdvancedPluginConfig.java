package com.vyb.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 插件高级配置
 * <p>
 * 内存、CPU、并发等限制只是声明，运行时不做强制；真正生效的只有每次操作的超时。
 * 插件可自行读取这些值约束自身行为。
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AdvancedPluginConfig {

    public static final long DEFAULT_MEMORY_LIMIT = 100L * 1024 * 1024;

    private int loadOrder = 1000;

    /**
     * 字节
     */
    private long memoryLimit = DEFAULT_MEMORY_LIMIT;

    /**
     * 0 ~ 1
     */
    private double cpuLimit = 0.8;

    /**
     * 秒
     */
    private int timeout = 30;

    private RetryConfig retry = new RetryConfig();

    private ResourceLimits resourceLimits = new ResourceLimits();

    private Map<String, String> environment = new LinkedHashMap<>();

    private NetworkConfig networkAccess = new NetworkConfig();

    private FileSystemConfig fileSystemAccess = new FileSystemConfig();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private boolean enabled = true;
        private int maxAttempts = 3;
        /**
         * 秒
         */
        private int interval = 5;
        private boolean backoff = true;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResourceLimits {
        private int maxConcurrentTasks = 100;
        private int maxFiles = 50;
        private int maxSockets = 10;
        private long diskQuota = 1024L * 1024 * 1024;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NetworkConfig {
        private boolean allowed = false;
        private List<String> allowedHosts = new ArrayList<>();
        private List<String> blockedHosts = new ArrayList<>();
        private List<Integer> allowedPorts = new ArrayList<>();
        private boolean requireHttps = true;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FileSystemConfig {
        private List<String> readOnlyPaths = new ArrayList<>(List.of("/etc", "/usr"));
        private List<String> writablePaths = new ArrayList<>(List.of("/tmp"));
        private List<String> forbiddenPaths = new ArrayList<>(List.of("/system", "/var"));
        private boolean tempDirAccess = true;
    }
}
