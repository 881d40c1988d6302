package com.vyb.core.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 插件安全策略
 * 由 {@link PluginSecurity} 独占持有，只能通过其方法修改
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecurityPolicy {

    public static final long DEFAULT_MAX_PLUGIN_SIZE = 50L * 1024 * 1024;

    @Builder.Default
    private SecurityLevel level = SecurityLevel.MODERATE;

    /**
     * 签名校验，当前只作为策略声明
     */
    @Builder.Default
    private boolean requireSignature = false;

    @Builder.Default
    private boolean requireHashCheck = true;

    @Builder.Default
    private boolean allowUnsignedLocal = true;

    @Builder.Default
    private long maxPluginSize = DEFAULT_MAX_PLUGIN_SIZE;

    @Builder.Default
    private List<String> allowedExtensions = new ArrayList<>(List.of(".jar"));

    @Builder.Default
    private List<String> restrictedPaths = new ArrayList<>(List.of("/system", "/etc", "/var"));

    public SecurityPolicy copy() {
        return toBuilder()
                .allowedExtensions(new ArrayList<>(allowedExtensions))
                .restrictedPaths(new ArrayList<>(restrictedPaths))
                .build();
    }
}
