package com.vyb.core.plugin;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 插件状态机
 * <pre>
 * UNLOADED -> LOADING -> LOADED -> ACTIVE
 *                     \-> ERROR
 * LOADED/ACTIVE -> UNLOADED | DISABLED
 * DISABLED -> UNLOADED (重新启用)
 * </pre>
 */
public enum PluginStatus {

    UNLOADED,
    LOADING,
    LOADED,
    ACTIVE,
    ERROR,
    DISABLED;

    public boolean canTransitionTo(PluginStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isLoaded() {
        return this == LOADED || this == ACTIVE;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    private Set<PluginStatus> allowedTargets() {
        switch (this) {
            case UNLOADED:
                return EnumSet.of(LOADING, DISABLED);
            case LOADING:
                return EnumSet.of(LOADED, ERROR);
            case LOADED:
                return EnumSet.of(ACTIVE, UNLOADED, DISABLED);
            case ACTIVE:
                return EnumSet.of(LOADED, UNLOADED, DISABLED);
            case ERROR:
                return EnumSet.of(LOADING, UNLOADED, DISABLED);
            case DISABLED:
                return EnumSet.of(UNLOADED);
            default:
                return EnumSet.noneOf(PluginStatus.class);
        }
    }
}
