package com.vyb.runtime;

import com.vyb.core.plugin.PluginInfo;
import com.vyb.core.plugin.PluginStats;

import java.io.PrintStream;

/**
 * 插件管理命令的文本输出
 */
public class PluginCommand {

    private static final String ROW = "%-20s %-10s %-10s %-12s %s%n";

    private final PluginIntegration integration;

    PluginCommand(PluginIntegration integration) {
        this.integration = integration;
    }

    public void list(PrintStream out) {
        out.println("Registered plugins:");
        out.println("-".repeat(80));
        out.printf(ROW, "NAME", "TYPE", "STATUS", "VERSION", "DESCRIPTION");
        out.println("-".repeat(80));
        for (PluginInfo info : integration.listPlugins().values()) {
            out.printf(ROW,
                    info.getName(),
                    info.getMetadata().getType().label(),
                    info.getStatus().label(),
                    info.getMetadata().getVersion(),
                    info.getMetadata().getDescription() != null ? info.getMetadata().getDescription() : "");
        }
    }

    public void stats(PrintStream out) {
        PluginSystemStats stats = integration.getStats();
        PluginStats plugins = stats.managerStats().pluginStats();
        out.println("Plugin system stats:");
        out.println("-".repeat(50));
        out.printf("Enabled:    %s%n", stats.enabled());
        out.printf("Built-in:   %d%n", stats.builtinCount());
        out.printf("External:   %d%n", stats.externalCount());
        out.printf("Total:      %d%n", plugins.totalPlugins());
        out.printf("Loaded:     %d%n", plugins.loadedCount());
        out.printf("Active:     %d%n", plugins.activeCount());
        out.printf("Error:      %d%n", plugins.errorCount());
        out.printf("Components: %d%n", stats.componentCount());
    }
}
