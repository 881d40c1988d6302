package com.vyb.core.plugin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginStatus 状态机")
class PluginStatusTest {

    @ParameterizedTest(name = "{0} -> {1} = {2}")
    @CsvSource({
            "UNLOADED, LOADING, true",
            "UNLOADED, LOADED, false",
            "LOADING, LOADED, true",
            "LOADING, ERROR, true",
            "LOADING, UNLOADED, false",
            "LOADED, ACTIVE, true",
            "ACTIVE, UNLOADED, true",
            "ERROR, LOADING, true",
            "DISABLED, UNLOADED, true",
            "DISABLED, LOADING, false"
    })
    @DisplayName("状态转换规则")
    void transitions(PluginStatus from, PluginStatus to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @Test
    @DisplayName("LOADED 与 ACTIVE 视为已加载")
    void loadedStates() {
        assertTrue(PluginStatus.LOADED.isLoaded());
        assertTrue(PluginStatus.ACTIVE.isLoaded());
        assertFalse(PluginStatus.ERROR.isLoaded());
        assertEquals("disabled", PluginStatus.DISABLED.label());
    }
}
