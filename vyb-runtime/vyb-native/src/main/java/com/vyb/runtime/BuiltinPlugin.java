package com.vyb.runtime;

import com.vyb.api.component.ComponentType;
import com.vyb.api.plugin.ComponentFactory;

/**
 * 宿主提供的内置组件工厂
 */
public record BuiltinPlugin(String name, ComponentType type, String description, ComponentFactory factory) {

    public static BuiltinPlugin of(String name, ComponentType type, ComponentFactory factory) {
        return new BuiltinPlugin(name, type, "Built-in " + type.label() + " " + name, factory);
    }
}
