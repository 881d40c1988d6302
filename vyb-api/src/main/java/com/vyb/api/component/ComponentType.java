package com.vyb.api.component;

import java.util.Locale;

/**
 * 组件能力层级
 */
public enum ComponentType {

    CORE,
    EXTENSION,
    BRIDGE;

    /**
     * 解析清单中的类型字符串，无法识别时默认为 EXTENSION
     */
    public static ComponentType parse(String value) {
        if (value == null) {
            return EXTENSION;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "core":
                return CORE;
            case "bridge":
                return BRIDGE;
            default:
                return EXTENSION;
        }
    }

    /**
     * 判断组件实例是否具备该层级要求的能力集合
     */
    public boolean isSatisfiedBy(Component component) {
        switch (this) {
            case EXTENSION:
                return component instanceof Extension;
            case BRIDGE:
                return component instanceof Bridge;
            default:
                return component != null;
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
