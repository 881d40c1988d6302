package com.vyb.core.security;

import java.util.Locale;

/**
 * 安全等级，按严格程度递增
 */
public enum SecurityLevel {

    LOW,
    MODERATE,
    HIGH,
    STRICT;

    public boolean isAtLeast(SecurityLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * 解析配置中的等级名称，无法识别时回退到 MODERATE
     */
    public static SecurityLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MODERATE;
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
