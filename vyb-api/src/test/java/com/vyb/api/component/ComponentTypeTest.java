package com.vyb.api.component;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComponentType 单元测试")
class ComponentTypeTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "core, CORE",
            " Bridge , BRIDGE",
            "extension, EXTENSION",
            "widget, EXTENSION"
    })
    @DisplayName("清单类型字符串解析，未知值回退为扩展")
    void parse(String value, ComponentType expected) {
        assertEquals(expected, ComponentType.parse(value));
    }

    @Test
    @DisplayName("空值回退为扩展")
    void parseNull() {
        assertEquals(ComponentType.EXTENSION, ComponentType.parse(null));
    }

    @Test
    @DisplayName("层级能力校验")
    void satisfiedBy() {
        Component plain = new Component() {
            @Override
            public String getName() {
                return "plain";
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
        };
        Bridge bridge = new Bridge() {
            @Override
            public List<String> getConnectsTo() {
                return List.of();
            }

            @Override
            public boolean isRequired() {
                return true;
            }

            @Override
            public String getName() {
                return "bridge";
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
        };

        assertTrue(ComponentType.CORE.isSatisfiedBy(plain));
        assertFalse(ComponentType.EXTENSION.isSatisfiedBy(plain));
        assertFalse(ComponentType.BRIDGE.isSatisfiedBy(plain));
        assertTrue(ComponentType.BRIDGE.isSatisfiedBy(bridge));
        assertEquals("bridge", ComponentType.BRIDGE.label());
    }

    @Test
    @DisplayName("元数据深拷贝")
    void metadataCopy() {
        ComponentMetadata metadata = new ComponentMetadata("ai", ComponentType.EXTENSION);
        metadata.getDependencies().add("config");

        ComponentMetadata copy = metadata.copy();
        copy.getDependencies().add("logger");
        copy.setEnabled(false);

        assertEquals(List.of("config"), metadata.getDependencies());
        assertTrue(metadata.isEnabled());
    }
}
