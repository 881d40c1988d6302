package com.vyb.api.component;

import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 组件元数据（用于展示和持久化）
 */
@Getter
@Setter
public class ComponentMetadata implements Serializable {

    private String name;
    private ComponentType type = ComponentType.EXTENSION;
    private String version = "1.0.0";
    private String description;
    private List<String> dependencies = new ArrayList<>();
    private boolean optional = true;
    private boolean enabled = true;

    public ComponentMetadata() {
    }

    public ComponentMetadata(String name, ComponentType type) {
        this.name = name;
        this.type = type;
    }

    /**
     * 深拷贝
     */
    public ComponentMetadata copy() {
        ComponentMetadata copy = new ComponentMetadata(name, type);
        copy.version = this.version;
        copy.description = this.description;
        copy.dependencies = this.dependencies != null ? new ArrayList<>(this.dependencies) : new ArrayList<>();
        copy.optional = this.optional;
        copy.enabled = this.enabled;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("ComponentMetadata{name='%s', type=%s, version='%s', enabled=%s}",
                name, type, version, enabled);
    }
}
