package com.vyb.sample;

import com.vyb.api.component.Component;
import com.vyb.api.config.HostConfig;
import com.vyb.api.plugin.ComponentFactory;
import org.slf4j.Logger;

/**
 * 插件入口，通过 META-INF/services 暴露
 */
public class GreeterComponentFactory implements ComponentFactory {

    @Override
    public Component create(Logger logger, HostConfig config) {
        return new GreeterExtension(logger, config);
    }
}
