package com.vyb.api.component;

import java.util.List;

/**
 * 桥接组件
 * 连接两个或多个扩展组件
 *
 * @author vyb
 */
public interface Bridge extends Component {

    /**
     * 连接的扩展名称
     */
    List<String> getConnectsTo();

    /**
     * 是否为必需的桥接组件
     */
    boolean isRequired();
}
