package com.vyb.api.component;

import java.util.List;

/**
 * 扩展组件
 * 在 Core 组件之后按优先级启动，启动前要求其依赖全部处于运行且健康状态
 *
 * @author vyb
 */
public interface Extension extends Component {

    /**
     * 依赖的组件名称
     */
    List<String> getDependencies();

    /**
     * 是否启用，未启用的扩展在 initializeAll 时被跳过
     */
    boolean isEnabled();

    /**
     * 启动优先级，数字越小越先启动
     */
    int getPriority();
}
