package com.musicfox.plugin.api.plugin;

import com.musicfox.plugin.api.context.PluginContext;

import java.util.Collections;
import java.util.List;

/**
 * 插件契约
 * <p>
 * 由各类加载器产出，编排器负责驱动其生命周期。
 * 所有回调都在独立任务中执行并受超时约束，抛出的任何异常都会被编排器捕获。
 * 可额外实现 {@code com.musicfox.plugin.api.cleanup} 包下的可选清理接口。
 */
public interface Plugin {

    PluginInfo getInfo();

    default List<String> getCapabilities() {
        return Collections.emptyList();
    }

    /**
     * 依赖的插件（按名称或 ID 匹配）
     */
    default List<String> getDependencies() {
        return Collections.emptyList();
    }

    void initialize(PluginContext context) throws Exception;

    void start() throws Exception;

    void stop() throws Exception;

    default void cleanup() throws Exception {
    }

    default void healthCheck() throws Exception {
    }

    /**
     * @return 指标快照，返回 null 时视为零值快照
     */
    default PluginMetrics getMetrics() throws Exception {
        return null;
    }

    default void handleEvent(Object event) throws Exception {
    }
}
