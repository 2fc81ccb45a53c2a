package com.musicfox.plugin.api.context;

import com.musicfox.plugin.api.event.EventHandler;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * 插件上下文
 * <p>
 * 插件与宿主交互的唯一入口，所有能力在委派前都会经过权限检查。
 */
public interface PluginContext {

    String getPluginId();

    /**
     * 插件配置（只读）
     */
    Map<String, Object> getConfig();

    /**
     * 插件私有数据目录
     */
    Path getDataDirectory();

    /**
     * 向事件总线发送消息
     *
     * @throws com.musicfox.plugin.api.exception.PermissionDeniedException 缺少 EVENT_ACCESS
     */
    void sendMessage(String topic, Object payload);

    /**
     * 订阅主题，返回的句柄用于取消订阅
     *
     * @throws com.musicfox.plugin.api.exception.PermissionDeniedException 缺少 EVENT_ACCESS
     */
    Subscription subscribe(String topic, EventHandler handler);

    /**
     * 按名称获取其它插件暴露的服务
     *
     * @throws com.musicfox.plugin.api.exception.PermissionDeniedException 缺少 SERVICE_ACCESS
     */
    <T> Optional<T> getService(String name, Class<T> type);

    @FunctionalInterface
    interface Subscription {
        void unsubscribe();
    }
}
