package com.musicfox.plugin.api.event;

/**
 * 主题事件处理器
 */
@FunctionalInterface
public interface EventHandler {

    void handle(String topic, Object payload) throws Exception;
}
