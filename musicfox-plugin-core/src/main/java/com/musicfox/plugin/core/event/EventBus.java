package com.musicfox.plugin.core.event;

import com.musicfox.plugin.api.event.EventHandler;

/**
 * 进程内主题事件总线
 * <p>
 * 发布方与订阅方互不感知；处理器异常不会传播给发布方或其它处理器。
 */
public interface EventBus {

    /**
     * 发布事件，每个当前订阅者在独立任务中处理
     *
     * @return 派发的处理器数量
     */
    int publish(String topic, Object payload);

    void subscribe(String topic, EventHandler handler);

    /**
     * 订阅并记录归属插件，便于插件卸载时整体清理
     */
    void subscribe(String topic, EventHandler handler, String ownerId);

    /**
     * 移除该处理器在此主题上的一次订阅
     *
     * @return 是否确有移除
     */
    boolean unsubscribe(String topic, EventHandler handler);

    /**
     * 移除某插件名下的全部订阅
     *
     * @return 移除的订阅数
     */
    int unsubscribeOwner(String ownerId);

    int getSubscriberCount(String topic);

    void shutdown();
}
