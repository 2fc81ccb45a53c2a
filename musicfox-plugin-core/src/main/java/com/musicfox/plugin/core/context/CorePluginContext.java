package com.musicfox.plugin.core.context;

import com.musicfox.plugin.api.context.PluginContext;
import com.musicfox.plugin.api.event.EventHandler;
import com.musicfox.plugin.api.exception.PermissionDeniedException;
import com.musicfox.plugin.api.exception.PluginException;
import com.musicfox.plugin.api.security.Permission;
import com.musicfox.plugin.core.event.EventBus;
import com.musicfox.plugin.core.security.SecurityManager;
import com.musicfox.plugin.core.service.ServiceRegistry;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 插件上下文实现
 * <p>
 * 每项能力在委派给事件总线/服务注册表前先经过 {@link SecurityManager} 判定。
 */
@Slf4j
public class CorePluginContext implements PluginContext {

    private final String pluginId;
    private final Map<String, Object> config;
    private final Path dataDirectory;
    private final EventBus eventBus;
    private final ServiceRegistry serviceRegistry;

    /**
     * 向编排器暴露安全管理器（卸载时撤销权限）
     */
    @Getter
    private final SecurityManager securityManager;

    // 本上下文建立的订阅，清理时统一撤销
    private final List<TopicHandler> subscriptions = new CopyOnWriteArrayList<>();

    private volatile boolean closed;

    public CorePluginContext(@NonNull String pluginId,
                             Map<String, Object> config,
                             Path dataDirectory,
                             @NonNull EventBus eventBus,
                             @NonNull ServiceRegistry serviceRegistry,
                             @NonNull SecurityManager securityManager) {
        this.pluginId = pluginId;
        this.config = config != null ? Collections.unmodifiableMap(config) : Collections.emptyMap();
        this.dataDirectory = dataDirectory;
        this.eventBus = eventBus;
        this.serviceRegistry = serviceRegistry;
        this.securityManager = securityManager;
    }

    @Override
    public String getPluginId() {
        return pluginId;
    }

    @Override
    public Map<String, Object> getConfig() {
        ensureOpen();
        checkPermission(Permission.CONFIG_ACCESS);
        return config;
    }

    @Override
    public Path getDataDirectory() {
        return dataDirectory;
    }

    @Override
    public void sendMessage(String topic, Object payload) {
        ensureOpen();
        checkPermission(Permission.EVENT_ACCESS);
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic cannot be empty.");
        }
        eventBus.publish(topic, payload);
    }

    @Override
    public Subscription subscribe(String topic, EventHandler handler) {
        ensureOpen();
        checkPermission(Permission.EVENT_ACCESS);
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic cannot be empty.");
        }
        eventBus.subscribe(topic, handler, pluginId);
        TopicHandler entry = new TopicHandler(topic, handler);
        subscriptions.add(entry);
        return () -> {
            if (subscriptions.remove(entry)) {
                eventBus.unsubscribe(topic, handler);
            }
        };
    }

    @Override
    public <T> Optional<T> getService(String name, Class<T> type) {
        ensureOpen();
        checkPermission(Permission.SERVICE_ACCESS);
        return serviceRegistry.findService(name, type);
    }

    private void checkPermission(Permission permission) {
        if (!securityManager.checkPermission(permission)) {
            log.warn("[{}] Permission denied: {}", pluginId, permission);
            throw new PermissionDeniedException(pluginId, "permission denied: " + permission);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new PluginException(pluginId, "plugin context is closed", null);
        }
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 撤销本上下文的全部订阅并关闭
     */
    public void cleanup() {
        if (closed) {
            return;
        }
        closed = true;
        for (TopicHandler entry : subscriptions) {
            eventBus.unsubscribe(entry.topic(), entry.handler());
        }
        subscriptions.clear();
        log.debug("[{}] Plugin context cleaned up", pluginId);
    }

    private record TopicHandler(String topic, EventHandler handler) {
    }
}
