package com.musicfox.plugin.core.service;

import com.musicfox.plugin.api.exception.InvalidArgumentException;
import com.musicfox.plugin.api.exception.PluginException;
import jakarta.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 服务注册表
 * 职责：按名称发布/查找服务实例；插件启动后以 {@code plugin.<name>} 发布自身，
 * 以 {@code plugin.<name>.context} 发布其上下文
 */
@Slf4j
public class ServiceRegistry {

    // 名称 -> 服务实例
    private final Map<String, Object> services = new ConcurrentHashMap<>();

    public static String pluginServiceName(String pluginName) {
        return "plugin." + pluginName;
    }

    public static String contextServiceName(String pluginName) {
        return "plugin." + pluginName + ".context";
    }

    // ==================== 服务注册 ====================

    /**
     * 注册服务
     *
     * @return 是否为新注册（false 表示覆盖）
     */
    public boolean registerService(String name, Object service) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("name", "Service name cannot be null or blank");
        }
        if (service == null) {
            throw new InvalidArgumentException("service", "Service cannot be null");
        }
        Object previous = services.put(name, service);
        if (previous != null) {
            log.warn("Service overwritten: {}", name);
        } else {
            log.debug("Service registered: {}", name);
        }
        return previous == null;
    }

    /**
     * @throws PluginException 服务不存在
     */
    public Object getService(String name) {
        Object service = services.get(name);
        if (service == null) {
            throw new PluginException("service " + name + " not found");
        }
        return service;
    }

    public <T> Optional<T> findService(String name, Class<T> type) {
        Object service = services.get(name);
        if (type.isInstance(service)) {
            return Optional.of(type.cast(service));
        }
        return Optional.empty();
    }

    public boolean unregisterService(String name) {
        boolean removed = services.remove(name) != null;
        if (removed) {
            log.debug("Service unregistered: {}", name);
        }
        return removed;
    }

    public List<String> listServices() {
        List<String> names = new ArrayList<>(services.keySet());
        Collections.sort(names);
        return names;
    }

    public boolean hasService(String name) {
        return services.containsKey(name);
    }

    public RegistryStats getStats() {
        return new RegistryStats(services.size());
    }

    public void clear() {
        services.clear();
    }

    public record RegistryStats(int serviceCount) {
        @Nonnull
        @Override
        public String toString() {
            return String.format("RegistryStats{services=%d}", serviceCount);
        }
    }
}
