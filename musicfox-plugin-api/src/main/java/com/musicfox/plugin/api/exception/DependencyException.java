package com.musicfox.plugin.api.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 依赖关系阻止了启动/停止/卸载
 */
@Getter
public class DependencyException extends PluginException {

    /**
     * 阻塞本次操作的插件 ID
     */
    private final List<String> blockingPluginIds;

    public DependencyException(String pluginId, String message) {
        this(pluginId, message, Collections.emptyList(), null);
    }

    public DependencyException(String pluginId, String message, List<String> blockingPluginIds, Throwable cause) {
        super(pluginId, message, cause);
        this.blockingPluginIds = blockingPluginIds == null ? Collections.emptyList() : List.copyOf(blockingPluginIds);
    }
}
