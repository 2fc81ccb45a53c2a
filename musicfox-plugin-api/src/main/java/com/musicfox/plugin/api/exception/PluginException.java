package com.musicfox.plugin.api.exception;

import lombok.Getter;

/**
 * 插件系统基础异常
 * <p>
 * 可选携带出错插件的 ID，便于上层日志与事件关联。
 */
@Getter
public class PluginException extends RuntimeException {

    private final String pluginId;

    public PluginException(String message) {
        this(null, message, null);
    }

    public PluginException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public PluginException(String pluginId, String message, Throwable cause) {
        super(message, cause);
        this.pluginId = pluginId;
    }
}
