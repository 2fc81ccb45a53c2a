package com.musicfox.plugin.api.exception;

import lombok.Getter;

/**
 * 插件调用超时
 */
@Getter
public class PluginTimeoutException extends PluginOperationException {

    private final long timeoutMillis;

    public PluginTimeoutException(String pluginId, String message, long timeoutMillis) {
        super(pluginId, message);
        this.timeoutMillis = timeoutMillis;
    }
}
