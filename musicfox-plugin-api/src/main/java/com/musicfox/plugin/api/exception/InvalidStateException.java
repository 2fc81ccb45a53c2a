package com.musicfox.plugin.api.exception;

/**
 * 状态守卫失败（当前状态不允许该操作或该迁移）
 */
public class InvalidStateException extends PluginException {

    public InvalidStateException(String pluginId, String message) {
        super(pluginId, message, null);
    }
}
