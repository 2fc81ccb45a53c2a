package com.musicfox.plugin.api.exception;

/**
 * 权限拒绝异常
 * 当插件尝试执行未经授权的操作时抛出此异常。
 */
public class PermissionDeniedException extends PluginException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String pluginId, String message) {
        super(pluginId, message, null);
    }
}
