package com.musicfox.plugin.api.exception;

/**
 * 卸载失败但已被强制回收
 * <p>
 * 收到此异常时插件已从管理器中移除，调用方不应再持有该插件对象。
 */
public class UnloadRecoveredException extends PluginException {

    public UnloadRecoveredException(String pluginId, Throwable cause) {
        super(pluginId, "plugin unload failed but recovered: " + (cause != null ? cause.getMessage() : "unknown"), cause);
    }
}
