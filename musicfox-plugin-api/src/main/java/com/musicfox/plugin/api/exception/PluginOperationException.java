package com.musicfox.plugin.api.exception;

/**
 * 插件回调或加载器调用失败
 * <p>
 * 插件代码抛出的任何 Throwable（包括 Error）都会被包装成此异常，
 * 超时也属于此类（见 {@link PluginTimeoutException}）。
 */
public class PluginOperationException extends PluginException {

    public PluginOperationException(String pluginId, String message) {
        super(pluginId, message, null);
    }

    public PluginOperationException(String pluginId, String message, Throwable cause) {
        super(pluginId, message, cause);
    }
}
