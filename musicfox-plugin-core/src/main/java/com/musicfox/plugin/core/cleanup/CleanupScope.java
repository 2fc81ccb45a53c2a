package com.musicfox.plugin.core.cleanup;

/**
 * 清理范围
 */
public enum CleanupScope {

    /**
     * 停止后的清理，插件仍留在编排器中
     */
    STOP,

    /**
     * 卸载时的完整清理
     */
    UNLOAD
}
