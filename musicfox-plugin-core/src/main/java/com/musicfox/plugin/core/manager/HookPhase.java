package com.musicfox.plugin.core.manager;

/**
 * 钩子触发时机
 */
public enum HookPhase {
    PRE_START,
    POST_START,
    PRE_STOP,
    POST_STOP,
    PRE_UNLOAD,
    POST_UNLOAD,
    /**
     * 每次失败的尝试之后
     */
    ON_ERROR,
    /**
     * 卸载时资源清理之前
     */
    ON_CLEANUP
}
