package com.musicfox.plugin.core.resource;

/**
 * 资源超限时的处置策略
 */
public enum EnforceMode {

    /**
     * 仅记录日志
     */
    WARN,

    /**
     * 记录违规，由外部执行限流
     */
    LIMIT,

    /**
     * 标记插件需要强制停止
     */
    KILL
}
