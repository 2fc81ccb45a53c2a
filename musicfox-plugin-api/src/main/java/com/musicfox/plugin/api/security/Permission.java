package com.musicfox.plugin.api.security;

/**
 * 插件能力令牌
 * <p>
 * {@link #ALL} 为通配：持有即视为拥有全部权限。
 */
public enum Permission {
    UNKNOWN,
    FILE_READ,
    FILE_WRITE,
    FILE_EXECUTE,
    NETWORK_ACCESS,
    SYSTEM_CALL,
    PROCESS_CONTROL,
    ENVIRONMENT_ACCESS,
    CONFIG_ACCESS,
    DATABASE_ACCESS,
    AUDIO_ACCESS,
    UI_ACCESS,
    PLUGIN_MANAGEMENT,
    KERNEL_ACCESS,
    EVENT_ACCESS,
    SERVICE_ACCESS,
    ALL
}
