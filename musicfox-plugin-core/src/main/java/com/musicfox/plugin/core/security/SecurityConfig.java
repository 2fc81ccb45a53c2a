package com.musicfox.plugin.core.security;

import com.musicfox.plugin.api.security.Permission;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 安全配置
 */
@Value
@Builder(toBuilder = true)
public class SecurityConfig {

    /**
     * 授予插件的能力令牌
     */
    @Singular
    Set<Permission> permissions;

    /**
     * 允许加载插件的目录，为空表示不限制
     */
    @Singular
    List<String> allowedPaths;

    @Builder.Default
    boolean sandboxEnabled = true;

    /**
     * 插件默认获得的权限：事件、服务、配置、音频
     */
    public static SecurityConfig defaults() {
        return SecurityConfig.builder()
                .permission(Permission.EVENT_ACCESS)
                .permission(Permission.SERVICE_ACCESS)
                .permission(Permission.CONFIG_ACCESS)
                .permission(Permission.AUDIO_ACCESS)
                .build();
    }

    public Set<Permission> permissionSet() {
        return permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions);
    }
}
