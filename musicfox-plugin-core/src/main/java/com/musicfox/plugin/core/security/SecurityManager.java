package com.musicfox.plugin.core.security;

import com.musicfox.plugin.api.exception.PermissionDeniedException;
import com.musicfox.plugin.api.security.Permission;

import java.util.Set;

/**
 * 权限门
 * <p>
 * 只做判定，不做隔离；隔离由加载器负责。
 */
public interface SecurityManager {

    /**
     * 加载前校验插件产物
     *
     * @throws SecurityException 校验失败
     */
    void validatePlugin(String path) throws SecurityException;

    /**
     * 持有 {@link Permission#ALL} 时自动放行，否则要求精确包含
     */
    boolean checkPermission(Permission permission);

    default void requirePermission(Permission permission) {
        if (!checkPermission(permission)) {
            throw new PermissionDeniedException("permission denied: " + permission);
        }
    }

    /**
     * 原子替换权限集合
     */
    void updateConfig(SecurityConfig config);

    SecurityConfig getConfig();

    Set<Permission> getPermissions();

    /**
     * 撤销全部权限
     */
    void cleanup();
}
