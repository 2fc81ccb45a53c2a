package com.musicfox.plugin.core.security;

import com.musicfox.plugin.api.security.Permission;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 默认安全管理器
 * 职责：持有权限集合，鉴权查询，加载前的路径与产物校验
 */
@Slf4j
public class DefaultSecurityManager implements SecurityManager {

    private final String owner;
    private final List<ArtifactVerifier> verifiers;

    // 权限集合整体替换，读取无需加锁
    private volatile Set<Permission> permissions;
    private volatile SecurityConfig config;

    public DefaultSecurityManager(String owner, @NonNull SecurityConfig config) {
        this(owner, config, Collections.emptyList());
    }

    public DefaultSecurityManager(String owner, @NonNull SecurityConfig config, List<ArtifactVerifier> verifiers) {
        this.owner = owner != null ? owner : "host";
        this.verifiers = verifiers != null ? List.copyOf(verifiers) : Collections.emptyList();
        this.config = config;
        this.permissions = Collections.unmodifiableSet(config.permissionSet());
    }

    @Override
    public void validatePlugin(String path) throws SecurityException {
        if (path == null || path.isBlank()) {
            throw new SecurityException("plugin path cannot be empty");
        }
        Path artifact;
        try {
            artifact = Paths.get(path);
        } catch (InvalidPathException e) {
            throw new SecurityException("invalid plugin path: " + path, e);
        }
        for (Path segment : artifact) {
            if ("..".equals(segment.toString())) {
                throw new SecurityException("path traversal is not allowed: " + path);
            }
        }

        List<String> allowed = config.getAllowedPaths();
        if (!allowed.isEmpty()) {
            Path normalized = artifact.toAbsolutePath().normalize();
            boolean inside = allowed.stream()
                    .map(p -> Paths.get(p).toAbsolutePath().normalize())
                    .anyMatch(normalized::startsWith);
            if (!inside) {
                log.warn("[{}] DENY: plugin path outside allowed directories: {}", owner, path);
                throw new SecurityException("plugin path is outside allowed directories: " + path);
            }
        }

        for (ArtifactVerifier verifier : verifiers) {
            verifier.verify(artifact);
        }
    }

    @Override
    public boolean checkPermission(Permission permission) {
        Set<Permission> current = permissions;
        boolean allowed = current.contains(Permission.ALL) || current.contains(permission);
        if (!allowed) {
            log.warn("[{}] DENY: permission {} not granted", owner, permission);
        }
        return allowed;
    }

    @Override
    public void updateConfig(@NonNull SecurityConfig newConfig) {
        this.permissions = Collections.unmodifiableSet(newConfig.permissionSet());
        this.config = newConfig;
        log.info("[{}] Security config updated, permissions={}", owner, permissions);
    }

    @Override
    public SecurityConfig getConfig() {
        return config;
    }

    @Override
    public Set<Permission> getPermissions() {
        return permissions;
    }

    @Override
    public void cleanup() {
        this.permissions = Collections.emptySet();
        log.debug("[{}] Permissions revoked", owner);
    }
}
