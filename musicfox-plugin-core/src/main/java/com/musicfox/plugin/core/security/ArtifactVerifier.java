package com.musicfox.plugin.core.security;

import java.nio.file.Path;

/**
 * 插件产物校验（签名、哈希比对等）
 * <p>
 * 由 {@link DefaultSecurityManager#validatePlugin(String)} 在路径检查通过后依次调用，任一失败即拒绝加载。
 */
@FunctionalInterface
public interface ArtifactVerifier {

    /**
     * @throws SecurityException 产物未通过校验
     */
    void verify(Path artifact) throws SecurityException;
}
