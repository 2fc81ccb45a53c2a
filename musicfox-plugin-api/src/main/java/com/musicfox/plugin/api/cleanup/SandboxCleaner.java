package com.musicfox.plugin.api.cleanup;

/**
 * 可选清理能力：拆除沙箱执行环境
 */
public interface SandboxCleaner {

    void cleanupSandbox() throws Exception;
}
