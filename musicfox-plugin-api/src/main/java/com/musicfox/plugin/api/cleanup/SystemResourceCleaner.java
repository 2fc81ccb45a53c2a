package com.musicfox.plugin.api.cleanup;

/**
 * 可选清理能力：释放系统级资源（子进程、信号量等）
 */
public interface SystemResourceCleaner {

    void cleanupSystemResources() throws Exception;
}
