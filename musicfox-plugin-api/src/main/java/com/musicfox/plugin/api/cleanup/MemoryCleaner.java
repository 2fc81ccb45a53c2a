package com.musicfox.plugin.api.cleanup;

/**
 * 可选清理能力：释放插件内部缓存
 */
public interface MemoryCleaner {

    void cleanupMemory() throws Exception;
}
