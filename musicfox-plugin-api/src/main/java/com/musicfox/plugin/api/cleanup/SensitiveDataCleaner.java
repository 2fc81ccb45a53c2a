package com.musicfox.plugin.api.cleanup;

/**
 * 可选清理能力：擦除插件内存中的敏感数据（令牌、密码）
 */
public interface SensitiveDataCleaner {

    void cleanupSensitiveData() throws Exception;
}
