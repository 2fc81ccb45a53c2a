package com.musicfox.plugin.api.cleanup;

/**
 * 可选清理能力：擦除插件持有的密钥
 */
public interface EncryptionKeyCleaner {

    void cleanupEncryptionKeys() throws Exception;
}
