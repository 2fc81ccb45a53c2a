package com.musicfox.plugin.api.cleanup;

/**
 * 可选清理能力：关闭插件打开的网络连接（RPC 通道、HTTP 客户端等）
 */
public interface NetworkCleaner {

    void closeConnections() throws Exception;
}
