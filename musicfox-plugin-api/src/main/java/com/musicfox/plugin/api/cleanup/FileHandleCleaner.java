package com.musicfox.plugin.api.cleanup;

/**
 * 可选清理能力：关闭插件持有的文件句柄
 */
public interface FileHandleCleaner {

    void closeFiles() throws Exception;
}
