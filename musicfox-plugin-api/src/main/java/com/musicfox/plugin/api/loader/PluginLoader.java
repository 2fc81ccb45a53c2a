package com.musicfox.plugin.api.loader;

import com.musicfox.plugin.api.plugin.Plugin;

/**
 * 插件加载器 SPI
 * <p>
 * 每种 {@link LoaderKind} 对应一个实现，负责把打包产物变成 {@link Plugin} 实例。
 * 编排器只依赖这一窄契约，不关心具体的映射/传输/执行细节。
 */
public interface PluginLoader {

    LoaderKind getKind();

    /**
     * 预校验产物（格式、签名等），不产生副作用
     */
    void validatePlugin(String path) throws Exception;

    Plugin loadPlugin(String path) throws Exception;

    void unloadPlugin(String pluginId) throws Exception;

    /**
     * 释放加载器为该插件持有的额外资源（进程句柄、沙箱实例、文件监听等）
     */
    default void releaseResources(String pluginId) throws Exception {
    }
}
