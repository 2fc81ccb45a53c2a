package com.musicfox.plugin.core.resource;

/**
 * 资源采样源
 * <p>
 * 默认实现读取 JVM 进程级数据；RPC/沙箱类插件可以提供按插件隔离的采样。
 */
@FunctionalInterface
public interface ResourceSampler {

    ResourceUsage sample();
}
