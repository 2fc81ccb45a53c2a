package com.musicfox.plugin.core.manager;

/**
 * 钩子逻辑
 */
@FunctionalInterface
public interface HookAction {

    /**
     * @param plugin 目标插件
     * @param error  仅 ON_ERROR 时非空
     */
    void execute(ManagedPlugin plugin, Throwable error) throws Exception;
}
