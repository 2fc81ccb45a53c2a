package com.musicfox.plugin.core.event;

/**
 * 生命周期事件主题
 */
public final class PluginTopics {

    public static final String LOADED = "plugin.loaded";
    public static final String STARTED = "plugin.started";
    public static final String STOPPED = "plugin.stopped";
    public static final String UNLOADING = "plugin.unloading";
    public static final String UNLOADED = "plugin.unloaded";
    public static final String UNLOAD_RECOVERY_STARTED = "plugin.unload.recovery.started";
    public static final String UNLOAD_RECOVERY_COMPLETED = "plugin.unload.recovery.completed";
    public static final String DEPENDENCY_BLOCKED = "plugin.dependency.blocked";

    private PluginTopics() {
    }
}
