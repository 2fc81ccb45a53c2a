package com.musicfox.plugin.core.event;

import jakarta.annotation.Nonnull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 生命周期事件载荷
 * <p>
 * 必含字段：plugin_id, plugin_path, plugin_type, plugin_state, timestamp；
 * 其余为操作相关字段（success, error, dependent_plugin_ids ...）。
 */
public record PluginEvent(String topic, Map<String, Object> data) {

    public static final String PLUGIN_ID = "plugin_id";
    public static final String PLUGIN_PATH = "plugin_path";
    public static final String PLUGIN_TYPE = "plugin_type";
    public static final String PLUGIN_STATE = "plugin_state";
    public static final String TIMESTAMP = "timestamp";
    public static final String PLUGIN_NAME = "plugin_name";
    public static final String PLUGIN_VERSION = "plugin_version";
    public static final String PLUGIN_AUTHOR = "plugin_author";
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String RUNTIME_MS = "runtime_ms";
    public static final String DEPENDENT_IDS = "dependent_plugin_ids";
    public static final String DEPENDENT_NAMES = "dependent_plugin_names";
    public static final String DEPENDENT_COUNT = "dependent_count";

    public PluginEvent {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Object get(String key) {
        return data.get(key);
    }

    public String getPluginId() {
        return (String) data.get(PLUGIN_ID);
    }

    public String getPluginState() {
        return (String) data.get(PLUGIN_STATE);
    }

    @Nonnull
    @Override
    public String toString() {
        return "PluginEvent{" + topic + ", " + data + "}";
    }
}
