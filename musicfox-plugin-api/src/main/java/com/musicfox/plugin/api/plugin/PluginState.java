package com.musicfox.plugin.api.plugin;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 插件生命周期状态
 * <p>
 * 迁移表（from → 允许的 to）：
 * <pre>
 * UNKNOWN   → LOADED, ERROR
 * LOADED    → RUNNING, UNLOADING, ERROR
 * RUNNING   → STOPPING, PAUSED, ERROR
 * STOPPING  → STOPPED, ERROR
 * STOPPED   → RUNNING, UNLOADING, ERROR
 * UNLOADING → UNLOADED, CLEANING, ERROR, CORRUPTED
 * UNLOADED  → LOADED, ERROR
 * ERROR     → CLEANING, CORRUPTED, UNLOADING
 * PAUSED    → RUNNING, STOPPING, ERROR
 * CLEANING  → UNLOADED, ERROR, CORRUPTED
 * CORRUPTED → CLEANING, UNLOADING
 * </pre>
 */
public enum PluginState {

    UNKNOWN("unknown"),
    LOADED("loaded"),
    RUNNING("running"),
    STOPPING("stopping"),
    STOPPED("stopped"),
    UNLOADING("unloading"),
    UNLOADED("unloaded"),
    ERROR("error"),
    PAUSED("paused"),
    CLEANING("cleaning"),
    CORRUPTED("corrupted");

    private static final Map<PluginState, Set<PluginState>> TRANSITIONS = new EnumMap<>(PluginState.class);

    static {
        allow(UNKNOWN, LOADED, ERROR);
        allow(LOADED, RUNNING, UNLOADING, ERROR);
        allow(RUNNING, STOPPING, PAUSED, ERROR);
        allow(STOPPING, STOPPED, ERROR);
        allow(STOPPED, RUNNING, UNLOADING, ERROR);
        allow(UNLOADING, UNLOADED, CLEANING, ERROR, CORRUPTED);
        allow(UNLOADED, LOADED, ERROR);
        allow(ERROR, CLEANING, CORRUPTED, UNLOADING);
        allow(PAUSED, RUNNING, STOPPING, ERROR);
        allow(CLEANING, UNLOADED, ERROR, CORRUPTED);
        allow(CORRUPTED, CLEANING, UNLOADING);
    }

    private static void allow(PluginState from, PluginState first, PluginState... rest) {
        TRANSITIONS.put(from, Collections.unmodifiableSet(EnumSet.of(first, rest)));
    }

    private final String value;

    PluginState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 判断 from → to 是否是合法迁移
     */
    public static boolean isValidTransition(PluginState from, PluginState to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.get(from).contains(to);
    }

    public boolean canTransitionTo(PluginState target) {
        return isValidTransition(this, target);
    }

    public Set<PluginState> allowedTargets() {
        return TRANSITIONS.get(this);
    }

    public boolean canUnload() {
        return this == LOADED || this == STOPPED || this == ERROR || this == PAUSED;
    }

    public boolean canStop() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * 过渡态：操作进行中，外部不应再发起新的生命周期操作
     */
    public boolean isTransitional() {
        return this == STOPPING || this == UNLOADING || this == CLEANING;
    }

    @Override
    public String toString() {
        return value;
    }
}
