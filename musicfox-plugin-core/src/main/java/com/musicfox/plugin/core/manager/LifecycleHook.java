package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.InvalidArgumentException;

/**
 * 具名钩子
 *
 * @param name   名称，同一链内唯一
 * @param phase  触发时机
 * @param action 执行体
 */
public record LifecycleHook(String name, HookPhase phase, HookAction action) {

    public LifecycleHook {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("name", "hook name cannot be blank");
        }
        if (phase == null) {
            throw new InvalidArgumentException("phase", "hook phase cannot be null");
        }
        if (action == null) {
            throw new InvalidArgumentException("action", "hook action cannot be null");
        }
    }

    public static LifecycleHook of(String name, HookPhase phase, HookAction action) {
        return new LifecycleHook(name, phase, action);
    }
}
