package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.InvalidArgumentException;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 有序具名钩子链
 * <p>
 * 按注册顺序执行；支持按名称查看和单独移除。
 */
public class HookChain {

    private final List<LifecycleHook> hooks = new CopyOnWriteArrayList<>();

    public HookChain() {
    }

    public HookChain(Collection<LifecycleHook> initial) {
        if (initial != null) {
            initial.forEach(this::add);
        }
    }

    public synchronized void add(LifecycleHook hook) {
        if (contains(hook.name())) {
            throw new InvalidArgumentException("name", "hook already registered: " + hook.name());
        }
        hooks.add(hook);
    }

    /**
     * 只移除同名的那一个钩子
     */
    public boolean remove(String name) {
        return hooks.removeIf(h -> h.name().equals(name));
    }

    public boolean contains(String name) {
        return hooks.stream().anyMatch(h -> h.name().equals(name));
    }

    public List<LifecycleHook> list() {
        return List.copyOf(hooks);
    }

    public List<LifecycleHook> forPhase(HookPhase phase) {
        return hooks.stream().filter(h -> h.phase() == phase).collect(Collectors.toList());
    }

    public int size() {
        return hooks.size();
    }

    public void clear() {
        hooks.clear();
    }
}
