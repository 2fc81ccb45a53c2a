package com.musicfox.plugin.core.manager;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 依赖关系查询
 * <p>
 * 依赖声明按字符串匹配插件 ID，其次匹配插件名称。
 */
final class DependencyGraph {

    private DependencyGraph() {
    }

    static Optional<ManagedPlugin> resolve(Collection<ManagedPlugin> plugins, String ref) {
        for (ManagedPlugin p : plugins) {
            if (p.getId().equals(ref)) {
                return Optional.of(p);
            }
        }
        for (ManagedPlugin p : plugins) {
            if (ref.equals(p.getInfo().getName())) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * 直接依赖 target 的其它插件
     */
    static List<ManagedPlugin> dependentsOf(Collection<ManagedPlugin> plugins, ManagedPlugin target) {
        List<ManagedPlugin> result = new ArrayList<>();
        for (ManagedPlugin p : plugins) {
            if (p != target && p.dependsOn(target)) {
                result.add(p);
            }
        }
        return result;
    }

    /**
     * 加入 candidate 后是否会形成环
     * <p>
     * 已注册的插件之间无环，因此只需检查经过 candidate 的路径。
     */
    static boolean createsCycle(Collection<ManagedPlugin> registered, ManagedPlugin candidate) {
        if (candidate.dependsOn(candidate)) {
            return true;
        }
        Set<String> visited = new HashSet<>();
        Deque<ManagedPlugin> pending = new ArrayDeque<>();
        for (String dep : candidate.getDependencies()) {
            resolve(registered, dep).ifPresent(pending::push);
        }
        while (!pending.isEmpty()) {
            ManagedPlugin current = pending.pop();
            if (!visited.add(current.getId())) {
                continue;
            }
            if (current.dependsOn(candidate)) {
                return true;
            }
            for (String dep : current.getDependencies()) {
                resolve(registered, dep).ifPresent(pending::push);
            }
        }
        return false;
    }
}
