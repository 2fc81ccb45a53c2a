package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.InvalidStateException;
import com.musicfox.plugin.api.loader.LoaderKind;
import com.musicfox.plugin.api.loader.PluginLoader;
import com.musicfox.plugin.api.plugin.Plugin;
import com.musicfox.plugin.api.plugin.PluginInfo;
import com.musicfox.plugin.api.plugin.PluginState;
import com.musicfox.plugin.core.context.CorePluginContext;
import com.musicfox.plugin.core.resilience.CircuitBreaker;
import com.musicfox.plugin.core.resource.ResourceMonitor;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 受管插件：编排器对一个已加载插件实例的可变记录
 * 包含：插件实例 + 状态 + 时间戳 + 依赖 + 钩子 + 熔断器
 * <p>
 * 只能由 {@link PluginManager} 创建与修改。可变字段由 {@link #getLock()} 保护，
 * 加锁顺序固定为先编排器锁、后插件锁。
 */
@Slf4j
@Getter
public class ManagedPlugin {

    private final String id;

    private final String path;

    private final LoaderKind kind;

    private final Plugin plugin;

    private final PluginLoader loader;

    private final PluginInfo info;

    private final Instant loadTime;

    private final ReentrantLock lock = new ReentrantLock();

    // 元数据：loader_type / capabilities / load_timestamp 及插件写入的键
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();

    private final List<String> dependencies;

    private final HookChain hooks = new HookChain();

    private final AtomicInteger failureCount = new AtomicInteger(0);

    private volatile PluginState state = PluginState.UNKNOWN;

    private volatile Instant startTime;

    private volatile Instant stopTime;

    @Setter
    private volatile int priority;

    @Setter
    private volatile String group;

    @Setter
    private volatile int retryCount;

    @Setter
    private volatile Throwable lastError;

    @Setter
    private volatile CorePluginContext context;

    @Setter
    private volatile Path tempDir;

    @Setter
    private volatile CircuitBreaker circuitBreaker;

    @Setter
    private volatile ResourceMonitor resourceMonitor;

    ManagedPlugin(String id, String path, LoaderKind kind, Plugin plugin, PluginLoader loader, PluginInfo info,
                  List<String> dependencies) {
        this.id = id;
        this.path = path;
        this.kind = kind;
        this.plugin = plugin;
        this.loader = loader;
        this.info = info;
        this.dependencies = new CopyOnWriteArrayList<>(dependencies);
        this.loadTime = Instant.now();
    }

    public String getName() {
        return info.getName() != null ? info.getName() : id;
    }

    // ==================== 状态迁移 ====================

    /**
     * 按迁移表执行状态变更
     *
     * @throws InvalidStateException 非法迁移
     */
    void transitionTo(PluginState target) {
        PluginState current = state;
        if (!PluginState.isValidTransition(current, target)) {
            throw new InvalidStateException(id,
                    "invalid state transition from " + current + " to " + target + " for plugin " + id);
        }
        state = target;
        log.debug("[{}] State changed: {} -> {}", id, current, target);
    }

    /**
     * 越过迁移表直接写状态（强制操作与内部恢复路径）
     */
    void forceState(PluginState target) {
        PluginState current = state;
        if (current != target && !PluginState.isValidTransition(current, target)) {
            log.warn("[{}] Forcing state transition: {} -> {}", id, current, target);
        }
        state = target;
    }

    void markStarted() {
        this.startTime = Instant.now();
    }

    void markStopped() {
        this.stopTime = Instant.now();
    }

    /**
     * 最近一次运行的时长（运行中则计到当前）
     */
    public Duration getRuntime() {
        Instant started = startTime;
        if (started == null) {
            return Duration.ZERO;
        }
        Instant end = state == PluginState.RUNNING || stopTime == null || stopTime.isBefore(started)
                ? Instant.now() : stopTime;
        return Duration.between(started, end);
    }

    public boolean isCircuitBreakerOpen() {
        CircuitBreaker breaker = circuitBreaker;
        return breaker != null && breaker.getState() == CircuitBreaker.State.OPEN;
    }

    int recordFailure(Throwable error) {
        this.lastError = error;
        return failureCount.incrementAndGet();
    }

    /**
     * 本插件是否依赖 target（按名称或 ID 匹配）
     */
    public boolean dependsOn(ManagedPlugin target) {
        for (String dep : dependencies) {
            if (dep.equals(target.getId()) || dep.equals(target.getInfo().getName())) {
                return true;
            }
        }
        return false;
    }

    public List<String> getDependencies() {
        return List.copyOf(dependencies);
    }

    /**
     * 释放元数据、依赖与钩子引用（卸载清理阶段调用）
     */
    public void releaseReferences() {
        metadata.clear();
        dependencies.clear();
        hooks.clear();
    }

    @Override
    public String toString() {
        return "ManagedPlugin{id=" + id + ", kind=" + kind + ", state=" + state + ", priority=" + priority + "}";
    }
}
