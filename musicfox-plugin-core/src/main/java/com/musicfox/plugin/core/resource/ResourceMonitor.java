package com.musicfox.plugin.core.resource;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 插件资源监控器
 * <p>
 * 周期性采样并与 {@link ResourceLimits} 对比，超限时按 {@link EnforceMode} 处置：
 * WARN 只打日志；LIMIT 记录违规次数，限流由外部完成；KILL 置位强停标记并通知监听器。
 */
@Slf4j
public class ResourceMonitor {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    @Getter
    private final String pluginId;
    private final ResourceSampler sampler;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;

    private volatile ResourceLimits limits;
    private volatile ResourceUsage usage = ResourceUsage.empty();
    private volatile boolean killRequested;
    private final AtomicLong violationCount = new AtomicLong();

    private volatile Consumer<LimitViolation> violationListener;
    private ScheduledFuture<?> task;

    public ResourceMonitor(@NonNull String pluginId,
                           @NonNull ResourceLimits limits,
                           @NonNull ResourceSampler sampler,
                           @NonNull ScheduledExecutorService scheduler,
                           Duration interval) {
        limits.validate();
        this.pluginId = pluginId;
        this.limits = limits;
        this.sampler = sampler;
        this.scheduler = scheduler;
        this.interval = interval != null && !interval.isZero() && !interval.isNegative() ? interval : DEFAULT_INTERVAL;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long periodMs = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.debug("[{}] Resource monitor started, interval={}ms", pluginId, periodMs);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.debug("[{}] Resource monitor stopped", pluginId);
        }
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    public void setViolationListener(Consumer<LimitViolation> listener) {
        this.violationListener = listener;
    }

    private void tick() {
        try {
            sampleNow();
        } catch (Exception e) {
            // 调度线程上的异常会终止后续执行，这里必须吞掉
            log.error("[{}] Resource sampling failed: {}", pluginId, e.getMessage(), e);
        }
    }

    /**
     * 立即采样一次并检查限额
     *
     * @return 本次发现的违规
     */
    public List<LimitViolation> sampleNow() {
        ResourceUsage sampled = sampler.sample();
        if (sampled == null) {
            return Collections.emptyList();
        }
        this.usage = sampled;
        List<LimitViolation> violations = findViolations(sampled, limits);
        for (LimitViolation violation : violations) {
            handleLimitExceeded(violation);
        }
        return violations;
    }

    private List<LimitViolation> findViolations(ResourceUsage current, ResourceLimits limit) {
        List<LimitViolation> result = new ArrayList<>();
        EnforceMode mode = limit.getEnforceMode();
        if (limit.getMaxMemoryMb() > 0 && current.memoryUsageMb() > limit.getMaxMemoryMb()) {
            result.add(new LimitViolation(pluginId, "memory", current.memoryUsageMb(), limit.getMaxMemoryMb(), mode));
        }
        if (limit.getMaxCpuPercent() > 0 && current.cpuUsagePercent() > limit.getMaxCpuPercent()) {
            result.add(new LimitViolation(pluginId, "cpu", current.cpuUsagePercent(), limit.getMaxCpuPercent(), mode));
        }
        if (limit.getMaxConcurrentTasks() > 0 && current.activeTasks() > limit.getMaxConcurrentTasks()) {
            result.add(new LimitViolation(pluginId, "tasks", current.activeTasks(), limit.getMaxConcurrentTasks(), mode));
        }
        if (limit.getMaxFileHandles() > 0 && current.fileHandles() > limit.getMaxFileHandles()) {
            result.add(new LimitViolation(pluginId, "file_handles", current.fileHandles(), limit.getMaxFileHandles(), mode));
        }
        if (limit.getMaxConnections() > 0 && current.connections() > limit.getMaxConnections()) {
            result.add(new LimitViolation(pluginId, "connections", current.connections(), limit.getMaxConnections(), mode));
        }
        return result;
    }

    private void handleLimitExceeded(LimitViolation violation) {
        switch (violation.mode()) {
            case WARN -> log.warn("[{}] Resource limit exceeded: {} current={} limit={}",
                    pluginId, violation.resource(), violation.current(), violation.limit());
            case LIMIT -> {
                violationCount.incrementAndGet();
                log.warn("[{}] Resource limit exceeded, throttling requested: {} current={} limit={}",
                        pluginId, violation.resource(), violation.current(), violation.limit());
            }
            case KILL -> {
                violationCount.incrementAndGet();
                killRequested = true;
                log.error("[{}] Resource limit exceeded, plugin marked for forced stop: {} current={} limit={}",
                        pluginId, violation.resource(), violation.current(), violation.limit());
            }
        }

        Consumer<LimitViolation> listener = violationListener;
        if (listener != null) {
            try {
                listener.accept(violation);
            } catch (Exception e) {
                log.error("[{}] Violation listener failed: {}", pluginId, e.getMessage(), e);
            }
        }
    }

    /**
     * 热替换限额，下一次采样生效
     */
    public void updateLimits(@NonNull ResourceLimits newLimits) {
        newLimits.validate();
        this.limits = newLimits;
        log.info("[{}] Resource limits updated: {}", pluginId, newLimits);
    }

    public ResourceLimits getLimits() {
        return limits;
    }

    /**
     * 最近一次采样的快照
     */
    public ResourceUsage getMetrics() {
        return usage;
    }

    public boolean isHealthy() {
        return findViolations(usage, limits).isEmpty();
    }

    public boolean isKillRequested() {
        return killRequested;
    }

    public long getViolationCount() {
        return violationCount.get();
    }
}
