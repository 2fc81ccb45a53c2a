package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.DependencyException;
import com.musicfox.plugin.api.exception.InvalidArgumentException;
import com.musicfox.plugin.api.exception.InvalidStateException;
import com.musicfox.plugin.api.exception.PluginException;
import com.musicfox.plugin.api.exception.PluginNotFoundException;
import com.musicfox.plugin.api.exception.PluginOperationException;
import com.musicfox.plugin.api.exception.UnloadRecoveredException;
import com.musicfox.plugin.api.loader.LoaderKind;
import com.musicfox.plugin.api.loader.PluginLoader;
import com.musicfox.plugin.api.plugin.Plugin;
import com.musicfox.plugin.api.plugin.PluginInfo;
import com.musicfox.plugin.api.plugin.PluginState;
import com.musicfox.plugin.api.security.Permission;
import com.musicfox.plugin.core.cleanup.CleanupReport;
import com.musicfox.plugin.core.cleanup.CleanupScope;
import com.musicfox.plugin.core.cleanup.ResourceCleaner;
import com.musicfox.plugin.core.cleanup.SecurityCleaner;
import com.musicfox.plugin.core.config.ManagerConfig;
import com.musicfox.plugin.core.context.CorePluginContext;
import com.musicfox.plugin.core.event.EventBus;
import com.musicfox.plugin.core.event.PluginEvent;
import com.musicfox.plugin.core.event.PluginTopics;
import com.musicfox.plugin.core.loader.LoaderRegistry;
import com.musicfox.plugin.core.monitor.HealthChecker;
import com.musicfox.plugin.core.monitor.PluginMonitor;
import com.musicfox.plugin.core.resilience.CircuitBreaker;
import com.musicfox.plugin.core.resilience.ThresholdCircuitBreaker;
import com.musicfox.plugin.core.resource.EnforceMode;
import com.musicfox.plugin.core.resource.JvmResourceSampler;
import com.musicfox.plugin.core.resource.LimitViolation;
import com.musicfox.plugin.core.resource.ResourceMonitor;
import com.musicfox.plugin.core.resource.ResourceSampler;
import com.musicfox.plugin.core.security.DefaultSecurityManager;
import com.musicfox.plugin.core.security.SecurityConfig;
import com.musicfox.plugin.core.security.SecurityManager;
import com.musicfox.plugin.core.service.ServiceRegistry;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 插件生命周期编排器
 * 职责：
 * 1. 插件的加载、启动、停止与卸载 (Load/Start/Stop/Unload)
 * 2. 插件分组、批量与异步操作
 * 3. 依赖约束、级联卸载与失败恢复
 * 4. 监控、健康检查与资源清理的接入
 * <p>
 * 公共方法获取编排器锁后调用 {@code doXxx} 内部方法，内部方法假定锁已持有，
 * 因此卸载可以直接调用内部停止逻辑而无需释放再重入。查询方法不加编排器锁。
 */
@Slf4j
public class PluginManager {

    private static final Duration FORCE_STOP_TIMEOUT = Duration.ofSeconds(5);

    private final ManagerConfig config;

    private final LoaderRegistry loaders;

    private final EventBus eventBus;

    private final ServiceRegistry serviceRegistry;

    private final SecurityManager securityManager;

    private final ResourceSampler resourceSampler;

    // 插件表：Key=PluginId
    private final Map<String, ManagedPlugin> plugins = new ConcurrentHashMap<>();

    // 分组表：Key=组名，列表受编排器锁保护
    private final Map<String, List<ManagedPlugin>> groups = new ConcurrentHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    // 资源采样调度器
    private final ScheduledExecutorService scheduler;

    // 健康检查与指标收集会同步等待插件回调，单独占一个线程
    private final ScheduledExecutorService monitorScheduler;

    // 插件方法调用（隔离线程池 + 超时）
    private final PluginCallExecutor callExecutor;

    // 批量操作扇出
    private final ExecutorService batchExecutor;

    @Getter
    private final HealthChecker healthChecker;

    @Getter
    private final PluginMonitor monitor;

    private final ResourceCleaner resourceCleaner;

    private final SecurityCleaner securityCleaner = new SecurityCleaner();

    private final AsyncRequestQueue startQueue;

    private final AsyncRequestQueue stopQueue;

    private final AtomicInteger batchThreadNumber = new AtomicInteger(1);

    public PluginManager(ManagerConfig config,
                         Collection<? extends PluginLoader> loaders,
                         @NonNull EventBus eventBus,
                         @NonNull ServiceRegistry serviceRegistry,
                         SecurityManager securityManager) {
        this(config, loaders, eventBus, serviceRegistry, securityManager, new JvmResourceSampler());
    }

    public PluginManager(ManagerConfig config,
                         Collection<? extends PluginLoader> loaders,
                         @NonNull EventBus eventBus,
                         @NonNull ServiceRegistry serviceRegistry,
                         SecurityManager securityManager,
                         @NonNull ResourceSampler resourceSampler) {
        this.config = config != null ? config : ManagerConfig.defaults();
        this.config.validate();
        this.loaders = new LoaderRegistry(loaders);
        this.eventBus = eventBus;
        this.serviceRegistry = serviceRegistry;
        this.securityManager = securityManager != null ? securityManager
                : new DefaultSecurityManager("manager", this.config.getPluginSecurity());
        this.resourceSampler = resourceSampler;

        this.scheduler = newScheduler("musicfox-plugin-scheduler");
        this.monitorScheduler = newScheduler("musicfox-plugin-monitor");
        this.callExecutor = new PluginCallExecutor();
        this.batchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "musicfox-plugin-batch-" + batchThreadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        this.healthChecker = new HealthChecker(monitorScheduler, callExecutor,
                this.config.getHealthCheckInterval(), this.config.getStartTimeout());
        this.monitor = new PluginMonitor(monitorScheduler, callExecutor,
                this.config.getMetricsInterval(), this.config.getStartTimeout());
        if (this.config.isEnableMonitoring()) {
            healthChecker.start();
            monitor.start();
        }
        this.resourceCleaner = new ResourceCleaner(eventBus, this.config.getTempDir());
        this.startQueue = new AsyncRequestQueue("start", this.config.getAsyncQueueCapacity());
        this.stopQueue = new AsyncRequestQueue("stop", this.config.getAsyncQueueCapacity());

        if (!this.loaders.isComplete()) {
            log.warn("No loader registered for kinds: {}", this.loaders.missingKinds());
        }
        log.info("PluginManager initialized: maxPlugins={}, loaders={}",
                this.config.getMaxPlugins(), this.loaders.registeredKinds());
    }

    // ==================== 加载 ====================

    /**
     * 加载插件，成功后插件处于 {@link PluginState#LOADED}
     */
    public ManagedPlugin loadPlugin(String path, LoaderKind kind) {
        ensureOpen();
        if (path == null || path.isBlank()) {
            throw new InvalidArgumentException("path", "plugin path cannot be empty");
        }
        if (kind == null) {
            throw new InvalidArgumentException("kind", "plugin loader kind cannot be null");
        }

        lock.lock();
        try {
            for (ManagedPlugin existing : plugins.values()) {
                if (existing.getPath().equals(path)) {
                    throw new InvalidArgumentException("path", "plugin already loaded from path: " + path);
                }
            }
            if (plugins.size() >= config.getMaxPlugins()) {
                throw new InvalidArgumentException("maxPlugins",
                        "maximum number of plugins (" + config.getMaxPlugins() + ") reached");
            }

            // 安全验证
            if (config.isEnableSecurity()) {
                try {
                    securityManager.validatePlugin(path);
                } catch (SecurityException e) {
                    throw new PluginException(null, "security validation failed: " + e.getMessage(), e);
                }
            }

            PluginLoader loader = loaders.select(kind).orElseThrow(() ->
                    new InvalidArgumentException("kind", "no suitable loader found for plugin type " + kind));

            try {
                loader.validatePlugin(path);
            } catch (Exception e) {
                throw new PluginOperationException(null, "plugin validation failed: " + e.getMessage(), e);
            }

            Plugin plugin = callExecutor.call(path, "load", config.getLoadTimeout(), () -> loader.loadPlugin(path));
            if (plugin == null) {
                throw new PluginOperationException(null, "loaded plugin instance is null");
            }
            PluginInfo info = plugin.getInfo();
            if (info == null) {
                throw new PluginOperationException(null, "plugin info is null");
            }

            String pluginId = info.getId() != null && !info.getId().isBlank()
                    ? info.getId() : generatePluginId(path, kind);
            if (plugins.containsKey(pluginId)) {
                throw new InvalidArgumentException("id", "plugin ID conflict: " + pluginId);
            }

            List<String> dependencies = plugin.getDependencies() != null ? plugin.getDependencies() : List.of();
            ManagedPlugin managed = new ManagedPlugin(pluginId, path, kind, plugin, loader, info, dependencies);
            if (DependencyGraph.createsCycle(plugins.values(), managed)) {
                throw new DependencyException(pluginId,
                        "dependency cycle detected for plugin " + pluginId + ": " + dependencies);
            }

            managed.getMetadata().put("loader_type", kind.getValue());
            managed.getMetadata().put("capabilities", List.copyOf(plugin.getCapabilities()));
            managed.getMetadata().put("load_timestamp", Instant.now().getEpochSecond());
            managed.setTempDir(config.getTempDir().resolve(safeName(pluginId)));
            managed.setContext(createContext(managed));
            if (config.isEnableCircuitBreaker()) {
                managed.setCircuitBreaker(new ThresholdCircuitBreaker(pluginId,
                        config.getCircuitBreakerThreshold(), config.getCircuitBreakerRecoveryTimeout()));
            }
            managed.transitionTo(PluginState.LOADED);

            plugins.put(pluginId, managed);
            publishEvent(PluginTopics.LOADED, managed, Map.of());

            if (config.isEnableMonitoring()) {
                monitor.addPlugin(managed);
                healthChecker.addPlugin(managed);
            }

            log.info("[{}] Plugin loaded: name={}, version={}, path={}, type={}, dependencies={}",
                    pluginId, info.getName(), info.getVersion(), path, kind, dependencies.size());
            return managed;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 启动 ====================

    public void startPlugin(String pluginId) {
        startPlugin(pluginId, StartOptions.defaults());
    }

    public void startPlugin(String pluginId, StartOptions options) {
        ensureOpen();
        lock.lock();
        try {
            doStart(requirePlugin(pluginId), options != null ? options : StartOptions.defaults());
        } finally {
            lock.unlock();
        }
    }

    private void doStart(ManagedPlugin managed, StartOptions options) {
        String pluginId = managed.getId();
        PluginState state = managed.getState();
        if (state == PluginState.RUNNING) {
            throw new InvalidStateException(pluginId, "plugin is already running: " + pluginId);
        }
        if (!options.isForceStart() && state != PluginState.LOADED && state != PluginState.STOPPED) {
            throw new InvalidStateException(pluginId,
                    "plugin is not in a startable state: " + pluginId + " (current: " + state + ")");
        }
        if (!options.isForceStart()) {
            checkDependencies(managed);
        }

        List<LifecycleHook> hooks = hooksFor(managed, options.getHooks());
        runHooks(hooks, HookPhase.PRE_START, managed, null, true);

        Duration timeout = RetryPolicy.timeout(options.getTimeout(), config.getStartTimeout());
        int attempts = options.effectiveRetryCount();
        Duration delay = options.effectiveRetryDelay();

        PluginException lastError = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                sleep(pluginId, delay);
                log.info("[{}] Retrying plugin start ({}/{})", pluginId, attempt + 1, attempts);
            }
            CircuitBreaker breaker = managed.getCircuitBreaker();
            if (breaker != null && !breaker.tryAcquirePermission()) {
                log.warn("[{}] Start rejected, circuit breaker is open", pluginId);
                throw new PluginOperationException(pluginId, "circuit breaker is open for plugin " + pluginId);
            }
            try {
                attemptStart(managed, timeout);
                if (breaker != null) {
                    breaker.onSuccess();
                }
                managed.setRetryCount(attempt);
                lastError = null;
                break;
            } catch (PluginException e) {
                lastError = e;
                int failures = managed.recordFailure(e);
                if (breaker != null) {
                    breaker.onError(e);
                }
                log.warn("[{}] Plugin start attempt {} failed (total failures {}): {}",
                        pluginId, attempt + 1, failures, e.getMessage());
                runHooks(hooks, HookPhase.ON_ERROR, managed, e, false);
            }
        }
        if (lastError != null) {
            log.error("[{}] Plugin start failed after {} attempts", pluginId, attempts);
            throw new PluginOperationException(pluginId, "failed to start plugin " + pluginId
                    + " after " + attempts + " attempts: " + lastError.getMessage(), lastError);
        }

        runHooks(hooks, HookPhase.POST_START, managed, null, false);
    }

    private void attemptStart(ManagedPlugin managed, Duration timeout) {
        String pluginId = managed.getId();
        Plugin plugin = managed.getPlugin();
        managed.getLock().lock();
        try {
            CorePluginContext context = managed.getContext();
            if (context == null || context.isClosed()) {
                context = createContext(managed);
                managed.setContext(context);
            }
            CorePluginContext initContext = context;
            try {
                callExecutor.run(pluginId, "initialization", timeout, () -> plugin.initialize(initContext));
                callExecutor.run(pluginId, "start", timeout, plugin::start);
            } catch (PluginException e) {
                managed.forceState(PluginState.ERROR);
                throw e;
            }
            moveTo(managed, PluginState.RUNNING);
            managed.markStarted();
            registerServices(managed);
            startResourceMonitor(managed);
        } finally {
            managed.getLock().unlock();
        }
        publishEvent(PluginTopics.STARTED, managed, Map.of());
        log.info("[{}] Plugin started: name={}, startupTime={}ms", pluginId, managed.getName(),
                Duration.between(managed.getLoadTime(), Instant.now()).toMillis());
    }

    /**
     * 每个声明的依赖都必须已加载且处于运行中
     */
    private void checkDependencies(ManagedPlugin managed) {
        for (String dep : managed.getDependencies()) {
            ManagedPlugin target = DependencyGraph.resolve(plugins.values(), dep).orElse(null);
            if (target == null) {
                throw new DependencyException(managed.getId(), "dependency check failed for plugin "
                        + managed.getId() + ": dependency not found: " + dep);
            }
            if (target.getState() != PluginState.RUNNING) {
                throw new DependencyException(managed.getId(), "dependency check failed for plugin "
                        + managed.getId() + ": dependency not running: " + dep + " (state: " + target.getState() + ")");
            }
        }
    }

    // ==================== 停止 ====================

    public void stopPlugin(String pluginId) {
        stopPlugin(pluginId, StopOptions.defaults());
    }

    public void stopPlugin(String pluginId, StopOptions options) {
        ensureOpen();
        lock.lock();
        try {
            doStop(requirePlugin(pluginId), options != null ? options : StopOptions.defaults(), false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param internal 卸载与关闭流程内部调用，接受任何可停止状态
     */
    private void doStop(ManagedPlugin managed, StopOptions options, boolean internal) {
        String pluginId = managed.getId();
        PluginState state = managed.getState();
        if (internal ? !state.canStop() : state != PluginState.RUNNING) {
            throw new InvalidStateException(pluginId,
                    "plugin is not running: " + pluginId + " (current: " + state + ")");
        }
        if (!options.isForceStop()) {
            List<String> running = new ArrayList<>();
            for (ManagedPlugin dependent : DependencyGraph.dependentsOf(plugins.values(), managed)) {
                if (dependent.getState() == PluginState.RUNNING) {
                    running.add(dependent.getId());
                }
            }
            if (!running.isEmpty()) {
                throw new DependencyException(pluginId, "cannot stop plugin " + pluginId
                        + ": dependent plugins are still running: " + running, running, null);
            }
        }

        List<LifecycleHook> hooks = hooksFor(managed, options.getHooks());
        runHooks(hooks, HookPhase.PRE_STOP, managed, null, true);

        Duration timeout = RetryPolicy.timeout(options.getTimeout(), config.getStopTimeout());
        int attempts = options.effectiveRetryCount();
        Duration delay = options.effectiveRetryDelay();

        PluginException lastError = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                sleep(pluginId, delay);
                log.info("[{}] Retrying plugin stop ({}/{})", pluginId, attempt + 1, attempts);
            }
            try {
                attemptStop(managed, timeout, options, hooks);
                lastError = null;
                break;
            } catch (PluginException e) {
                lastError = e;
                managed.recordFailure(e);
                log.warn("[{}] Plugin stop attempt {} failed: {}", pluginId, attempt + 1, e.getMessage());
                runHooks(hooks, HookPhase.ON_ERROR, managed, e, false);
            }
        }
        if (lastError != null) {
            log.error("[{}] Plugin stop failed after {} attempts", pluginId, attempts);
            throw new PluginOperationException(pluginId, "failed to stop plugin " + pluginId
                    + " after " + attempts + " attempts: " + lastError.getMessage(), lastError);
        }

        runHooks(hooks, HookPhase.POST_STOP, managed, null, false);
    }

    private void attemptStop(ManagedPlugin managed, Duration timeout, StopOptions options, List<LifecycleHook> hooks) {
        String pluginId = managed.getId();
        managed.getLock().lock();
        try {
            if (managed.getState() != PluginState.STOPPING) {
                moveTo(managed, PluginState.STOPPING);
            }
            try {
                callExecutor.run(pluginId, "stop", timeout, managed.getPlugin()::stop);
            } catch (PluginException e) {
                if (!options.isForce()) {
                    managed.forceState(PluginState.ERROR);
                    throw e;
                }
                log.warn("[{}] Plugin stop failed, continuing because force is set: {}", pluginId, e.getMessage());
            }

            stopResourceMonitor(managed);
            unregisterServices(managed);
            if (!options.isSkipCleanup()) {
                runHooks(hooks, HookPhase.ON_CLEANUP, managed, null, false);
                CleanupReport report = resourceCleaner.cleanup(managed, CleanupScope.STOP);
                if (!report.isSuccessful()) {
                    log.warn("[{}] Resource cleanup after stop finished with {} failed stage(s)",
                            pluginId, report.failures().size());
                }
            }
            moveTo(managed, PluginState.STOPPED);
            managed.markStopped();
        } finally {
            managed.getLock().unlock();
        }

        Map<String, Object> extra = new HashMap<>();
        extra.put(PluginEvent.RUNTIME_MS, managed.getRuntime().toMillis());
        publishEvent(PluginTopics.STOPPED, managed, extra);
        log.info("[{}] Plugin stopped: runtime={}ms", pluginId, managed.getRuntime().toMillis());
    }

    // ==================== 卸载 ====================

    public void unloadPlugin(String pluginId) {
        unloadPlugin(pluginId, UnloadOptions.defaults());
    }

    public void unloadPlugin(String pluginId, UnloadOptions options) {
        unloadPluginWithProgress(pluginId, options, null);
    }

    /**
     * 卸载插件并上报进度
     *
     * @throws UnloadRecoveredException 卸载失败但已通过恢复流程强制移除，插件对象不再有效
     */
    public void unloadPluginWithProgress(String pluginId, UnloadOptions options, UnloadProgressListener listener) {
        ensureOpen();
        lock.lock();
        try {
            ManagedPlugin managed = requirePlugin(pluginId);
            ProgressReporter reporter = listener != null
                    ? new ProgressReporter(pluginId, managed.getName(), listener) : ProgressReporter.NOOP;
            doUnload(managed, options != null ? options : UnloadOptions.defaults(), reporter);
        } finally {
            lock.unlock();
        }
    }

    private void doUnload(ManagedPlugin managed, UnloadOptions options, ProgressReporter reporter) {
        String pluginId = managed.getId();
        boolean force = options.isForceUnload();
        try {
            reporter.report("validation", 0.05, "validating plugin state");
            PluginState state = managed.getState();
            if (!force && !state.canUnload()) {
                throw new InvalidStateException(pluginId,
                        "plugin is not in an unloadable state: " + pluginId + " (current: " + state + ")");
            }

            reporter.report("dependency_check", 0.1, "checking dependent plugins");
            if (options.isCascadeUnload()) {
                cascadeUnloadDependents(managed, options);
            }
            if (!force) {
                checkDependentsForUnload(managed);
            }

            reporter.report("pre_hooks", 0.2, "running pre-unload hooks");
            List<LifecycleHook> hooks = hooksFor(managed, options.getHooks());
            runHooks(hooks, HookPhase.PRE_UNLOAD, managed, null, true);

            Duration timeout = RetryPolicy.timeout(options.getTimeout(), config.getUnloadTimeout());
            int attempts = options.effectiveRetryCount();
            Duration delay = options.effectiveRetryDelay();

            PluginException lastError = null;
            for (int attempt = 0; attempt < attempts; attempt++) {
                if (attempt > 0) {
                    sleep(pluginId, delay);
                    log.info("[{}] Retrying plugin unload ({}/{})", pluginId, attempt + 1, attempts);
                }
                reporter.report("unloading", 0.3, "unload attempt " + (attempt + 1) + "/" + attempts);
                try {
                    attemptUnload(managed, timeout, options, hooks, reporter);
                    lastError = null;
                    break;
                } catch (PluginException e) {
                    lastError = e;
                    managed.recordFailure(e);
                    log.warn("[{}] Plugin unload attempt {} failed: {}", pluginId, attempt + 1, e.getMessage());
                    runHooks(hooks, HookPhase.ON_ERROR, managed, e, false);
                }
            }
            if (lastError != null) {
                recoverFromUnloadError(managed, new PluginOperationException(pluginId, "failed to unload plugin "
                        + pluginId + " after " + attempts + " attempts: " + lastError.getMessage(), lastError),
                        timeout, reporter);
            }

            reporter.report("post_hooks", 0.95, "running post-unload hooks");
            runHooks(hooks, HookPhase.POST_UNLOAD, managed, null, false);
            reporter.report("completed", 1.0, "plugin unloaded");
        } catch (UnloadRecoveredException e) {
            throw e;
        } catch (PluginException e) {
            reporter.report("failed", 0.0, e.getMessage(), e);
            throw e;
        }
    }

    private void attemptUnload(ManagedPlugin managed, Duration timeout, UnloadOptions options,
                               List<LifecycleHook> hooks, ProgressReporter reporter) {
        String pluginId = managed.getId();
        boolean force = options.isForceUnload();
        managed.getLock().lock();
        try {
            // 运行中的插件先停止，资源统一由卸载清理
            if (managed.getState().canStop()) {
                reporter.report("stopping", 0.35, "stopping running plugin");
                StopOptions stopOptions = StopOptions.builder()
                        .timeout(timeout)
                        .forceStop(force)
                        .force(force)
                        .gracefulShutdown(options.isGracefulShutdown())
                        .skipCleanup(true)
                        .build();
                try {
                    doStop(managed, stopOptions, true);
                } catch (PluginException e) {
                    if (!force) {
                        throw new PluginOperationException(pluginId,
                                "failed to stop plugin " + pluginId + " before unloading: " + e.getMessage(), e);
                    }
                    log.warn("[{}] Stop before unload failed, continuing with force: {}", pluginId, e.getMessage());
                }
            }

            reporter.report("state_transition", 0.4, "transitioning to unloading");
            PluginState current = managed.getState();
            if (!PluginState.isValidTransition(current, PluginState.UNLOADING)) {
                if (!force) {
                    throw new InvalidStateException(pluginId, "invalid state transition from " + current
                            + " to " + PluginState.UNLOADING + " for plugin " + pluginId);
                }
                managed.forceState(PluginState.UNLOADING);
            } else {
                managed.transitionTo(PluginState.UNLOADING);
            }
            Map<String, Object> unloading = new HashMap<>();
            unloading.put(PluginEvent.SUCCESS, true);
            publishEvent(PluginTopics.UNLOADING, managed, unloading);

            try {
                reporter.report("cleanup_monitoring", 0.5, "removing from monitoring");
                healthChecker.removePlugin(pluginId);
                monitor.removePlugin(pluginId);
                stopResourceMonitor(managed);

                reporter.report("plugin_cleanup", 0.55, "invoking plugin cleanup");
                try {
                    callExecutor.run(pluginId, "cleanup", timeout, managed.getPlugin()::cleanup);
                } catch (PluginException e) {
                    if (!force) {
                        throw e;
                    }
                    log.warn("[{}] Plugin cleanup failed, continuing with force: {}", pluginId, e.getMessage());
                }

                reporter.report("service_cleanup", 0.6, "unregistering services");
                unregisterServices(managed);

                if (!options.isSkipCleanup()) {
                    reporter.report("resource_cleanup", 0.7, "cleaning plugin resources");
                    runHooks(hooks, HookPhase.ON_CLEANUP, managed, null, false);
                    CleanupReport report = resourceCleaner.cleanup(managed, CleanupScope.UNLOAD);
                    if (!report.isSuccessful()) {
                        if (!force) {
                            throw report.toException("resource cleanup");
                        }
                        log.warn("[{}] Resource cleanup finished with {} failed stage(s), continuing with force",
                                pluginId, report.failures().size());
                    }
                    CleanupReport securityReport = securityCleaner.cleanup(managed);
                    if (!securityReport.isSuccessful()) {
                        log.warn("[{}] Security cleanup finished with {} failed stage(s)",
                                pluginId, securityReport.failures().size());
                    }
                }

                reporter.report("loader_cleanup", 0.8, "unloading from loader");
                try {
                    callExecutor.run(pluginId, "loader unload", timeout,
                            () -> managed.getLoader().unloadPlugin(pluginId));
                } catch (PluginException e) {
                    if (!force) {
                        throw e;
                    }
                    log.warn("[{}] Loader unload failed, continuing with force: {}", pluginId, e.getMessage());
                }
            } catch (PluginException e) {
                managed.forceState(PluginState.ERROR);
                throw e;
            }

            reporter.report("finalization", 0.9, "removing plugin");
            managed.transitionTo(PluginState.UNLOADED);
            plugins.remove(pluginId);
            removeFromGroup(managed);
        } finally {
            managed.getLock().unlock();
        }

        Map<String, Object> unloaded = new HashMap<>();
        unloaded.put(PluginEvent.SUCCESS, true);
        publishEvent(PluginTopics.UNLOADED, managed, unloaded);
        log.info("[{}] Plugin unloaded", pluginId);
    }

    /**
     * 所有重试失败后的兜底：尽力停止、强制清理并移除插件
     */
    private void recoverFromUnloadError(ManagedPlugin managed, PluginException cause, Duration timeout,
                                        ProgressReporter reporter) {
        String pluginId = managed.getId();
        log.error("[{}] Plugin unload failed, starting recovery: {}", pluginId, cause.getMessage());
        reporter.report("recovery", 0.85, "recovering from unload failure", cause);

        Map<String, Object> started = new HashMap<>();
        started.put(PluginEvent.SUCCESS, false);
        started.put(PluginEvent.ERROR, cause.getMessage());
        publishEvent(PluginTopics.UNLOAD_RECOVERY_STARTED, managed, started);

        List<Throwable> errors = new ArrayList<>();
        managed.getLock().lock();
        try {
            if (managed.getState().canStop()) {
                try {
                    callExecutor.run(pluginId, "force stop", FORCE_STOP_TIMEOUT, managed.getPlugin()::stop);
                } catch (PluginException e) {
                    log.warn("[{}] Force stop during recovery failed: {}", pluginId, e.getMessage());
                }
            }
            managed.forceState(PluginState.ERROR);
            managed.setLastError(cause);

            try {
                callExecutor.run(pluginId, "cleanup", timeout, managed.getPlugin()::cleanup);
            } catch (PluginException e) {
                errors.add(e);
            }
            resourceCleaner.cleanup(managed, CleanupScope.UNLOAD).failures()
                    .forEach(failure -> errors.add(failure.error()));
            securityCleaner.cleanup(managed).failures()
                    .forEach(failure -> errors.add(failure.error()));
            unregisterServices(managed);
            healthChecker.removePlugin(pluginId);
            monitor.removePlugin(pluginId);
            stopResourceMonitor(managed);

            plugins.remove(pluginId);
            removeFromGroup(managed);
        } finally {
            managed.getLock().unlock();
        }

        Map<String, Object> completed = new HashMap<>();
        completed.put(PluginEvent.SUCCESS, true);
        completed.put(PluginEvent.ERROR, cause.getMessage());
        publishEvent(PluginTopics.UNLOAD_RECOVERY_COMPLETED, managed, completed);
        reporter.report("finalization", 0.9, "plugin removed by recovery", cause);

        if (!errors.isEmpty()) {
            log.warn("[{}] Recovery cleanup finished with {} error(s)", pluginId, errors.size());
        }
        UnloadRecoveredException recovered = new UnloadRecoveredException(pluginId, cause);
        errors.forEach(recovered::addSuppressed);
        throw recovered;
    }

    /**
     * 仍被其它已注册插件依赖时拒绝卸载，并广播阻塞事件
     */
    private void checkDependentsForUnload(ManagedPlugin managed) {
        List<ManagedPlugin> dependents = DependencyGraph.dependentsOf(plugins.values(), managed);
        if (dependents.isEmpty()) {
            return;
        }
        List<String> ids = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (ManagedPlugin dependent : dependents) {
            ids.add(dependent.getId());
            names.add(dependent.getName());
            labels.add(dependent.getName() + "(" + dependent.getId() + ")");
        }
        Map<String, Object> extra = new HashMap<>();
        extra.put(PluginEvent.DEPENDENT_IDS, ids);
        extra.put(PluginEvent.DEPENDENT_NAMES, names);
        extra.put(PluginEvent.DEPENDENT_COUNT, dependents.size());
        publishEvent(PluginTopics.DEPENDENCY_BLOCKED, managed, extra);

        throw new DependencyException(managed.getId(), "dependency check failed for plugin " + managed.getId()
                + ": cannot unload plugin " + managed.getName() + ": it is required by " + dependents.size()
                + " other plugin(s): " + String.join(", ", labels), ids, null);
    }

    /**
     * 级联卸载：按优先级从高到低先卸载所有依赖方，每个插件只卸载一次
     */
    private void cascadeUnloadDependents(ManagedPlugin managed, UnloadOptions options) {
        List<ManagedPlugin> dependents = DependencyGraph.dependentsOf(plugins.values(), managed);
        dependents.sort(Comparator.comparingInt(ManagedPlugin::getPriority).reversed());
        for (ManagedPlugin dependent : dependents) {
            if (!plugins.containsKey(dependent.getId())) {
                continue;
            }
            log.info("[{}] Cascade unloading dependent plugin {}", managed.getId(), dependent.getId());
            try {
                doUnload(dependent, options, ProgressReporter.NOOP);
            } catch (UnloadRecoveredException e) {
                log.warn("[{}] Dependent plugin {} was removed by recovery: {}",
                        managed.getId(), dependent.getId(), e.getMessage());
            } catch (PluginException e) {
                if (!options.isForceUnload()) {
                    throw new DependencyException(managed.getId(), "cascade unload failed for dependent plugin "
                            + dependent.getId() + ": " + e.getMessage(), List.of(dependent.getId()), e);
                }
                log.warn("[{}] Cascade unload of {} failed, continuing with force: {}",
                        managed.getId(), dependent.getId(), e.getMessage());
            }
        }
    }

    // ==================== 分组 ====================

    public void addPluginToGroup(String pluginId, String groupName) {
        requireGroupName(groupName);
        lock.lock();
        try {
            ManagedPlugin managed = requirePlugin(pluginId);
            if (groupName.equals(managed.getGroup())) {
                return;
            }
            removeFromGroup(managed);
            groups.computeIfAbsent(groupName, k -> new ArrayList<>()).add(managed);
            managed.setGroup(groupName);
            log.debug("[{}] Added to group {}", pluginId, groupName);
        } finally {
            lock.unlock();
        }
    }

    public void removePluginFromGroup(String pluginId, String groupName) {
        requireGroupName(groupName);
        lock.lock();
        try {
            ManagedPlugin managed = requirePlugin(pluginId);
            List<ManagedPlugin> members = groups.get(groupName);
            if (members == null) {
                throw new PluginException(pluginId, "plugin group not found: " + groupName, null);
            }
            if (!groupName.equals(managed.getGroup())) {
                throw new PluginException(pluginId, "plugin " + pluginId + " is not in group " + groupName, null);
            }
            removeFromGroup(managed);
        } finally {
            lock.unlock();
        }
    }

    public List<String> getPluginGroupNames() {
        lock.lock();
        try {
            List<String> names = new ArrayList<>(groups.keySet());
            names.sort(null);
            return names;
        } finally {
            lock.unlock();
        }
    }

    public List<ManagedPlugin> getPluginGroup(String groupName) {
        lock.lock();
        try {
            List<ManagedPlugin> members = groups.get(groupName);
            return members != null ? List.copyOf(members) : List.of();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, List<ManagedPlugin>> getPluginGroups() {
        lock.lock();
        try {
            Map<String, List<ManagedPlugin>> copy = new TreeMap<>();
            groups.forEach((name, members) -> copy.put(name, List.copyOf(members)));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按优先级从高到低启动，已运行的插件跳过，遇错即停
     */
    public void startPluginGroup(String groupName, StartOptions options) {
        ensureOpen();
        lock.lock();
        try {
            for (ManagedPlugin member : sortedGroup(groupName, true)) {
                if (member.getState() == PluginState.RUNNING) {
                    continue;
                }
                try {
                    doStart(member, options != null ? options : StartOptions.defaults());
                } catch (PluginException e) {
                    throw new PluginOperationException(member.getId(), "failed to start plugin "
                            + member.getId() + " in group " + groupName + ": " + e.getMessage(), e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按优先级从低到高停止，未运行的插件跳过，遇错即停
     */
    public void stopPluginGroup(String groupName, StopOptions options) {
        ensureOpen();
        lock.lock();
        try {
            for (ManagedPlugin member : sortedGroup(groupName, false)) {
                if (member.getState() != PluginState.RUNNING) {
                    continue;
                }
                try {
                    doStop(member, options != null ? options : StopOptions.defaults(), false);
                } catch (PluginException e) {
                    throw new PluginOperationException(member.getId(), "failed to stop plugin "
                            + member.getId() + " in group " + groupName + ": " + e.getMessage(), e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按优先级从高到低卸载；强制模式下越过失败继续，最后汇总报错
     */
    public void unloadPluginGroup(String groupName, UnloadOptions options) {
        ensureOpen();
        UnloadOptions effective = options != null ? options : UnloadOptions.defaults();
        lock.lock();
        try {
            List<String> failures = new ArrayList<>();
            PluginException first = null;
            for (ManagedPlugin member : sortedGroup(groupName, true)) {
                if (!plugins.containsKey(member.getId())) {
                    continue;
                }
                try {
                    doUnload(member, effective, ProgressReporter.NOOP);
                } catch (PluginException e) {
                    if (!effective.isForceUnload()) {
                        throw new PluginOperationException(member.getId(), "failed to unload plugin "
                                + member.getId() + " in group " + groupName + ": " + e.getMessage(), e);
                    }
                    failures.add(member.getId() + ": " + e.getMessage());
                    if (first == null) {
                        first = e;
                    }
                }
            }
            if (!failures.isEmpty()) {
                throw new PluginOperationException(null, "failed to unload " + failures.size()
                        + " plugin(s) in group " + groupName + ": " + String.join("; ", failures), first);
            }
        } finally {
            lock.unlock();
        }
    }

    private List<ManagedPlugin> sortedGroup(String groupName, boolean descending) {
        List<ManagedPlugin> members = groups.get(groupName);
        if (members == null) {
            throw new PluginException(null, "plugin group not found: " + groupName, null);
        }
        List<ManagedPlugin> sorted = new ArrayList<>(members);
        Comparator<ManagedPlugin> byPriority = Comparator.comparingInt(ManagedPlugin::getPriority);
        sorted.sort(descending ? byPriority.reversed() : byPriority);
        return sorted;
    }

    private void removeFromGroup(ManagedPlugin managed) {
        String groupName = managed.getGroup();
        if (groupName == null) {
            return;
        }
        List<ManagedPlugin> members = groups.get(groupName);
        if (members != null) {
            members.removeIf(p -> p.getId().equals(managed.getId()));
            if (members.isEmpty()) {
                groups.remove(groupName);
            }
        }
        managed.setGroup(null);
    }

    // ==================== 批量与异步 ====================

    /**
     * 并发启动，返回每个 ID 的结果（成功为 null）
     */
    public Map<String, Throwable> startPlugins(List<String> pluginIds, StartOptions options) {
        return runBatch(pluginIds, id -> startPlugin(id, options));
    }

    public Map<String, Throwable> stopPlugins(List<String> pluginIds, StopOptions options) {
        return runBatch(pluginIds, id -> stopPlugin(id, options));
    }

    public Map<String, Throwable> unloadPlugins(List<String> pluginIds, UnloadOptions options) {
        return runBatch(pluginIds, id -> unloadPlugin(id, options));
    }

    private Map<String, Throwable> runBatch(List<String> pluginIds, Consumer<String> operation) {
        Map<String, CompletableFuture<Throwable>> futures = new LinkedHashMap<>();
        for (String id : pluginIds) {
            futures.put(id, CompletableFuture.runAsync(() -> operation.accept(id), batchExecutor)
                    .handle((ignored, error) -> unwrap(error)));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<String, Throwable> results = new LinkedHashMap<>();
        futures.forEach((id, future) -> results.put(id, future.join()));
        return results;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    public CompletableFuture<Void> startPluginAsync(String pluginId, StartOptions options) {
        return startQueue.submit(pluginId, () -> startPlugin(pluginId, options));
    }

    public CompletableFuture<Void> stopPluginAsync(String pluginId, StopOptions options) {
        return stopQueue.submit(pluginId, () -> stopPlugin(pluginId, options));
    }

    // ==================== 查询 ====================

    public ManagedPlugin getPlugin(String pluginId) {
        return requirePlugin(pluginId);
    }

    public List<ManagedPlugin> listPlugins() {
        List<ManagedPlugin> list = new ArrayList<>(plugins.values());
        list.sort(Comparator.comparing(ManagedPlugin::getId));
        return list;
    }

    public List<ManagedPlugin> getPluginsByState(PluginState state) {
        return filter(p -> p.getState() == state);
    }

    public List<ManagedPlugin> getPluginsByType(LoaderKind kind) {
        return filter(p -> p.getKind() == kind);
    }

    public List<ManagedPlugin> getRunningPlugins() {
        return getPluginsByState(PluginState.RUNNING);
    }

    public List<ManagedPlugin> getStoppedPlugins() {
        return getPluginsByState(PluginState.STOPPED);
    }

    public List<ManagedPlugin> getErrorPlugins() {
        return getPluginsByState(PluginState.ERROR);
    }

    public PluginInfo getPluginInfo(String pluginId) {
        return requirePlugin(pluginId).getInfo();
    }

    public PluginState getPluginState(String pluginId) {
        return requirePlugin(pluginId).getState();
    }

    /**
     * 各状态的插件数量，另含 {@code total}
     */
    public Map<String, Integer> getPluginStatistics() {
        Map<PluginState, Integer> byState = new EnumMap<>(PluginState.class);
        List<ManagedPlugin> snapshot = new ArrayList<>(plugins.values());
        for (ManagedPlugin p : snapshot) {
            byState.merge(p.getState(), 1, Integer::sum);
        }
        Map<String, Integer> stats = new LinkedHashMap<>();
        byState.forEach((state, count) -> stats.put(state.getValue(), count));
        stats.put("total", snapshot.size());
        return stats;
    }

    public int getPluginCount() {
        return plugins.size();
    }

    private List<ManagedPlugin> filter(Predicate<ManagedPlugin> predicate) {
        List<ManagedPlugin> result = new ArrayList<>();
        for (ManagedPlugin p : listPlugins()) {
            if (predicate.test(p)) {
                result.add(p);
            }
        }
        return result;
    }

    // ==================== 优先级与钩子 ====================

    public void setPluginPriority(String pluginId, int priority) {
        requirePlugin(pluginId).setPriority(priority);
    }

    public void addHook(String pluginId, LifecycleHook hook) {
        requirePlugin(pluginId).getHooks().add(hook);
    }

    public boolean removeHook(String pluginId, String hookName) {
        return requirePlugin(pluginId).getHooks().remove(hookName);
    }

    public List<LifecycleHook> getHooks(String pluginId) {
        return requirePlugin(pluginId).getHooks().list();
    }

    private List<LifecycleHook> hooksFor(ManagedPlugin managed, List<LifecycleHook> callHooks) {
        List<LifecycleHook> all = new ArrayList<>(managed.getHooks().list());
        if (callHooks != null) {
            all.addAll(callHooks);
        }
        return all;
    }

    /**
     * @param fatal 前置钩子失败时中止操作，其余阶段只记录
     */
    private void runHooks(List<LifecycleHook> hooks, HookPhase phase, ManagedPlugin managed,
                          Throwable error, boolean fatal) {
        for (LifecycleHook hook : hooks) {
            if (hook.phase() != phase) {
                continue;
            }
            try {
                hook.action().execute(managed, error);
            } catch (Exception e) {
                if (fatal) {
                    throw new PluginOperationException(managed.getId(), phaseLabel(phase) + " hook '" + hook.name()
                            + "' failed for plugin " + managed.getId() + ": " + e.getMessage(), e);
                }
                log.warn("[{}] {} hook '{}' failed: {}", managed.getId(), phaseLabel(phase), hook.name(),
                        e.getMessage());
            }
        }
    }

    private static String phaseLabel(HookPhase phase) {
        return phase.name().toLowerCase().replace('_', '-');
    }

    // ==================== 关闭 ====================

    /**
     * 停止并卸载全部插件，释放线程资源；重复调用无副作用
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down PluginManager, {} plugin(s) loaded", plugins.size());
        startQueue.shutdown();
        stopQueue.shutdown();

        lock.lock();
        try {
            if (config.isEnableGracefulShutdown()) {
                List<ManagedPlugin> running = new ArrayList<>(plugins.values());
                running.sort(Comparator.comparingInt(ManagedPlugin::getPriority));
                for (ManagedPlugin managed : running) {
                    if (!managed.getState().canStop()) {
                        continue;
                    }
                    try {
                        doStop(managed, StopOptions.builder()
                                .timeout(config.getShutdownTimeout())
                                .forceStop(true)
                                .force(true)
                                .build(), true);
                    } catch (PluginException e) {
                        log.warn("[{}] Failed to stop plugin during shutdown: {}", managed.getId(), e.getMessage());
                    }
                }
            }
            UnloadOptions forced = UnloadOptions.builder().forceUnload(true).build();
            for (ManagedPlugin managed : listPlugins()) {
                if (!plugins.containsKey(managed.getId())) {
                    continue;
                }
                try {
                    doUnload(managed, forced, ProgressReporter.NOOP);
                } catch (PluginException e) {
                    log.warn("[{}] Failed to unload plugin during shutdown: {}", managed.getId(), e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }

        healthChecker.stop();
        monitor.stop();
        scheduler.shutdownNow();
        monitorScheduler.shutdownNow();
        callExecutor.shutdown();
        batchExecutor.shutdownNow();
        log.info("PluginManager shutdown complete.");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    // ==================== 辅助方法 ====================

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new PluginException(null, "plugin manager is shut down", null);
        }
    }

    private ManagedPlugin requirePlugin(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new InvalidArgumentException("pluginId", "plugin ID cannot be empty");
        }
        ManagedPlugin managed = plugins.get(pluginId);
        if (managed == null) {
            throw new PluginNotFoundException(pluginId);
        }
        return managed;
    }

    private static void requireGroupName(String groupName) {
        if (groupName == null || groupName.isBlank()) {
            throw new InvalidArgumentException("groupName", "group name cannot be empty");
        }
    }

    private static void moveTo(ManagedPlugin managed, PluginState target) {
        if (PluginState.isValidTransition(managed.getState(), target)) {
            managed.transitionTo(target);
        } else {
            managed.forceState(target);
        }
    }

    private static String generatePluginId(String path, LoaderKind kind) {
        return kind.getValue() + "_" + path + "_" + System.nanoTime();
    }

    private static String safeName(String pluginId) {
        return pluginId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private CorePluginContext createContext(ManagedPlugin managed) {
        SecurityConfig securityConfig = config.isEnableSecurity()
                ? config.getPluginSecurity()
                : SecurityConfig.builder().permission(Permission.ALL).build();
        Map<String, Object> pluginConfig = new HashMap<>(managed.getInfo().getConfig());
        Path dataDirectory = managed.getTempDir() != null
                ? managed.getTempDir().resolve("data")
                : config.getTempDir().resolve(safeName(managed.getId())).resolve("data");
        return new CorePluginContext(managed.getId(), pluginConfig, dataDirectory, eventBus, serviceRegistry,
                new DefaultSecurityManager(managed.getId(), securityConfig));
    }

    private void registerServices(ManagedPlugin managed) {
        String name = managed.getName();
        try {
            serviceRegistry.registerService(ServiceRegistry.pluginServiceName(name), managed.getPlugin());
            serviceRegistry.registerService(ServiceRegistry.contextServiceName(name), managed.getContext());
        } catch (PluginException e) {
            log.warn("[{}] Failed to register plugin services: {}", managed.getId(), e.getMessage());
        }
    }

    private void unregisterServices(ManagedPlugin managed) {
        String name = managed.getName();
        serviceRegistry.unregisterService(ServiceRegistry.pluginServiceName(name));
        serviceRegistry.unregisterService(ServiceRegistry.contextServiceName(name));
    }

    private static ScheduledExecutorService newScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Scheduler thread {} failed: {}", t.getName(), e.getMessage()));
            return thread;
        });
    }

    private void startResourceMonitor(ManagedPlugin managed) {
        if (!config.isEnableMonitoring()) {
            return;
        }
        ResourceMonitor resourceMonitor = managed.getResourceMonitor();
        if (resourceMonitor == null) {
            resourceMonitor = new ResourceMonitor(managed.getId(), config.getResourceLimits(), resourceSampler,
                    scheduler, config.getResourceCheckInterval());
            resourceMonitor.setViolationListener(this::onResourceViolation);
            managed.setResourceMonitor(resourceMonitor);
        }
        resourceMonitor.start();
    }

    private static void stopResourceMonitor(ManagedPlugin managed) {
        ResourceMonitor resourceMonitor = managed.getResourceMonitor();
        if (resourceMonitor != null) {
            resourceMonitor.stop();
        }
    }

    /**
     * KILL 策略下超限的插件被异步强制停止
     */
    private void onResourceViolation(LimitViolation violation) {
        if (violation.mode() != EnforceMode.KILL || shutdown.get()) {
            return;
        }
        ManagedPlugin managed = plugins.get(violation.pluginId());
        if (managed == null || managed.getState() != PluginState.RUNNING) {
            return;
        }
        log.error("[{}] Resource limit exceeded ({}: {} > {}), forcing stop", violation.pluginId(),
                violation.resource(), violation.current(), violation.limit());
        stopPluginAsync(violation.pluginId(), StopOptions.builder().forceStop(true).force(true).build())
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("[{}] Forced stop after resource violation failed: {}",
                                violation.pluginId(), unwrap(error).getMessage());
                    }
                });
    }

    private void publishEvent(String topic, ManagedPlugin managed, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PluginEvent.PLUGIN_ID, managed.getId());
        data.put(PluginEvent.PLUGIN_PATH, managed.getPath());
        data.put(PluginEvent.PLUGIN_TYPE, managed.getKind().getValue());
        data.put(PluginEvent.PLUGIN_STATE, managed.getState().getValue());
        data.put(PluginEvent.TIMESTAMP, Instant.now());
        PluginInfo info = managed.getInfo();
        putIfPresent(data, PluginEvent.PLUGIN_NAME, info.getName());
        putIfPresent(data, PluginEvent.PLUGIN_VERSION, info.getVersion());
        putIfPresent(data, PluginEvent.PLUGIN_AUTHOR, info.getAuthor());
        data.putAll(extra);
        try {
            eventBus.publish(topic, new PluginEvent(topic, data));
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to publish event {}: {}", managed.getId(), topic, e.getMessage());
        }
    }

    private static void putIfPresent(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }

    private static void sleep(String pluginId, Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginOperationException(pluginId, "interrupted while waiting to retry", e);
        }
    }
}
