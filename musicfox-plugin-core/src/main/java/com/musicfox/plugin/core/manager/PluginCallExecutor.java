package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.PluginOperationException;
import com.musicfox.plugin.api.exception.PluginTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件回调执行器
 * 职责：线程隔离、超时控制、异常收敛
 * <p>
 * 回调在独立任务中执行并与超时赛跑，先到者生效。超时的任务不会被中断，只会被放弃。
 * 插件抛出的任何 Throwable 都会被收敛为 {@link PluginOperationException}。
 */
@Slf4j
public class PluginCallExecutor {

    // ================= 线程池配置 =================
    private static final int CORE_POOL_SIZE = Runtime.getRuntime().availableProcessors();
    // 超时的调用会一直占着线程，上限要给被放弃的任务留足余量
    private static final int DEFAULT_MAX_CONCURRENT_CALLS = Math.max(64, CORE_POOL_SIZE * 16);
    private static final long KEEP_ALIVE_TIME = 60L;

    private final ExecutorService executor;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public PluginCallExecutor() {
        this(DEFAULT_MAX_CONCURRENT_CALLS);
    }

    /**
     * @param maxConcurrentCalls 同时在执行（含已超时被放弃）的回调上限，超出即拒绝
     */
    public PluginCallExecutor(int maxConcurrentCalls) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive: " + maxConcurrentCalls);
        }
        // SynchronousQueue 直接移交：每个回调立即获得线程，不会排在卡死的回调后面
        this.executor = new ThreadPoolExecutor(
                Math.min(CORE_POOL_SIZE, maxConcurrentCalls),
                maxConcurrentCalls,
                KEEP_ALIVE_TIME, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("musicfox-plugin-call-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy() // 满载时快速失败，不阻塞编排线程
        );
    }

    public PluginCallExecutor(ExecutorService executor) {
        this.executor = executor;
    }

    @FunctionalInterface
    public interface PluginCall {
        void run() throws Exception;
    }

    /**
     * 执行无返回值的插件回调
     */
    public void run(String pluginId, String operation, Duration timeout, PluginCall call) {
        call(pluginId, operation, timeout, () -> {
            call.run();
            return null;
        });
    }

    /**
     * 执行插件回调并等待结果
     *
     * @throws PluginTimeoutException   超时
     * @throws PluginOperationException 回调失败（含 Error）或被拒绝执行
     */
    public <T> T call(String pluginId, String operation, Duration timeout, Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(() -> {
                try {
                    return call.call();
                } catch (Exception e) {
                    throw e;
                } catch (Throwable t) {
                    // Error 也要收敛，不能让插件拖垮编排线程
                    throw new ExecutionException("plugin " + operation + " panicked: " + t, t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new PluginOperationException(pluginId, "plugin " + operation + " rejected: executor is saturated", e);
        }

        long timeoutMs = timeout.toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[{}] Plugin {} timed out after {}ms, abandoning call", pluginId, operation, timeoutMs);
            throw new PluginTimeoutException(pluginId, "plugin " + operation + " timeout after " + timeoutMs + "ms",
                    timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            throw new PluginOperationException(pluginId,
                    "plugin " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginOperationException(pluginId, "interrupted while waiting for plugin " + operation, e);
        }
    }

    private static Throwable unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        // 内层包装的 Error
        if (cause instanceof ExecutionException inner && inner.getCause() != null) {
            return inner.getCause();
        }
        return cause != null ? cause : e;
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
