package com.musicfox.plugin.core.cleanup;

import com.musicfox.plugin.api.cleanup.FileHandleCleaner;
import com.musicfox.plugin.api.cleanup.MemoryCleaner;
import com.musicfox.plugin.api.cleanup.NetworkCleaner;
import com.musicfox.plugin.api.cleanup.SystemResourceCleaner;
import com.musicfox.plugin.api.loader.PluginLoader;
import com.musicfox.plugin.core.context.CorePluginContext;
import com.musicfox.plugin.core.event.EventBus;
import com.musicfox.plugin.core.manager.ManagedPlugin;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 插件资源清理
 * <p>
 * 八个阶段依次执行，单个阶段失败不影响后续阶段：
 * 上下文、事件订阅、临时文件与缓存、网络连接、内存引用、文件句柄、系统资源、加载器相关资源。
 * <p>
 * {@link CleanupScope#STOP} 保留依赖/钩子/元数据与加载器资源，插件之后还能再次启动。
 */
@Slf4j
public class ResourceCleaner {

    public static final String STAGE_CONTEXT = "context";
    public static final String STAGE_EVENT_LISTENERS = "event_listeners";
    public static final String STAGE_TEMP_FILES = "temp_files";
    public static final String STAGE_NETWORK = "network";
    public static final String STAGE_MEMORY = "memory";
    public static final String STAGE_FILE_HANDLES = "file_handles";
    public static final String STAGE_SYSTEM = "system_resources";
    public static final String STAGE_LOADER = "loader_specific";

    private final EventBus eventBus;
    private final Path cacheRoot;

    public ResourceCleaner(@NonNull EventBus eventBus, Path cacheRoot) {
        this.eventBus = eventBus;
        this.cacheRoot = cacheRoot;
    }

    @FunctionalInterface
    private interface Stage {
        void run() throws Exception;
    }

    public CleanupReport cleanup(@NonNull ManagedPlugin managed, @NonNull CleanupScope scope) {
        String pluginId = managed.getId();
        log.info("[{}] Starting plugin resource cleanup ({})", pluginId, scope);
        boolean unloading = scope == CleanupScope.UNLOAD;

        List<CleanupReport.StageFailure> failures = new ArrayList<>();
        runStage(managed, STAGE_CONTEXT, () -> cleanupContext(managed), failures);
        runStage(managed, STAGE_EVENT_LISTENERS, () -> cleanupEventListeners(managed), failures);
        runStage(managed, STAGE_TEMP_FILES, () -> cleanupTemporaryFiles(managed), failures);
        runStage(managed, STAGE_NETWORK, () -> cleanupNetwork(managed), failures);
        runStage(managed, STAGE_MEMORY, () -> cleanupMemory(managed, unloading), failures);
        runStage(managed, STAGE_FILE_HANDLES, () -> cleanupFileHandles(managed), failures);
        runStage(managed, STAGE_SYSTEM, () -> cleanupSystemResources(managed), failures);
        if (unloading) {
            runStage(managed, STAGE_LOADER, () -> cleanupLoaderResources(managed), failures);
        }

        CleanupReport report = new CleanupReport(pluginId, failures);
        if (report.isSuccessful()) {
            log.info("[{}] Plugin resource cleanup completed successfully", pluginId);
        } else {
            log.warn("[{}] Plugin resource cleanup completed with {} error(s)", pluginId, failures.size());
        }
        return report;
    }

    private void runStage(ManagedPlugin managed, String name, Stage stage, List<CleanupReport.StageFailure> failures) {
        try {
            stage.run();
        } catch (Throwable e) {
            log.warn("[{}] Cleanup stage {} failed: {}", managed.getId(), name, e.getMessage());
            failures.add(new CleanupReport.StageFailure(name, e));
        }
    }

    // ==================== 各阶段 ====================

    private void cleanupContext(ManagedPlugin managed) {
        CorePluginContext context = managed.getContext();
        if (context != null) {
            context.cleanup();
        }
    }

    private void cleanupEventListeners(ManagedPlugin managed) {
        // 只移除插件自己的订阅，宿主与其它插件的订阅不受影响
        int removed = eventBus.unsubscribeOwner(managed.getId());
        if (removed > 0) {
            log.debug("[{}] Removed {} event subscription(s)", managed.getId(), removed);
        }
    }

    private void cleanupTemporaryFiles(ManagedPlugin managed) throws IOException {
        List<String> errors = new ArrayList<>();

        Path tempDir = managed.getTempDir();
        if (tempDir != null) {
            try {
                deleteRecursively(tempDir);
                log.debug("[{}] Removed plugin temp directory {}", managed.getId(), tempDir);
            } catch (IOException | UncheckedIOException e) {
                errors.add("failed to remove temp directory " + tempDir + ": " + e.getMessage());
            }
            managed.setTempDir(null);
        }

        if (cacheRoot != null) {
            Path cacheDir = cacheRoot.resolve(managed.getName());
            if (Files.exists(cacheDir)) {
                try {
                    deleteRecursively(cacheDir);
                    log.debug("[{}] Removed plugin cache directory {}", managed.getId(), cacheDir);
                } catch (IOException | UncheckedIOException e) {
                    errors.add("failed to remove cache directory " + cacheDir + ": " + e.getMessage());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IOException("temporary files cleanup errors: " + String.join("; ", errors));
        }
    }

    private void cleanupNetwork(ManagedPlugin managed) throws Exception {
        if (managed.getPlugin() instanceof NetworkCleaner cleaner) {
            cleaner.closeConnections();
            log.debug("[{}] Closed network connections", managed.getId());
        }
    }

    private void cleanupMemory(ManagedPlugin managed, boolean releaseReferences) throws Exception {
        if (releaseReferences) {
            managed.releaseReferences();
        }
        if (managed.getPlugin() instanceof MemoryCleaner cleaner) {
            cleaner.cleanupMemory();
        }
        log.debug("[{}] Cleaned up memory resources", managed.getId());
    }

    private void cleanupFileHandles(ManagedPlugin managed) throws Exception {
        if (managed.getPlugin() instanceof FileHandleCleaner cleaner) {
            cleaner.closeFiles();
            log.debug("[{}] Closed plugin file handles", managed.getId());
        }
    }

    private void cleanupSystemResources(ManagedPlugin managed) throws Exception {
        if (managed.getPlugin() instanceof SystemResourceCleaner cleaner) {
            cleaner.cleanupSystemResources();
            log.debug("[{}] Cleaned up system resources", managed.getId());
        }
    }

    private void cleanupLoaderResources(ManagedPlugin managed) throws Exception {
        PluginLoader loader = managed.getLoader();
        if (loader == null) {
            return;
        }
        String what = switch (managed.getKind()) {
            case DYNAMIC -> "dynamic library";
            case RPC -> "RPC";
            case WASM -> "WASM";
            case HOT_RELOAD -> "hot reload";
        };
        try {
            loader.releaseResources(managed.getId());
        } catch (Exception e) {
            throw new Exception(what + " cleanup failed: " + e.getMessage(), e);
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
