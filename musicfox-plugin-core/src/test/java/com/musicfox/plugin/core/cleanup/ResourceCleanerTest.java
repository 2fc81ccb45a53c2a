package com.musicfox.plugin.core.cleanup;

import com.musicfox.plugin.api.cleanup.FileHandleCleaner;
import com.musicfox.plugin.api.cleanup.MemoryCleaner;
import com.musicfox.plugin.api.cleanup.NetworkCleaner;
import com.musicfox.plugin.api.cleanup.SystemResourceCleaner;
import com.musicfox.plugin.api.loader.LoaderKind;
import com.musicfox.plugin.api.loader.PluginLoader;
import com.musicfox.plugin.api.plugin.Plugin;
import com.musicfox.plugin.core.context.CorePluginContext;
import com.musicfox.plugin.core.event.DefaultEventBus;
import com.musicfox.plugin.core.event.EventBus;
import com.musicfox.plugin.core.event.PluginTopics;
import com.musicfox.plugin.core.manager.HookPhase;
import com.musicfox.plugin.core.manager.LifecycleHook;
import com.musicfox.plugin.core.manager.ManagedPlugin;
import com.musicfox.plugin.core.manager.ManagedPlugins;
import com.musicfox.plugin.core.security.SecurityManager;
import com.musicfox.plugin.core.service.ServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ResourceCleaner 资源清理测试")
public class ResourceCleanerTest {

    @TempDir
    Path root;

    @Mock
    private EventBus eventBus;

    @Mock
    private PluginLoader loader;

    @Mock
    private SecurityManager securityManager;

    private Plugin plugin;
    private ManagedPlugin managed;
    private ResourceCleaner cleaner;

    @BeforeEach
    void setUp() throws Exception {
        plugin = mock(Plugin.class, withSettings().extraInterfaces(
                NetworkCleaner.class, MemoryCleaner.class, FileHandleCleaner.class, SystemResourceCleaner.class));
        managed = ManagedPlugins.create("lyrics", LoaderKind.DYNAMIC, plugin, loader, "scrobbler");
        managed.getMetadata().put("loader_type", "dynamic");
        managed.getHooks().add(LifecycleHook.of("audit", HookPhase.ON_CLEANUP, (p, e) -> { }));

        Path tempDir = root.resolve("plugins").resolve("lyrics");
        Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(tempDir.resolve("data/offsets.json"), "{}");
        managed.setTempDir(tempDir);
        managed.setContext(new CorePluginContext("lyrics", Map.of(), tempDir.resolve("data"), eventBus,
                new ServiceRegistry(), securityManager));

        cleaner = new ResourceCleaner(eventBus, root.resolve("cache"));
    }

    @Nested
    @DisplayName("事件订阅")
    class SubscriptionTests {

        @Test
        @DisplayName("只移除插件自己的订阅，宿主订阅保留")
        void shouldKeepHostSubscriptions() {
            DefaultEventBus bus = new DefaultEventBus();
            try {
                ManagedPlugin named = ManagedPlugins.create("unload", LoaderKind.DYNAMIC, plugin, loader);
                bus.subscribe(PluginTopics.UNLOAD_RECOVERY_STARTED, (topic, payload) -> { });
                bus.subscribe(PluginTopics.UNLOAD_RECOVERY_COMPLETED, (topic, payload) -> { });
                bus.subscribe("plugin.unload.status", (topic, payload) -> { });
                bus.subscribe("player.song.changed", (topic, payload) -> { }, "unload");
                bus.subscribe("plugin.unload.status", (topic, payload) -> { }, "unload");
                ResourceCleaner busCleaner = new ResourceCleaner(bus, null);

                busCleaner.cleanup(named, CleanupScope.STOP);

                assertEquals(1, bus.getSubscriberCount(PluginTopics.UNLOAD_RECOVERY_STARTED));
                assertEquals(1, bus.getSubscriberCount(PluginTopics.UNLOAD_RECOVERY_COMPLETED));
                assertEquals(1, bus.getSubscriberCount("plugin.unload.status"));
                assertEquals(0, bus.getSubscriberCount("player.song.changed"));

                busCleaner.cleanup(named, CleanupScope.UNLOAD);

                assertEquals(1, bus.getSubscriberCount(PluginTopics.UNLOAD_RECOVERY_STARTED));
                assertEquals(1, bus.getSubscriberCount("plugin.unload.status"));
            } finally {
                bus.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("卸载范围")
    class UnloadScopeTests {

        @Test
        @DisplayName("全部阶段执行并释放引用")
        void shouldRunAllStages() throws Exception {
            Path tempDir = managed.getTempDir();
            Path cacheDir = root.resolve("cache").resolve("lyrics");
            Files.createDirectories(cacheDir);

            CleanupReport report = cleaner.cleanup(managed, CleanupScope.UNLOAD);

            assertTrue(report.isSuccessful());
            assertTrue(managed.getContext().isClosed());
            verify(eventBus).unsubscribeOwner("lyrics");
            assertFalse(Files.exists(tempDir));
            assertFalse(Files.exists(cacheDir));
            assertNull(managed.getTempDir());
            verify((NetworkCleaner) plugin).closeConnections();
            verify((MemoryCleaner) plugin).cleanupMemory();
            verify((FileHandleCleaner) plugin).closeFiles();
            verify((SystemResourceCleaner) plugin).cleanupSystemResources();
            verify(loader).releaseResources("lyrics");
            assertTrue(managed.getMetadata().isEmpty());
            assertTrue(managed.getDependencies().isEmpty());
            assertTrue(managed.getHooks().list().isEmpty());
        }

        @Test
        @DisplayName("单个阶段失败不影响后续阶段")
        void shouldContinueAfterStageFailure() throws Exception {
            doThrow(new IllegalStateException("socket stuck")).when((NetworkCleaner) plugin).closeConnections();

            CleanupReport report = cleaner.cleanup(managed, CleanupScope.UNLOAD);

            assertFalse(report.isSuccessful());
            assertEquals(1, report.failures().size());
            assertEquals(ResourceCleaner.STAGE_NETWORK, report.failures().get(0).stage());
            verify((MemoryCleaner) plugin).cleanupMemory();
            verify(loader).releaseResources("lyrics");
            assertTrue(report.toException("resource cleanup").getMessage().contains("network: socket stuck"));
        }

        @Test
        @DisplayName("加载器清理失败的消息带上加载器类型")
        void shouldLabelLoaderFailure() throws Exception {
            doThrow(new IllegalStateException("handle leaked")).when(loader).releaseResources("lyrics");

            CleanupReport report = cleaner.cleanup(managed, CleanupScope.UNLOAD);

            assertEquals(ResourceCleaner.STAGE_LOADER, report.failures().get(0).stage());
            assertEquals("dynamic library cleanup failed: handle leaked", report.failures().get(0).error().getMessage());
        }
    }

    @Nested
    @DisplayName("停止范围")
    class StopScopeTests {

        @Test
        @DisplayName("保留引用与加载器资源")
        void shouldKeepReferences() throws Exception {
            CleanupReport report = cleaner.cleanup(managed, CleanupScope.STOP);

            assertTrue(report.isSuccessful());
            assertTrue(managed.getContext().isClosed());
            assertEquals("dynamic", managed.getMetadata().get("loader_type"));
            assertEquals(1, managed.getDependencies().size());
            assertEquals(1, managed.getHooks().list().size());
            verify(loader, never()).releaseResources(anyString());
            verify((MemoryCleaner) plugin).cleanupMemory();
        }
    }

    @Test
    @DisplayName("没有上下文与临时目录时也能完成")
    void shouldTolerateMissingResources() {
        managed.setContext(null);
        managed.setTempDir(null);

        CleanupReport report = new ResourceCleaner(eventBus, null).cleanup(managed, CleanupScope.UNLOAD);

        assertTrue(report.isSuccessful());
    }
}
