package com.musicfox.plugin.core.resource;

import com.musicfox.plugin.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceMonitor 单元测试")
public class ResourceMonitorTest {

    private static final String PLUGIN_ID = "lyric";

    private ScheduledExecutorService scheduler;

    private final AtomicReference<ResourceUsage> current = new AtomicReference<>(ResourceUsage.empty());

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Nested
    @DisplayName("限额检查")
    class LimitTests {

        @Test
        @DisplayName("未超限时健康且无违规")
        void withinLimitsShouldBeHealthy() {
            ResourceMonitor monitor = monitor(ResourceLimits.defaults());
            current.set(usage(100, 10, 5));

            assertTrue(monitor.sampleNow().isEmpty());
            assertTrue(monitor.isHealthy());
            assertEquals(100, monitor.getMetrics().memoryUsageMb());
        }

        @Test
        @DisplayName("WARN 模式只记录，不计数")
        void warnModeShouldOnlyLog() {
            ResourceMonitor monitor = monitor(ResourceLimits.builder().enforceMode(EnforceMode.WARN).build());
            current.set(usage(512, 10, 5));

            List<LimitViolation> violations = monitor.sampleNow();

            assertEquals(1, violations.size());
            assertEquals("memory", violations.get(0).resource());
            assertFalse(monitor.isHealthy());
            assertEquals(0, monitor.getViolationCount());
            assertFalse(monitor.isKillRequested());
        }

        @Test
        @DisplayName("LIMIT 模式计数违规")
        void limitModeShouldCount() {
            ResourceMonitor monitor = monitor(ResourceLimits.defaults());
            current.set(usage(512, 90, 5));

            monitor.sampleNow();

            assertEquals(2, monitor.getViolationCount());
            assertFalse(monitor.isKillRequested());
        }

        @Test
        @DisplayName("KILL 模式标记强制停止并通知监听器")
        void killModeShouldFlagAndNotify() {
            ResourceMonitor monitor = monitor(ResourceLimits.builder().enforceMode(EnforceMode.KILL).build());
            List<LimitViolation> received = new CopyOnWriteArrayList<>();
            monitor.setViolationListener(received::add);
            current.set(usage(10, 10, 500));

            monitor.sampleNow();

            assertTrue(monitor.isKillRequested());
            assertEquals(1, received.size());
            assertEquals(EnforceMode.KILL, received.get(0).mode());
            assertEquals(PLUGIN_ID, received.get(0).pluginId());
        }

        @Test
        @DisplayName("限额为 0 的维度不检查")
        void zeroLimitShouldBeIgnored() {
            ResourceMonitor monitor = monitor(ResourceLimits.builder().maxMemoryMb(0).build());
            current.set(usage(100_000, 10, 5));

            assertTrue(monitor.sampleNow().isEmpty());
        }
    }

    @Nested
    @DisplayName("限额热更新")
    class UpdateTests {

        @Test
        @DisplayName("更新后下一次采样按新限额判断")
        void updatedLimitsShouldApply() {
            ResourceMonitor monitor = monitor(ResourceLimits.defaults());
            current.set(usage(200, 10, 5));
            assertTrue(monitor.sampleNow().isEmpty());

            monitor.updateLimits(ResourceLimits.builder().maxMemoryMb(128).build());

            assertEquals(1, monitor.sampleNow().size());
            assertEquals(128, monitor.getLimits().getMaxMemoryMb());
        }

        @Test
        @DisplayName("负数限额被拒绝")
        void negativeLimitShouldBeRejected() {
            ResourceMonitor monitor = monitor(ResourceLimits.defaults());

            assertThrows(InvalidArgumentException.class,
                    () -> monitor.updateLimits(ResourceLimits.builder().maxConnections(-1).build()));
        }
    }

    @Test
    @DisplayName("周期采样在启动后执行，停止后不再执行")
    void periodicSamplingShouldRunUntilStopped() {
        ResourceMonitor monitor = new ResourceMonitor(PLUGIN_ID, ResourceLimits.defaults(), current::get,
                scheduler, Duration.ofMillis(20));
        current.set(usage(42, 1, 1));

        monitor.start();
        assertTrue(monitor.isRunning());
        await().atMost(Duration.ofSeconds(2)).until(() -> monitor.getMetrics().memoryUsageMb() == 42);

        monitor.stop();
        assertFalse(monitor.isRunning());
    }

    // ==================== 辅助方法 ====================

    private ResourceMonitor monitor(ResourceLimits limits) {
        return new ResourceMonitor(PLUGIN_ID, limits, current::get, scheduler, ResourceMonitor.DEFAULT_INTERVAL);
    }

    private static ResourceUsage usage(long memoryMb, double cpu, int tasks) {
        return new ResourceUsage(memoryMb, cpu, tasks, 0, 0, Instant.now());
    }
}
