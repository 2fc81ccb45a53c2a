package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.PluginOperationException;
import com.musicfox.plugin.api.exception.PluginTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginCallExecutor 单元测试")
public class PluginCallExecutorTest {

    private PluginCallExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new PluginCallExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("正常返回结果")
    void shouldReturnResult() {
        assertEquals(42, executor.call("lyric", "compute", Duration.ofSeconds(1), () -> 42));
    }

    @Test
    @DisplayName("回调异常包装为 PluginOperationException 并保留原因")
    void failureShouldBeWrapped() {
        PluginOperationException e = assertThrows(PluginOperationException.class,
                () -> executor.run("lyric", "start", Duration.ofSeconds(1), () -> {
                    throw new IOException("socket closed");
                }));

        assertEquals("plugin start failed: socket closed", e.getMessage());
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals("lyric", e.getPluginId());
    }

    @Test
    @DisplayName("Error 也被收敛为普通错误")
    void errorShouldBeContained() {
        PluginOperationException e = assertThrows(PluginOperationException.class,
                () -> executor.run("lyric", "start", Duration.ofSeconds(1), () -> {
                    throw new OutOfMemoryError("boom");
                }));

        assertInstanceOf(OutOfMemoryError.class, e.getCause());
    }

    @Test
    @DisplayName("超时与同步失败属于同一异常类型")
    void timeoutShouldBeOperationException() {
        CountDownLatch never = new CountDownLatch(1);

        PluginOperationException e = assertThrows(PluginOperationException.class,
                () -> executor.run("lyric", "stop", Duration.ofMillis(50), never::await));

        assertInstanceOf(PluginTimeoutException.class, e);
        assertEquals(50, ((PluginTimeoutException) e).getTimeoutMillis());
        assertTrue(e.getMessage().contains("timeout after 50ms"));
        never.countDown();
    }

    @Test
    @DisplayName("被放弃的卡死回调不阻塞后续回调")
    void abandonedCallShouldNotBlockLaterCalls() {
        PluginCallExecutor pool = new PluginCallExecutor(4);
        CountDownLatch stuck = new CountDownLatch(1);
        try {
            for (int i = 0; i < 3; i++) {
                assertThrows(PluginTimeoutException.class,
                        () -> pool.run("visualizer", "start", Duration.ofMillis(50), stuck::await));
            }

            long begin = System.nanoTime();
            assertEquals("ok", pool.call("lyric", "load", Duration.ofMillis(500), () -> "ok"));
            assertTrue(Duration.ofNanos(System.nanoTime() - begin).toMillis() < 400);
        } finally {
            stuck.countDown();
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("线程耗尽时立即拒绝而不是排队")
    void saturatedExecutorShouldRejectImmediately() {
        PluginCallExecutor pool = new PluginCallExecutor(1);
        CountDownLatch stuck = new CountDownLatch(1);
        try {
            assertThrows(PluginTimeoutException.class,
                    () -> pool.run("visualizer", "start", Duration.ofMillis(50), stuck::await));

            PluginOperationException e = assertThrows(PluginOperationException.class,
                    () -> pool.run("lyric", "load", Duration.ofSeconds(5), () -> { }));

            assertFalse(e instanceof PluginTimeoutException);
            assertTrue(e.getMessage().contains("executor is saturated"));
        } finally {
            stuck.countDown();
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("并发上限必须为正")
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new PluginCallExecutor(0));
    }
}
