package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.PluginException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AsyncRequestQueue 异步请求队列测试")
public class AsyncRequestQueueTest {

    private AsyncRequestQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    @Test
    @DisplayName("按提交顺序执行")
    void shouldRunInOrder() throws Exception {
        queue = new AsyncRequestQueue("start", 8);
        List<String> order = new CopyOnWriteArrayList<>();

        CompletableFuture<Void> first = queue.submit("lyrics", () -> order.add("lyrics"));
        CompletableFuture<Void> second = queue.submit("scrobbler", () -> order.add("scrobbler"));
        CompletableFuture.allOf(first, second).get(2, TimeUnit.SECONDS);

        assertEquals(List.of("lyrics", "scrobbler"), order);
    }

    @Test
    @DisplayName("操作异常传递给 future")
    void shouldPropagateFailure() {
        queue = new AsyncRequestQueue("stop", 8);

        CompletableFuture<Void> future = queue.submit("lyrics", () -> {
            throw new PluginException("lyrics", "plugin is not running: lyrics", null);
        });

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertInstanceOf(PluginException.class, ex.getCause());
    }

    @Test
    @DisplayName("队列满时立即失败，关闭时未处理的请求失败")
    void shouldRejectWhenFullAndFailPendingOnShutdown() throws Exception {
        queue = new AsyncRequestQueue("start", 1);
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> blocking = queue.submit("lyrics", () -> {
            running.countDown();
            try {
                release.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(running.await(2, TimeUnit.SECONDS));
        CompletableFuture<Void> pending = queue.submit("scrobbler", () -> { });
        CompletableFuture<Void> rejected = queue.submit("visualizer", () -> { });

        assertTrue(rejected.isCompletedExceptionally());
        ExecutionException full = assertThrows(ExecutionException.class, rejected::get);
        assertEquals("start queue is full", full.getCause().getMessage());
        assertEquals(1, queue.size());

        queue.shutdown();
        release.countDown();

        ExecutionException closed = assertThrows(ExecutionException.class, () -> pending.get(2, TimeUnit.SECONDS));
        assertEquals("plugin manager is shutting down", closed.getCause().getMessage());
        await().atMost(2, TimeUnit.SECONDS).until(blocking::isDone);

        CompletableFuture<Void> late = queue.submit("equalizer", () -> { });
        ExecutionException lateEx = assertThrows(ExecutionException.class, late::get);
        assertEquals("start queue is closed", lateEx.getCause().getMessage());
    }
}
