package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.exception.PluginException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * 有界异步请求队列，由一个专用线程顺序消费
 * <p>
 * 队列满时立即以失败完成返回的 future，不阻塞调用方。
 */
@Slf4j
class AsyncRequestQueue {

    private final String name;
    private final BlockingQueue<Request> queue;
    private final Thread consumer;
    private volatile boolean running = true;

    AsyncRequestQueue(String name, int capacity) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.consumer = new Thread(this::consume, "musicfox-" + name + "-queue");
        this.consumer.setDaemon(true);
        this.consumer.start();
    }

    CompletableFuture<Void> submit(String pluginId, Runnable operation) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (!running) {
            result.completeExceptionally(new PluginException(pluginId, name + " queue is closed", null));
            return result;
        }
        if (!queue.offer(new Request(pluginId, operation, result))) {
            log.warn("[{}] {} queue is full, request rejected", pluginId, name);
            result.completeExceptionally(new PluginException(pluginId, name + " queue is full", null));
        }
        return result;
    }

    private void consume() {
        while (running) {
            Request request;
            try {
                request = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                request.operation().run();
                request.result().complete(null);
            } catch (Throwable e) {
                request.result().completeExceptionally(e);
            }
        }
        log.debug("{} queue consumer exited", name);
    }

    int size() {
        return queue.size();
    }

    /**
     * 停止消费，未处理的请求以失败完成
     */
    void shutdown() {
        running = false;
        consumer.interrupt();
        List<Request> pending = new ArrayList<>();
        queue.drainTo(pending);
        for (Request request : pending) {
            request.result().completeExceptionally(
                    new PluginException(request.pluginId(), "plugin manager is shutting down", null));
        }
    }

    private record Request(String pluginId, Runnable operation, CompletableFuture<Void> result) {
    }
}
