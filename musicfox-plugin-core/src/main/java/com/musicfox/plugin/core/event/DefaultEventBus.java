package com.musicfox.plugin.core.event;

import com.musicfox.plugin.api.event.EventHandler;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 默认事件总线实现
 * <p>
 * 特点：
 * - 异步派发（每个处理器一个任务，无顺序保证）
 * - 处理器隔离（异常只记录日志）
 * - 按主题或按归属插件批量取消订阅
 */
@Slf4j
public class DefaultEventBus implements EventBus {

    // Key: topic, Value: 订阅列表（同一处理器可重复订阅）
    private final Map<String, List<Listener>> subscribers = new ConcurrentHashMap<>();

    private final ExecutorService dispatcher;
    private final boolean ownsDispatcher;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public DefaultEventBus() {
        this.dispatcher = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "musicfox-event-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.ownsDispatcher = true;
    }

    public DefaultEventBus(@NonNull ExecutorService dispatcher) {
        this.dispatcher = dispatcher;
        this.ownsDispatcher = false;
    }

    @Override
    public int publish(@NonNull String topic, Object payload) {
        List<Listener> listeners = subscribers.get(topic);
        if (listeners == null || listeners.isEmpty()) {
            log.debug("No subscribers for topic {}", topic);
            return 0;
        }

        int dispatched = 0;
        for (Listener listener : listeners) {
            try {
                dispatcher.execute(() -> deliver(topic, payload, listener));
                dispatched++;
            } catch (RejectedExecutionException e) {
                log.warn("Event dispatch rejected for topic {}: {}", topic, e.getMessage());
            }
        }
        log.debug("Published {} to {} subscriber(s)", topic, dispatched);
        return dispatched;
    }

    private void deliver(String topic, Object payload, Listener listener) {
        try {
            listener.handler().handle(topic, payload);
        } catch (Throwable e) {
            log.error("Error handling event {} (owner={}): {}", topic, listener.ownerId(), e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(String topic, EventHandler handler) {
        subscribe(topic, handler, null);
    }

    @Override
    public void subscribe(@NonNull String topic, @NonNull EventHandler handler, String ownerId) {
        subscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>())
                .add(new Listener(handler, ownerId));
        log.debug("Subscribed to {} (owner={})", topic, ownerId);
    }

    @Override
    public boolean unsubscribe(@NonNull String topic, @NonNull EventHandler handler) {
        List<Listener> listeners = subscribers.get(topic);
        if (listeners == null) {
            return false;
        }
        for (Listener listener : listeners) {
            if (listener.handler() == handler) {
                // CopyOnWriteArrayList.remove(Object) 只移除第一个相等元素
                boolean removed = listeners.remove(listener);
                if (removed) {
                    log.debug("Unsubscribed from {}", topic);
                }
                return removed;
            }
        }
        return false;
    }

    @Override
    public int unsubscribeOwner(@NonNull String ownerId) {
        int removed = 0;
        for (List<Listener> listeners : subscribers.values()) {
            for (Listener listener : listeners) {
                if (ownerId.equals(listener.ownerId()) && listeners.remove(listener)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("[{}] Removed {} subscription(s)", ownerId, removed);
        }
        return removed;
    }

    @Override
    public int getSubscriberCount(@NonNull String topic) {
        List<Listener> listeners = subscribers.get(topic);
        return listeners == null ? 0 : listeners.size();
    }

    @Override
    public void shutdown() {
        subscribers.clear();
        if (ownsDispatcher) {
            dispatcher.shutdown();
            try {
                if (!dispatcher.awaitTermination(1, TimeUnit.SECONDS)) {
                    dispatcher.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatcher.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("EventBus shutdown complete.");
    }

    private record Listener(EventHandler handler, String ownerId) {
    }
}
