package com.musicfox.plugin.core.event;

import com.musicfox.plugin.api.event.EventHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultEventBus 单元测试")
public class DefaultEventBusTest {

    private DefaultEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new DefaultEventBus();
    }

    @AfterEach
    void tearDown() {
        eventBus.shutdown();
    }

    @Nested
    @DisplayName("订阅和发布")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("无订阅者的主题发布成功且投递数为 0")
        void publishWithoutSubscribersShouldDeliverNothing() {
            assertEquals(0, eventBus.publish("player.song.changed", "x"));
            assertEquals(0, eventBus.getSubscriberCount("player.song.changed"));
        }

        @Test
        @DisplayName("订阅后应能收到事件")
        void subscriberShouldReceiveEvent() {
            AtomicReference<Object> received = new AtomicReference<>();
            eventBus.subscribe("player.song.changed", (topic, payload) -> received.set(payload));

            assertEquals(1, eventBus.publish("player.song.changed", "song-1"));

            await().atMost(Duration.ofSeconds(2)).until(() -> received.get() != null);
            assertEquals("song-1", received.get());
        }

        @Test
        @DisplayName("多个订阅者都应收到事件")
        void multipleSubscribersShouldAllReceive() {
            AtomicInteger count = new AtomicInteger(0);
            for (int i = 0; i < 3; i++) {
                eventBus.subscribe("lyric.updated", (topic, payload) -> count.incrementAndGet());
            }

            assertEquals(3, eventBus.publish("lyric.updated", null));

            await().atMost(Duration.ofSeconds(2)).until(() -> count.get() == 3);
        }

        @Test
        @DisplayName("其它主题的订阅者不应被触发")
        void otherTopicShouldNotTrigger() throws InterruptedException {
            AtomicInteger count = new AtomicInteger(0);
            eventBus.subscribe("lyric.updated", (topic, payload) -> count.incrementAndGet());

            eventBus.publish("player.paused", null);

            Thread.sleep(100);
            assertEquals(0, count.get());
        }
    }

    @Nested
    @DisplayName("取消订阅")
    class UnsubscribeTests {

        @Test
        @DisplayName("N 次订阅 M 次取消后计数为 max(N-M, 0)")
        void subscriberCountShouldFollowSubscribeAndUnsubscribe() {
            EventHandler handler = (topic, payload) -> {
            };
            for (int i = 0; i < 3; i++) {
                eventBus.subscribe("t", handler);
            }
            assertEquals(3, eventBus.getSubscriberCount("t"));

            assertTrue(eventBus.unsubscribe("t", handler));
            assertEquals(2, eventBus.getSubscriberCount("t"));

            eventBus.unsubscribe("t", handler);
            eventBus.unsubscribe("t", handler);
            assertFalse(eventBus.unsubscribe("t", handler));
            assertEquals(0, eventBus.getSubscriberCount("t"));
        }

        @Test
        @DisplayName("只移除指定处理器，其它处理器保留")
        void unsubscribeShouldRemoveOnlyThatHandler() {
            EventHandler first = (topic, payload) -> {
            };
            EventHandler second = (topic, payload) -> {
            };
            eventBus.subscribe("t", first);
            eventBus.subscribe("t", second);

            eventBus.unsubscribe("t", first);

            assertEquals(1, eventBus.getSubscriberCount("t"));
        }

        @Test
        @DisplayName("按归属插件取消订阅")
        void unsubscribeOwner() {
            EventHandler handler = (topic, payload) -> {
            };
            eventBus.subscribe("player.song.changed", handler, "lyric");
            eventBus.subscribe("player.paused", handler, "lyric");
            eventBus.subscribe("player.paused", handler, "scrobbler");

            assertEquals(2, eventBus.unsubscribeOwner("lyric"));

            assertEquals(0, eventBus.getSubscriberCount("player.song.changed"));
            assertEquals(1, eventBus.getSubscriberCount("player.paused"));
        }
    }

    @Nested
    @DisplayName("异常处理")
    class ExceptionHandlingTests {

        @Test
        @DisplayName("订阅者抛出异常不应影响发布者与其他订阅者")
        void exceptionShouldNotAffectOthers() {
            AtomicInteger count = new AtomicInteger(0);
            eventBus.subscribe("t", (topic, payload) -> {
                throw new IllegalStateException("Oops!");
            });
            eventBus.subscribe("t", (topic, payload) -> {
                throw new StackOverflowError();
            });
            eventBus.subscribe("t", (topic, payload) -> count.incrementAndGet());

            assertDoesNotThrow(() -> eventBus.publish("t", "x"));

            await().atMost(Duration.ofSeconds(2)).until(() -> count.get() == 1);
        }
    }

    @Test
    @DisplayName("shutdown 后不应有订阅者")
    void shutdownShouldClearSubscriptions() {
        eventBus.subscribe("t", (topic, payload) -> {
        });

        eventBus.shutdown();

        assertEquals(0, eventBus.getSubscriberCount("t"));
    }
}
