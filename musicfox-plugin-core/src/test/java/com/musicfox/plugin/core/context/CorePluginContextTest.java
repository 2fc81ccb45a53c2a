package com.musicfox.plugin.core.context;

import com.musicfox.plugin.api.context.PluginContext;
import com.musicfox.plugin.api.exception.PermissionDeniedException;
import com.musicfox.plugin.api.exception.PluginException;
import com.musicfox.plugin.api.security.Permission;
import com.musicfox.plugin.core.event.EventBus;
import com.musicfox.plugin.core.security.DefaultSecurityManager;
import com.musicfox.plugin.core.security.SecurityConfig;
import com.musicfox.plugin.core.service.ServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CorePluginContext 单元测试")
public class CorePluginContextTest {

    private static final String PLUGIN_ID = "lyric";

    @Mock
    private EventBus eventBus;

    private ServiceRegistry serviceRegistry;

    @BeforeEach
    void setUp() {
        serviceRegistry = new ServiceRegistry();
    }

    @Nested
    @DisplayName("权限放行")
    class GrantedTests {

        private CorePluginContext context;

        @BeforeEach
        void setUp() {
            context = context(SecurityConfig.defaults());
        }

        @Test
        @DisplayName("sendMessage 转发到事件总线")
        void sendMessageShouldPublish() {
            context.sendMessage("plugin.lyric.ready", "song-1");

            verify(eventBus).publish("plugin.lyric.ready", "song-1");
        }

        @Test
        @DisplayName("subscribe 以插件 ID 作为归属订阅")
        void subscribeShouldRegisterOwner() {
            PluginContext.Subscription subscription = context.subscribe("player.song.changed", (t, p) -> {
            });

            verify(eventBus).subscribe(eq("player.song.changed"), any(), eq(PLUGIN_ID));
            assertEquals(1, context.getSubscriptionCount());

            subscription.unsubscribe();
            verify(eventBus).unsubscribe(eq("player.song.changed"), any());
            assertEquals(0, context.getSubscriptionCount());
        }

        @Test
        @DisplayName("getService 从注册表查找")
        void getServiceShouldLookup() {
            serviceRegistry.registerService("plugin.scrobbler", "scrobbler");

            assertEquals("scrobbler", context.getService("plugin.scrobbler", String.class).orElseThrow());
            assertTrue(context.getService("plugin.none", String.class).isEmpty());
        }

        @Test
        @DisplayName("getConfig 返回只读配置")
        void getConfigShouldBeReadOnly() {
            Map<String, Object> config = context.getConfig();

            assertEquals("zh", config.get("lang"));
            assertThrows(UnsupportedOperationException.class, () -> config.put("x", "y"));
        }

        @Test
        @DisplayName("空主题被拒绝")
        void blankTopicShouldBeRejected() {
            assertThrows(IllegalArgumentException.class, () -> context.sendMessage(" ", null));
        }
    }

    @Nested
    @DisplayName("权限拒绝")
    class DeniedTests {

        private CorePluginContext context;

        @BeforeEach
        void setUp() {
            context = context(SecurityConfig.builder().permission(Permission.AUDIO_ACCESS).build());
        }

        @Test
        @DisplayName("缺少 EVENT_ACCESS 时不能收发消息")
        void eventAccessShouldBeRequired() {
            assertThrows(PermissionDeniedException.class, () -> context.sendMessage("t", null));
            assertThrows(PermissionDeniedException.class, () -> context.subscribe("t", (t, p) -> {
            }));
            verifyNoInteractions(eventBus);
        }

        @Test
        @DisplayName("缺少 SERVICE_ACCESS 时不能获取服务")
        void serviceAccessShouldBeRequired() {
            PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
                    () -> context.getService("plugin.scrobbler", Object.class));
            assertEquals(PLUGIN_ID, e.getPluginId());
        }

        @Test
        @DisplayName("缺少 CONFIG_ACCESS 时不能读取配置")
        void configAccessShouldBeRequired() {
            assertThrows(PermissionDeniedException.class, () -> context.getConfig());
        }
    }

    @Test
    @DisplayName("cleanup 撤销全部订阅并关闭上下文")
    void cleanupShouldUnsubscribeAndClose() {
        CorePluginContext context = context(SecurityConfig.defaults());
        context.subscribe("a", (t, p) -> {
        });
        context.subscribe("b", (t, p) -> {
        });

        context.cleanup();
        context.cleanup();

        verify(eventBus, times(2)).unsubscribe(any(), any());
        assertTrue(context.isClosed());
        assertEquals(0, context.getSubscriptionCount());
        assertThrows(PluginException.class, () -> context.sendMessage("a", null));
    }

    // ==================== 辅助方法 ====================

    private CorePluginContext context(SecurityConfig securityConfig) {
        return new CorePluginContext(PLUGIN_ID, Map.of("lang", "zh"), Paths.get("/tmp/lyric"), eventBus,
                serviceRegistry, new DefaultSecurityManager(PLUGIN_ID, securityConfig));
    }
}
