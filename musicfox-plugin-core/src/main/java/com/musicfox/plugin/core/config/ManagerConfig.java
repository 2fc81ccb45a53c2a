package com.musicfox.plugin.core.config;

import com.musicfox.plugin.api.exception.InvalidArgumentException;
import com.musicfox.plugin.core.resource.ResourceLimits;
import com.musicfox.plugin.core.security.SecurityConfig;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * 插件编排器配置
 * <p>
 * 作为编排器的唯一配置入口；可由 {@link ManagerConfigLoader} 从 YAML 构建。
 */
@Data
@Builder(toBuilder = true)
@ToString
public class ManagerConfig {

    // ================= 容量与超时 =================

    @Builder.Default
    private int maxPlugins = 100;

    @Builder.Default
    private Duration loadTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private Duration startTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private Duration stopTimeout = Duration.ofSeconds(10);

    /**
     * 卸载默认超时（Cleanup 调用）
     */
    @Builder.Default
    private Duration unloadTimeout = Duration.ofSeconds(30);

    // ================= 安全 =================

    @Builder.Default
    private boolean enableSecurity = true;

    /**
     * 新加载插件获得的默认安全配置
     */
    @Builder.Default
    private SecurityConfig pluginSecurity = SecurityConfig.defaults();

    // ================= 资源与监控 =================

    @Builder.Default
    private ResourceLimits resourceLimits = ResourceLimits.defaults();

    @Builder.Default
    private Duration resourceCheckInterval = Duration.ofSeconds(5);

    @Builder.Default
    private boolean enableMonitoring = true;

    @Builder.Default
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    @Builder.Default
    private Duration metricsInterval = Duration.ofSeconds(10);

    // ================= 热重载 =================

    @Builder.Default
    private boolean enableHotReload = false;

    @Builder.Default
    private Duration watchInterval = Duration.ofSeconds(1);

    // ================= 重试与熔断 =================

    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private Duration retryDelay = Duration.ofSeconds(2);

    @Builder.Default
    private boolean enableCircuitBreaker = true;

    @Builder.Default
    private int circuitBreakerThreshold = 5;

    @Builder.Default
    private Duration circuitBreakerRecoveryTimeout = Duration.ofSeconds(60);

    // ================= 关闭与队列 =================

    @Builder.Default
    private boolean enableGracefulShutdown = true;

    @Builder.Default
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * 异步启动/停止请求队列容量
     */
    @Builder.Default
    private int asyncQueueCapacity = 100;

    /**
     * 插件临时文件/缓存根目录
     */
    @Builder.Default
    private Path tempDir = Paths.get(System.getProperty("java.io.tmpdir"), "musicfox", "plugins");

    public static ManagerConfig defaults() {
        return ManagerConfig.builder().build();
    }

    public void validate() {
        if (maxPlugins <= 0) {
            throw new InvalidArgumentException("maxPlugins", "must be positive");
        }
        requirePositive("loadTimeout", loadTimeout);
        requirePositive("startTimeout", startTimeout);
        requirePositive("stopTimeout", stopTimeout);
        requirePositive("unloadTimeout", unloadTimeout);
        requirePositive("healthCheckInterval", healthCheckInterval);
        requirePositive("metricsInterval", metricsInterval);
        requirePositive("resourceCheckInterval", resourceCheckInterval);
        if (maxRetries < 0) {
            throw new InvalidArgumentException("maxRetries", "must not be negative");
        }
        if (circuitBreakerThreshold <= 0) {
            throw new InvalidArgumentException("circuitBreakerThreshold", "must be positive");
        }
        if (asyncQueueCapacity <= 0) {
            throw new InvalidArgumentException("asyncQueueCapacity", "must be positive");
        }
        if (resourceLimits == null) {
            throw new InvalidArgumentException("resourceLimits", "must not be null");
        }
        resourceLimits.validate();
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new InvalidArgumentException(field, "must be a positive duration");
        }
    }
}
