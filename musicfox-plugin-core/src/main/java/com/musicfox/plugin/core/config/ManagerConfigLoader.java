package com.musicfox.plugin.core.config;

import com.musicfox.plugin.api.exception.InvalidArgumentException;
import com.musicfox.plugin.api.security.Permission;
import com.musicfox.plugin.core.resource.EnforceMode;
import com.musicfox.plugin.core.resource.ResourceLimits;
import com.musicfox.plugin.core.security.SecurityConfig;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.InputStream;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 从 YAML 读取 {@link ManagerConfig}
 * <p>
 * 键名与字段同名（驼峰），时长以毫秒给出；缺省的键保持默认值。
 * <pre>
 * maxPlugins: 50
 * startTimeout: 5000
 * resourceLimits:
 *   maxMemoryMb: 128
 *   enforceMode: WARN
 * pluginSecurity:
 *   permissions: [EVENT_ACCESS, AUDIO_ACCESS]
 * </pre>
 */
@Slf4j
public class ManagerConfigLoader {

    public static ManagerConfig load(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions；只解析为基础类型，不实例化任意类
        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(options));

        Object root = yaml.load(inputStream);
        if (root == null) {
            return ManagerConfig.defaults();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new InvalidArgumentException("root", "manager config must be a YAML mapping");
        }
        ManagerConfig config = fromMap(map);
        config.validate();
        log.info("Manager config loaded: maxPlugins={}, security={}, monitoring={}",
                config.getMaxPlugins(), config.isEnableSecurity(), config.isEnableMonitoring());
        return config;
    }

    static ManagerConfig fromMap(Map<?, ?> map) {
        ManagerConfig.ManagerConfigBuilder builder = ManagerConfig.builder();
        ManagerConfig defaults = ManagerConfig.defaults();

        builder.maxPlugins(intValue(map, "maxPlugins", defaults.getMaxPlugins()));
        builder.loadTimeout(millis(map, "loadTimeout", defaults.getLoadTimeout()));
        builder.startTimeout(millis(map, "startTimeout", defaults.getStartTimeout()));
        builder.stopTimeout(millis(map, "stopTimeout", defaults.getStopTimeout()));
        builder.unloadTimeout(millis(map, "unloadTimeout", defaults.getUnloadTimeout()));
        builder.enableSecurity(boolValue(map, "enableSecurity", defaults.isEnableSecurity()));
        builder.enableMonitoring(boolValue(map, "enableMonitoring", defaults.isEnableMonitoring()));
        builder.healthCheckInterval(millis(map, "healthCheckInterval", defaults.getHealthCheckInterval()));
        builder.metricsInterval(millis(map, "metricsInterval", defaults.getMetricsInterval()));
        builder.resourceCheckInterval(millis(map, "resourceCheckInterval", defaults.getResourceCheckInterval()));
        builder.enableHotReload(boolValue(map, "enableHotReload", defaults.isEnableHotReload()));
        builder.watchInterval(millis(map, "watchInterval", defaults.getWatchInterval()));
        builder.maxRetries(intValue(map, "maxRetries", defaults.getMaxRetries()));
        builder.retryDelay(millis(map, "retryDelay", defaults.getRetryDelay()));
        builder.enableCircuitBreaker(boolValue(map, "enableCircuitBreaker", defaults.isEnableCircuitBreaker()));
        builder.circuitBreakerThreshold(intValue(map, "circuitBreakerThreshold", defaults.getCircuitBreakerThreshold()));
        builder.circuitBreakerRecoveryTimeout(millis(map, "circuitBreakerRecoveryTimeout",
                defaults.getCircuitBreakerRecoveryTimeout()));
        builder.enableGracefulShutdown(boolValue(map, "enableGracefulShutdown", defaults.isEnableGracefulShutdown()));
        builder.shutdownTimeout(millis(map, "shutdownTimeout", defaults.getShutdownTimeout()));
        builder.asyncQueueCapacity(intValue(map, "asyncQueueCapacity", defaults.getAsyncQueueCapacity()));

        Object tempDir = map.get("tempDir");
        if (tempDir != null) {
            builder.tempDir(Paths.get(tempDir.toString()));
        }

        Object limits = map.get("resourceLimits");
        if (limits instanceof Map<?, ?> limitsMap) {
            builder.resourceLimits(resourceLimits(limitsMap));
        }

        Object security = map.get("pluginSecurity");
        if (security instanceof Map<?, ?> securityMap) {
            builder.pluginSecurity(securityConfig(securityMap));
        }
        return builder.build();
    }

    private static ResourceLimits resourceLimits(Map<?, ?> map) {
        ResourceLimits defaults = ResourceLimits.defaults();
        ResourceLimits.ResourceLimitsBuilder builder = ResourceLimits.builder()
                .maxMemoryMb(longValue(map, "maxMemoryMb", defaults.getMaxMemoryMb()))
                .maxCpuPercent(doubleValue(map, "maxCpuPercent", defaults.getMaxCpuPercent()))
                .maxConcurrentTasks(intValue(map, "maxConcurrentTasks", defaults.getMaxConcurrentTasks()))
                .maxFileHandles(intValue(map, "maxFileHandles", defaults.getMaxFileHandles()))
                .maxConnections(intValue(map, "maxConnections", defaults.getMaxConnections()))
                .executionTimeout(millis(map, "executionTimeout", defaults.getExecutionTimeout()))
                .idleTimeout(millis(map, "idleTimeout", defaults.getIdleTimeout()));
        Object mode = map.get("enforceMode");
        if (mode != null) {
            try {
                builder.enforceMode(EnforceMode.valueOf(mode.toString().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new InvalidArgumentException("resourceLimits.enforceMode", "unknown enforce mode: " + mode);
            }
        }
        return builder.build();
    }

    private static SecurityConfig securityConfig(Map<?, ?> map) {
        SecurityConfig.SecurityConfigBuilder builder = SecurityConfig.builder();
        for (Object p : listValue(map, "permissions")) {
            try {
                builder.permission(Permission.valueOf(p.toString().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new InvalidArgumentException("pluginSecurity.permissions", "unknown permission: " + p);
            }
        }
        for (Object path : listValue(map, "allowedPaths")) {
            builder.allowedPath(path.toString());
        }
        builder.sandboxEnabled(boolValue(map, "sandboxEnabled", true));
        return builder.build();
    }

    // ==================== 类型转换 ====================

    private static int intValue(Map<?, ?> map, String key, int fallback) {
        Object value = map.get(key);
        return value == null ? fallback : number(key, value).intValue();
    }

    private static long longValue(Map<?, ?> map, String key, long fallback) {
        Object value = map.get(key);
        return value == null ? fallback : number(key, value).longValue();
    }

    private static double doubleValue(Map<?, ?> map, String key, double fallback) {
        Object value = map.get(key);
        return value == null ? fallback : number(key, value).doubleValue();
    }

    private static boolean boolValue(Map<?, ?> map, String key, boolean fallback) {
        Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private static Duration millis(Map<?, ?> map, String key, Duration fallback) {
        Object value = map.get(key);
        return value == null ? fallback : Duration.ofMillis(number(key, value).longValue());
    }

    private static List<?> listValue(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw new InvalidArgumentException(key, "must be a list");
    }

    private static Number number(String key, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(key, "not a number: " + value);
        }
    }
}
