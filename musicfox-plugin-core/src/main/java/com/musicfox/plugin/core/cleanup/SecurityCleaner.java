package com.musicfox.plugin.core.cleanup;

import com.musicfox.plugin.api.cleanup.EncryptionKeyCleaner;
import com.musicfox.plugin.api.cleanup.SandboxCleaner;
import com.musicfox.plugin.api.cleanup.SensitiveDataCleaner;
import com.musicfox.plugin.core.context.CorePluginContext;
import com.musicfox.plugin.core.manager.ManagedPlugin;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 安全清理
 * <p>
 * 擦除敏感元数据、拆除安全上下文、撤销权限、擦除密钥、拆除沙箱（仅沙箱类加载器）。
 */
@Slf4j
public class SecurityCleaner {

    public static final String STAGE_SENSITIVE_DATA = "sensitive_data";
    public static final String STAGE_SECURITY_CONTEXT = "security_context";
    public static final String STAGE_PERMISSIONS = "permissions";
    public static final String STAGE_ENCRYPTION_KEYS = "encryption_keys";
    public static final String STAGE_SANDBOX = "sandbox";

    private static final List<String> SENSITIVE_MARKERS = List.of("password", "token", "key", "secret", "credential");

    public CleanupReport cleanup(@NonNull ManagedPlugin managed) {
        String pluginId = managed.getId();
        log.debug("[{}] Starting secure cleanup", pluginId);

        List<CleanupReport.StageFailure> failures = new ArrayList<>();
        try {
            scrubSensitiveMetadata(managed);
            if (managed.getPlugin() instanceof SensitiveDataCleaner cleaner) {
                cleaner.cleanupSensitiveData();
            }
        } catch (Throwable e) {
            failures.add(new CleanupReport.StageFailure(STAGE_SENSITIVE_DATA, e));
        }

        CorePluginContext context = managed.getContext();
        try {
            if (context != null) {
                context.cleanup();
            }
        } catch (Throwable e) {
            failures.add(new CleanupReport.StageFailure(STAGE_SECURITY_CONTEXT, e));
        }

        try {
            if (context != null) {
                context.getSecurityManager().cleanup();
            }
            managed.setContext(null);
        } catch (Throwable e) {
            failures.add(new CleanupReport.StageFailure(STAGE_PERMISSIONS, e));
        }

        try {
            if (managed.getPlugin() instanceof EncryptionKeyCleaner cleaner) {
                cleaner.cleanupEncryptionKeys();
            }
        } catch (Throwable e) {
            failures.add(new CleanupReport.StageFailure(STAGE_ENCRYPTION_KEYS, e));
        }

        try {
            if (managed.getKind().isSandboxed() && managed.getPlugin() instanceof SandboxCleaner cleaner) {
                cleaner.cleanupSandbox();
            }
        } catch (Throwable e) {
            failures.add(new CleanupReport.StageFailure(STAGE_SANDBOX, e));
        }

        for (CleanupReport.StageFailure failure : failures) {
            log.warn("[{}] Secure cleanup stage {} failed: {}", pluginId, failure.stage(), failure.error().getMessage());
        }
        return new CleanupReport(pluginId, failures);
    }

    private void scrubSensitiveMetadata(ManagedPlugin managed) {
        int removed = 0;
        for (String key : List.copyOf(managed.getMetadata().keySet())) {
            if (isSensitive(key)) {
                managed.getMetadata().remove(key);
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[{}] Scrubbed {} sensitive metadata entries", managed.getId(), removed);
        }
    }

    static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_MARKERS.stream().anyMatch(lower::contains);
    }
}
