package com.musicfox.plugin.core.loader;

import com.musicfox.plugin.api.exception.InvalidArgumentException;
import com.musicfox.plugin.api.loader.LoaderKind;
import com.musicfox.plugin.api.loader.PluginLoader;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 加载器表：每种 {@link LoaderKind} 至多一个实现
 */
@Slf4j
public class LoaderRegistry {

    private final Map<LoaderKind, PluginLoader> loaders = new EnumMap<>(LoaderKind.class);

    public LoaderRegistry(Collection<? extends PluginLoader> loaders) {
        if (loaders != null) {
            for (PluginLoader loader : loaders) {
                register(loader);
            }
        }
    }

    private void register(PluginLoader loader) {
        LoaderKind kind = loader.getKind();
        if (kind == null) {
            throw new InvalidArgumentException("kind", "loader " + loader.getClass().getName() + " declares no kind");
        }
        PluginLoader previous = loaders.putIfAbsent(kind, loader);
        if (previous != null) {
            throw new InvalidArgumentException("kind", "duplicate loader for kind " + kind);
        }
        log.info("Registered {} loader: {}", kind, loader.getClass().getSimpleName());
    }

    public Optional<PluginLoader> select(LoaderKind kind) {
        return kind == null ? Optional.empty() : Optional.ofNullable(loaders.get(kind));
    }

    public Set<LoaderKind> registeredKinds() {
        return loaders.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(loaders.keySet()));
    }

    /**
     * 尚未注册加载器的交付形式
     */
    public Set<LoaderKind> missingKinds() {
        EnumSet<LoaderKind> missing = EnumSet.allOf(LoaderKind.class);
        missing.removeAll(loaders.keySet());
        return missing;
    }

    public boolean isComplete() {
        return missingKinds().isEmpty();
    }
}
