package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.loader.LoaderKind;
import com.musicfox.plugin.api.loader.PluginLoader;
import com.musicfox.plugin.api.plugin.Plugin;
import com.musicfox.plugin.api.plugin.PluginInfo;
import com.musicfox.plugin.api.plugin.PluginState;

import java.util.List;

/**
 * 为其它包的测试构造受管插件
 */
public final class ManagedPlugins {

    private ManagedPlugins() {
    }

    public static ManagedPlugin create(String id, LoaderKind kind, Plugin plugin, PluginLoader loader,
                                       String... dependencies) {
        PluginInfo info = plugin.getInfo() != null ? plugin.getInfo()
                : PluginInfo.builder().id(id).name(id).version("1.0.0").build();
        return new ManagedPlugin(id, "/plugins/" + id + ".so", kind, plugin, loader, info, List.of(dependencies));
    }

    public static ManagedPlugin inState(ManagedPlugin managed, PluginState state) {
        managed.forceState(state);
        return managed;
    }
}
