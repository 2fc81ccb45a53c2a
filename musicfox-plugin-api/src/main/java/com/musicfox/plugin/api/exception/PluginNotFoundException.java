package com.musicfox.plugin.api.exception;

public class PluginNotFoundException extends PluginException {

    public PluginNotFoundException(String pluginId) {
        super(pluginId, "plugin not found: " + pluginId, null);
    }
}
