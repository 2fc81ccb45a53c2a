package com.musicfox.plugin.core.manager;

@FunctionalInterface
public interface UnloadProgressListener {

    void onProgress(UnloadProgress progress);
}
