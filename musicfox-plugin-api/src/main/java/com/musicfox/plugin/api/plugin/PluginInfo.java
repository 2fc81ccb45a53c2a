package com.musicfox.plugin.api.plugin;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 插件元信息（加载后不可变）
 */
@Value
@Builder(toBuilder = true)
public class PluginInfo {

    /**
     * 插件声明的 ID，可为空（由管理器生成）
     */
    String id;

    String name;

    String version;

    String description;

    String author;

    /**
     * 业务类型，如 music_source、audio_processor
     */
    String type;

    String license;

    String homepage;

    @Singular
    List<String> tags;

    @Singular("configEntry")
    Map<String, String> config;

    Instant createdAt;
}
