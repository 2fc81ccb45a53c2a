package com.musicfox.plugin.api.loader;

/**
 * 插件交付形式
 */
public enum LoaderKind {

    /**
     * 本地动态库
     */
    DYNAMIC("dynamic"),

    /**
     * 独立进程，经 RPC 通信
     */
    RPC("rpc"),

    /**
     * 沙箱字节码
     */
    WASM("wasm"),

    /**
     * 可热重载模块
     */
    HOT_RELOAD("hotreload");

    private final String value;

    LoaderKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 是否运行在沙箱中（卸载时需要拆除沙箱）
     */
    public boolean isSandboxed() {
        return this == WASM;
    }

    public static LoaderKind fromValue(String value) {
        for (LoaderKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown loader kind: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
