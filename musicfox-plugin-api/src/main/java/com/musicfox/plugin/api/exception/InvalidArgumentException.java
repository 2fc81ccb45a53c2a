package com.musicfox.plugin.api.exception;

import lombok.Getter;

/**
 * 参数/配置错误
 * 立即失败，不参与重试。
 */
@Getter
public class InvalidArgumentException extends PluginException {

    private final String field;

    public InvalidArgumentException(String field, String message) {
        super(message);
        this.field = field;
    }
}
