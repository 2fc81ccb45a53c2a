package com.musicfox.plugin.core.resource;

/**
 * 一次资源超限记录
 *
 * @param pluginId 插件 ID
 * @param resource 维度名（memory/cpu/tasks/file_handles/connections）
 * @param current  当前值
 * @param limit    限额
 * @param mode     生效的处置策略
 */
public record LimitViolation(String pluginId, String resource, Number current, Number limit, EnforceMode mode) {
}
