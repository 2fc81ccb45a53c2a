/**
 * 插件可选实现的清理能力接口。
 * <p>
 * 卸载时编排器通过 {@code instanceof} 检查插件实例是否实现了这些接口，实现了才调用。
 */
package com.musicfox.plugin.api.cleanup;
