package org.edmap.density.dto;

/**
 * 允许读取密度图的根目录。
 *
 * @param rootId 根目录标识（root0、root1...）
 * @param path   规范化后的绝对路径
 */
public record MapRoot(String rootId, String path) {
}
