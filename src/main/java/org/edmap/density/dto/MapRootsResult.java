package org.edmap.density.dto;

import java.util.List;

/**
 * {@code density_list_roots} 的返回结果。
 *
 * @param roots          允许读取本地密度图的根目录
 * @param remoteEnabled  是否允许按 URL/PDB id 下载
 * @param pdbUrlTemplate 按 PDB id 下载时使用的地址模板（{@code {id}} 为小写 PDB id）
 */
public record MapRootsResult(
        List<MapRoot> roots,
        boolean remoteEnabled,
        String pdbUrlTemplate
) {
}
