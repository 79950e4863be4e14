package org.edmap.density.dto;

import java.util.List;

/**
 * {@code density_find_blobs} 的返回结果。
 *
 * @param source          数据来源
 * @param centerCount     查询中心数
 * @param radius          每个中心的搜索半径（Å）
 * @param cutoff          密度阈值
 * @param candidatePoints 去重后的候选网格点数
 * @param blobCount       提取（及合并）后的 blob 总数
 * @param truncated       blobs 是否被上限截断
 * @param blobs           按 |totalDensity| 降序排列的 blob
 * @param warnings        非致命告警
 */
public record BlobSearchResult(
        String source,
        int centerCount,
        double radius,
        double cutoff,
        int candidatePoints,
        int blobCount,
        boolean truncated,
        List<BlobSummary> blobs,
        List<String> warnings
) {
}
