package org.edmap.density.dto;

import java.util.List;

/**
 * 单个 blob 的聚合统计。
 *
 * @param pointCount   网格点数
 * @param totalDensity 密度总和
 * @param volume       体积（Å³）
 * @param centroid     密度加权质心
 * @param coordCenter  不加权几何中心
 */
public record BlobSummary(
        int pointCount,
        double totalDensity,
        double volume,
        List<Double> centroid,
        List<Double> coordCenter
) {
}
