package org.edmap.density.dto;

import java.util.List;

/**
 * {@code density_sphere} 的返回结果。
 *
 * @param source       数据来源
 * @param center       球心（物理坐标）
 * @param radius       半径（Å）
 * @param cutoff       密度阈值（0=全部，&gt;0 取更高密度，&lt;0 取更低密度）
 * @param pointCount   满足条件的网格点总数
 * @param totalDensity 满足条件的网格点密度之和
 * @param truncated    返回的 points 是否被 maxPoints 截断
 * @param points       网格点明细（最多 maxPoints 条）
 * @param warnings     非致命告警
 */
public record SphereQueryResult(
        String source,
        List<Double> center,
        double radius,
        double cutoff,
        int pointCount,
        double totalDensity,
        boolean truncated,
        List<GridPoint> points,
        List<String> warnings
) {
}
