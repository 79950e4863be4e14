package org.edmap.density.dto;

import java.util.List;

/**
 * {@code density_point} 的返回结果。
 *
 * @param source     数据来源
 * @param xyz        查询的物理坐标
 * @param crs        换算得到的网格坐标（未回绕）
 * @param wrappedCrs 周期回绕后的网格坐标（无数据时为 null）
 * @param valid      该位置是否有密度数据
 * @param density    密度值（无数据时为 0）
 * @param warnings   非致命告警
 */
public record PointDensityResult(
        String source,
        List<Double> xyz,
        List<Integer> crs,
        List<Integer> wrappedCrs,
        boolean valid,
        double density,
        List<String> warnings
) {
}
