package org.edmap.density.dto;

import java.util.List;

/**
 * 单个网格点。
 */
public record GridPoint(
        List<Integer> crs,
        List<Double> xyz,
        double density
) {
}
