package org.edmap.density.dto;

import java.util.List;

/**
 * {@code density_statistics} 的返回结果。
 * <p>
 * 计算值来自全部体素；header* 为文件头部声明的值，二者可能不一致。
 */
public record MapStatisticsResult(
        String source,
        int voxelCount,
        double mean,
        double std,
        double headerMin,
        double headerMax,
        double headerMean,
        double headerRms,
        List<String> warnings
) {
}
