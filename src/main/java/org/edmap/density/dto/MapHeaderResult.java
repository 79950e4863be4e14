package org.edmap.density.dto;

import java.util.List;

/**
 * {@code density_read_header} 的返回结果：头部原始字段 + 派生参数。
 *
 * @param source         数据来源
 * @param cached         是否来自缓存
 * @param byteOrder      推断出的字节序
 * @param mode           数据类型（2 = 32 位实数）
 * @param ncrs           列/行/层网格点数
 * @param crsStart       列/行/层起始索引
 * @param intervals      x/y/z 晶轴间隔数
 * @param cellLengths    晶胞边长（Å）
 * @param cellAngles     晶胞角（°）
 * @param axisMapping    col2xyz/row2xyz/sec2xyz
 * @param spaceGroup     空间群编号
 * @param symmetryBytes  对称性记录字节数
 * @param densityMin     头部声明的最小密度
 * @param densityMax     头部声明的最大密度
 * @param densityMean    头部声明的平均密度
 * @param rms            头部声明的均方根偏差
 * @param gridSpacing    x/y/z 网格间距（Å）
 * @param origin         物理坐标原点
 * @param unitVolume     单个体素体积（Å³）
 * @param uniqueExtent   用于周期回绕校验的 unique extent
 * @param orthogonal     三个晶胞角是否都为 90°
 * @param mapId          MAP 标识字符
 * @param labels         标签文本（已去除空格）
 * @param warnings       非致命告警（默认值修正等）
 */
public record MapHeaderResult(
        String source,
        boolean cached,
        String byteOrder,
        int mode,
        List<Integer> ncrs,
        List<Integer> crsStart,
        List<Integer> intervals,
        List<Double> cellLengths,
        List<Double> cellAngles,
        List<Integer> axisMapping,
        int spaceGroup,
        int symmetryBytes,
        double densityMin,
        double densityMax,
        double densityMean,
        double rms,
        List<Double> gridSpacing,
        List<Double> origin,
        double unitVolume,
        List<Integer> uniqueExtent,
        boolean orthogonal,
        String mapId,
        String labels,
        List<String> warnings
) {
}
