package org.edmap.density.map;

/**
 * 网格索引坐标（crs）与物理坐标（xyz）之间的换算，以及周期性回绕校验。
 * <p>
 * 三个晶胞角都为 90° 时走正交快速路径（逐轴线性换算）；否则使用完整的正交化/反正交化矩阵。
 * 本类无状态（仅持有不可变头部），线程安全。
 */
public final class CoordinateSystem {

    private final DensityHeader header;

    CoordinateSystem(DensityHeader header) {
        this.header = header;
    }

    public XyzCoord crsToXyz(GridCoord crs) {
        int[] map2xyz = header.map2xyzRef();
        if (header.isOrthogonal()) {
            double[] spacing = header.gridSpacingRef();
            XyzCoord origin = header.origin();
            return new XyzCoord(
                    crs.get(map2xyz[0]) * spacing[0] + origin.x(),
                    crs.get(map2xyz[1]) * spacing[1] + origin.y(),
                    crs.get(map2xyz[2]) * spacing[2] + origin.z()
            );
        }
        int[] crsStart = header.crsStartRef();
        int[] intervals = header.intervalsRef();
        double[] fractional = new double[3];
        for (int i = 0; i < 3; i++) {
            int crsAxis = map2xyz[i];
            fractional[i] = (double) (crs.get(crsAxis) + crsStart[crsAxis]) / intervals[i];
        }
        return XyzCoord.of(DensityHeader.multiply(header.orthoMatrixRef(), fractional));
    }

    /**
     * 物理坐标换算为最近的网格点。取整采用“四舍六入五成双”（{@link Math#rint}）。
     *
     * @throws IllegalArgumentException 坐标不是有限值，或换算出的网格下标超出 int 范围
     */
    public GridCoord xyzToCrs(XyzCoord xyz) {
        int[] gridPos = new int[3];
        if (header.isOrthogonal()) {
            double[] spacing = header.gridSpacingRef();
            XyzCoord origin = header.origin();
            for (int i = 0; i < 3; i++) {
                gridPos[i] = toIndex(Math.rint((xyz.get(i) - origin.get(i)) / spacing[i]), xyz);
            }
        } else {
            double[] fraction = DensityHeader.multiply(header.deOrthoMatrixRef(), xyz.toArray());
            int[] intervals = header.intervalsRef();
            int[] crsStart = header.crsStartRef();
            int[] map2xyz = header.map2xyzRef();
            for (int i = 0; i < 3; i++) {
                gridPos[i] = toIndex(Math.rint(fraction[i] * intervals[i]) - crsStart[map2xyz[i]], xyz);
            }
        }
        int[] map2crs = header.map2crsRef();
        return new GridCoord(gridPos[map2crs[0]], gridPos[map2crs[1]], gridPos[map2crs[2]]);
    }

    /**
     * 取整后的网格下标，必须落在 int 范围内。
     */
    static int toIndex(double index, XyzCoord xyz) {
        if (Double.isNaN(index) || index < Integer.MIN_VALUE || index > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("坐标超出可换算的网格范围：" + xyz);
        }
        return (int) index;
    }

    /**
     * 周期性回绕并校验坐标是否有数据。
     * <p>
     * 对每个轴：坐标不在 {@code [0, extent)} 内时减去 {@code floor(coord/interval)*interval}；
     * 回绕后若仍落在 {@code [extent, interval)} 内，则该位置没有密度数据。
     */
    public WrappedCoord validateAndWrap(GridCoord crs) {
        int[] ncrs = header.ncrsRef();
        int[] crsInterval = header.crsIntervalRef();
        int[] wrapped = crs.toArray();
        for (int axis = 0; axis < 3; axis++) {
            int value = wrapped[axis];
            if (value < 0 || value >= ncrs[axis]) {
                if (crsInterval[axis] <= 0) {
                    return new WrappedCoord(crs, false);
                }
                value -= Math.floorDiv(value, crsInterval[axis]) * crsInterval[axis];
                wrapped[axis] = value;
            }
            // TODO: 确认是否应统一改为与 uniqueExtent 比较（extent > interval 时未回绕的坐标不受此约束）
            if (ncrs[axis] <= value && value < crsInterval[axis]) {
                return new WrappedCoord(crs, false);
            }
        }
        return new WrappedCoord(GridCoord.of(wrapped), true);
    }
}
