package org.edmap.density.map;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 三维密度网格（按 {@code [section][row][column]} 索引），构造后只读。
 * <p>
 * 查询语义：
 * <ul>
 *   <li>点查询：坐标先做周期回绕；回绕后仍无数据的位置返回 0（视为“无异常”，不是错误）。</li>
 *   <li>球查询：在包围盒内枚举网格点，同时满足密度阈值与距离条件的点被保留。</li>
 * </ul>
 * 均值/标准差在首次访问时计算一次，之后复用。
 */
public final class DensityGrid {

    private final DensityHeader header;
    private final float[][][] density;
    private final int voxelCount;

    private final Object statisticsLock = new Object();
    private volatile boolean statisticsComputed;
    private double meanDensity;
    private double stdDensity;

    private DensityGrid(DensityHeader header, float[][][] density) {
        this.header = header;
        this.density = density;
        int[] ncrs = header.ncrsRef();
        this.voxelCount = ncrs[0] * ncrs[1] * ncrs[2];
    }

    /**
     * 把解码后的一维 float 数组（column 最快、section 最慢）重排为三维网格。
     */
    public static DensityGrid fromFlat(DensityHeader header, float[] values) {
        int[] ncrs = header.ncrsRef();
        long expected = (long) ncrs[0] * ncrs[1] * ncrs[2];
        if (values.length != expected) {
            throw new IllegalArgumentException("密度值数量与网格尺寸不一致：" + values.length + "（需要 " + expected + "）");
        }
        float[][][] grid = new float[ncrs[2]][ncrs[1]][ncrs[0]];
        int index = 0;
        for (int s = 0; s < ncrs[2]; s++) {
            for (int r = 0; r < ncrs[1]; r++) {
                System.arraycopy(values, index, grid[s][r], 0, ncrs[0]);
                index += ncrs[0];
            }
        }
        return new DensityGrid(header, grid);
    }

    public DensityHeader header() {
        return header;
    }

    public CoordinateSystem coordinateSystem() {
        return header.coordinateSystem();
    }

    public int voxelCount() {
        return voxelCount;
    }

    public float valueAt(int column, int row, int section) {
        return density[section][row][column];
    }

    public float pointDensity(GridCoord crs) {
        WrappedCoord wrapped = header.coordinateSystem().validateAndWrap(crs);
        if (!wrapped.valid()) {
            return 0.0f;
        }
        GridCoord c = wrapped.coord();
        return density[c.section()][c.row()][c.column()];
    }

    public float pointDensity(XyzCoord xyz) {
        return pointDensity(header.coordinateSystem().xyzToCrs(xyz));
    }

    /**
     * 球查询：返回距 {@code center} 不超过 {@code radius} 且满足密度阈值的网格坐标（未回绕的原始坐标）。
     * <p>
     * 阈值规则：cutoff=0 保留全部；cutoff&gt;0 保留 density&gt;cutoff；cutoff&lt;0 保留 density&lt;cutoff。
     * 多个中心的结果需要由调用方按坐标去重合并。
     *
     * @throws IllegalArgumentException 包围盒的网格下标超出 int 范围
     */
    public Set<GridCoord> sphereQuery(XyzCoord center, double radius, double cutoff) {
        CoordinateSystem cs = header.coordinateSystem();
        GridCoord centerCrs = cs.xyzToCrs(center);
        GridCoord radiusCrs = cs.xyzToCrs(header.origin().plus(radius, radius, radius));

        // 包围盒按 long 计算，越出 int 范围直接拒绝，保证枚举循环有界
        long[] lo = new long[3];
        long[] hi = new long[3];
        for (int axis = 0; axis < 3; axis++) {
            long extent = Math.abs((long) radiusCrs.get(axis));
            lo[axis] = centerCrs.get(axis) - extent - 1;
            hi[axis] = centerCrs.get(axis) + extent + 1;
            if (lo[axis] < Integer.MIN_VALUE || hi[axis] > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("球查询范围超出可枚举的网格下标：center=" + center + ", radius=" + radius);
            }
        }

        Set<GridCoord> result = new LinkedHashSet<>();
        for (long c = lo[0]; c <= hi[0]; c++) {
            for (long r = lo[1]; r <= hi[1]; r++) {
                for (long s = lo[2]; s <= hi[2]; s++) {
                    GridCoord crs = new GridCoord((int) c, (int) r, (int) s);
                    if (!passesCutoff(pointDensity(crs), cutoff)) {
                        continue;
                    }
                    if (cs.crsToXyz(crs).distanceTo(center) <= radius) {
                        result.add(crs);
                    }
                }
            }
        }
        return result;
    }

    /**
     * 球内（满足阈值的）密度总和。
     */
    public double totalDensity(XyzCoord center, double radius, double cutoff) {
        double total = 0.0;
        for (GridCoord crs : sphereQuery(center, radius, cutoff)) {
            total += pointDensity(crs);
        }
        return total;
    }

    static boolean passesCutoff(double density, double cutoff) {
        return cutoff == 0.0
                || (cutoff > 0.0 && density > cutoff)
                || (cutoff < 0.0 && density < cutoff);
    }

    public double meanDensity() {
        ensureStatistics();
        return meanDensity;
    }

    /** 总体标准差（除以 N）。 */
    public double stdDensity() {
        ensureStatistics();
        return stdDensity;
    }

    private void ensureStatistics() {
        if (statisticsComputed) {
            return;
        }
        synchronized (statisticsLock) {
            if (statisticsComputed) {
                return;
            }
            double sum = 0.0;
            for (float[][] section : density) {
                for (float[] row : section) {
                    for (float value : row) {
                        sum += value;
                    }
                }
            }
            double mean = voxelCount == 0 ? Double.NaN : sum / voxelCount;
            double squares = 0.0;
            for (float[][] section : density) {
                for (float[] row : section) {
                    for (float value : row) {
                        double d = value - mean;
                        squares += d * d;
                    }
                }
            }
            meanDensity = mean;
            stdDensity = voxelCount == 0 ? Double.NaN : Math.sqrt(squares / voxelCount);
            statisticsComputed = true;
        }
    }
}
