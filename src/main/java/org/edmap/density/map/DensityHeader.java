package org.edmap.density.map;

import java.util.List;

/**
 * 密度图（CCP4/MRC）头部：原始字段 + 一次性计算好的派生参数。
 * <p>
 * 派生参数包括：
 * <ul>
 *   <li>数据体字节数 {@code mapSize} 与各轴网格间距</li>
 *   <li>列/行/层与 x/y/z 之间的下标置换 {@code map2xyz}/{@code map2crs}</li>
 *   <li>单个体素体积（三斜晶胞公式）</li>
 *   <li>正交化矩阵及其逆矩阵（绝对值小于 1e-10 的元素清零）</li>
 *   <li>物理坐标原点与用于周期回绕校验的 unique extent</li>
 * </ul>
 * <p>
 * 对象构造后不可变，可被多个线程并发读取。
 */
public final class DensityHeader {

    static final double DEORTHO_SNAP = 1e-10;

    private final Fields fields;
    private final MapByteOrder byteOrder;
    private final List<String> warnings;

    private final long mapSize;
    private final double[] gridSpacing;
    private final int[] map2xyz;
    private final int[] map2crs;
    private final int[] crsInterval;
    private final double unitVolume;
    private final double[][] orthoMatrix;
    private final double[][] deOrthoMatrix;
    private final XyzCoord origin;
    private final int[] uniqueExtent;
    private final boolean orthogonal;
    private final CoordinateSystem coordinateSystem;

    DensityHeader(Fields fields, MapByteOrder byteOrder, List<String> warnings) {
        this.fields = fields;
        this.byteOrder = byteOrder;
        this.warnings = List.copyOf(warnings);

        int[] ncrs = fields.ncrs();
        int[] intervals = fields.intervals();
        float[] lengths = fields.cellLengths();
        float[] angles = fields.cellAngles();

        this.mapSize = (long) ncrs[0] * ncrs[1] * ncrs[2] * 4L;

        this.gridSpacing = new double[3];
        for (int i = 0; i < 3; i++) {
            gridSpacing[i] = (double) lengths[i] / intervals[i];
        }

        // map2xyz[xyz 轴] = 对应的 crs 下标；map2crs[crs 轴] = 对应的 xyz 下标
        int[] axisMapping = fields.axisMapping();
        this.map2xyz = new int[3];
        this.map2crs = new int[3];
        for (int crsAxis = 0; crsAxis < 3; crsAxis++) {
            int xyzAxis = axisMapping[crsAxis] - 1;
            map2xyz[xyzAxis] = crsAxis;
            map2crs[crsAxis] = xyzAxis;
        }

        this.crsInterval = new int[3];
        for (int crsAxis = 0; crsAxis < 3; crsAxis++) {
            crsInterval[crsAxis] = intervals[map2crs[crsAxis]];
        }

        double alpha = Math.toRadians(angles[0]);
        double beta = Math.toRadians(angles[1]);
        double gamma = Math.toRadians(angles[2]);
        double cosA = Math.cos(alpha);
        double cosB = Math.cos(beta);
        double cosG = Math.cos(gamma);
        double sinG = Math.sin(gamma);
        double volumeFactor = Math.sqrt(1 - cosA * cosA - cosB * cosB - cosG * cosG + 2 * cosA * cosB * cosG);

        this.unitVolume = (double) lengths[0] * lengths[1] * lengths[2]
                / intervals[0] / intervals[1] / intervals[2] * volumeFactor;

        // 分数坐标 -> 正交坐标（Rupp, Biomolecular Crystallography, p233）
        this.orthoMatrix = new double[][]{
                {lengths[0], lengths[1] * cosG, lengths[2] * cosB},
                {0.0, lengths[1] * sinG, lengths[2] * (cosA - cosB * cosG) / sinG},
                {0.0, 0.0, lengths[2] * volumeFactor / sinG}
        };
        this.deOrthoMatrix = invert(orthoMatrix);
        for (double[] row : deOrthoMatrix) {
            for (int j = 0; j < 3; j++) {
                if (Math.abs(row[j]) < DEORTHO_SNAP) {
                    row[j] = 0.0;
                }
            }
        }

        this.orthogonal = angles[0] == 90.0f && angles[1] == 90.0f && angles[2] == 90.0f;
        this.origin = calculateOrigin();

        this.uniqueExtent = ncrs.clone();
        for (int crsAxis = 0; crsAxis < 3; crsAxis++) {
            if (crsInterval[crsAxis] < ncrs[crsAxis]) {
                uniqueExtent[crsAxis] = crsInterval[crsAxis];
            }
        }

        this.coordinateSystem = new CoordinateSystem(this);
    }

    private XyzCoord calculateOrigin() {
        float[] futureUse = fields.futureUse();
        int n = futureUse.length;
        if (futureUse[n - 3] == 0.0f && futureUse[n - 2] == 0.0f && futureUse[n - 1] == 0.0f) {
            double[] fractional = new double[3];
            for (int i = 0; i < 3; i++) {
                fractional[i] = (double) fields.crsStart()[map2xyz[i]] / fields.intervals()[i];
            }
            return XyzCoord.of(multiply(orthoMatrix, fractional));
        }
        float[] override = fields.originOverride();
        return new XyzCoord(override[0], override[1], override[2]);
    }

    static double[] multiply(double[][] matrix, double[] vector) {
        double[] out = new double[3];
        for (int i = 0; i < 3; i++) {
            out[i] = matrix[i][0] * vector[0] + matrix[i][1] * vector[1] + matrix[i][2] * vector[2];
        }
        return out;
    }

    private static double[][] invert(double[][] m) {
        double c00 = m[1][1] * m[2][2] - m[1][2] * m[2][1];
        double c01 = m[1][2] * m[2][0] - m[1][0] * m[2][2];
        double c02 = m[1][0] * m[2][1] - m[1][1] * m[2][0];
        double det = m[0][0] * c00 + m[0][1] * c01 + m[0][2] * c02;
        if (det == 0.0 || !Double.isFinite(det)) {
            throw new MapFormatException(MapFormatException.Reason.DEGENERATE_CELL,
                    "晶胞参数退化，正交化矩阵不可逆（det=" + det + "）");
        }
        double inv = 1.0 / det;
        return new double[][]{
                {c00 * inv, (m[0][2] * m[2][1] - m[0][1] * m[2][2]) * inv, (m[0][1] * m[1][2] - m[0][2] * m[1][1]) * inv},
                {c01 * inv, (m[0][0] * m[2][2] - m[0][2] * m[2][0]) * inv, (m[0][2] * m[1][0] - m[0][0] * m[1][2]) * inv},
                {c02 * inv, (m[0][1] * m[2][0] - m[0][0] * m[2][1]) * inv, (m[0][0] * m[1][1] - m[0][1] * m[1][0]) * inv}
        };
    }

    // ---- 原始字段 ----

    public MapByteOrder byteOrder() {
        return byteOrder;
    }

    /** 列/行/层三个方向的网格点数。 */
    public int[] ncrs() {
        return fields.ncrs().clone();
    }

    public int mode() {
        return fields.mode();
    }

    public int[] crsStart() {
        return fields.crsStart().clone();
    }

    /** x/y/z 晶轴方向的间隔数。 */
    public int[] intervals() {
        return fields.intervals().clone();
    }

    public float[] cellLengths() {
        return fields.cellLengths().clone();
    }

    public float[] cellAngles() {
        return fields.cellAngles().clone();
    }

    /** col2xyz / row2xyz / sec2xyz，取值 1~3。 */
    public int[] axisMapping() {
        return fields.axisMapping().clone();
    }

    public float densityMin() {
        return fields.densityMin();
    }

    public float densityMax() {
        return fields.densityMax();
    }

    public float densityMean() {
        return fields.densityMean();
    }

    public int spaceGroup() {
        return fields.spaceGroup();
    }

    public int symmetryBytes() {
        return fields.symmetryBytes();
    }

    public int skewFlag() {
        return fields.skewFlag();
    }

    public float[] skewMatrix() {
        return fields.skewMatrix().clone();
    }

    public float[] skewTranslation() {
        return fields.skewTranslation().clone();
    }

    public float[] futureUse() {
        return fields.futureUse().clone();
    }

    public float[] originOverride() {
        return fields.originOverride().clone();
    }

    public String mapId() {
        return fields.mapId();
    }

    public int machineStamp() {
        return fields.machineStamp();
    }

    public float rms() {
        return fields.rms();
    }

    public int labelCount() {
        return fields.labelCount();
    }

    /** 第 224~1024 字节的标签文本（已去除空格）。 */
    public String labels() {
        return fields.labels();
    }

    /** 解析时自动修正产生的非致命告警。 */
    public List<String> warnings() {
        return warnings;
    }

    // ---- 派生参数 ----

    public long mapSize() {
        return mapSize;
    }

    public double[] gridSpacing() {
        return gridSpacing.clone();
    }

    public int[] map2xyz() {
        return map2xyz.clone();
    }

    public int[] map2crs() {
        return map2crs.clone();
    }

    /** 按 crs 轴排列的晶轴间隔数。 */
    public int[] crsInterval() {
        return crsInterval.clone();
    }

    public double unitVolume() {
        return unitVolume;
    }

    public double[][] orthoMatrix() {
        return copy(orthoMatrix);
    }

    public double[][] deOrthoMatrix() {
        return copy(deOrthoMatrix);
    }

    public XyzCoord origin() {
        return origin;
    }

    public int[] uniqueExtent() {
        return uniqueExtent.clone();
    }

    /** 三个晶胞角是否都等于 90°。 */
    public boolean isOrthogonal() {
        return orthogonal;
    }

    public CoordinateSystem coordinateSystem() {
        return coordinateSystem;
    }

    // 供同包的 CoordinateSystem 直接读取，避免每次查询都复制数组
    int[] ncrsRef() {
        return fields.ncrs();
    }

    int[] crsStartRef() {
        return fields.crsStart();
    }

    int[] intervalsRef() {
        return fields.intervals();
    }

    int[] map2xyzRef() {
        return map2xyz;
    }

    int[] map2crsRef() {
        return map2crs;
    }

    int[] crsIntervalRef() {
        return crsInterval;
    }

    double[] gridSpacingRef() {
        return gridSpacing;
    }

    double[][] orthoMatrixRef() {
        return orthoMatrix;
    }

    double[][] deOrthoMatrixRef() {
        return deOrthoMatrix;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            out[i] = matrix[i].clone();
        }
        return out;
    }

    /**
     * 头部前 224 字节按顺序解析出的原始字段（已应用默认值修正）。
     */
    record Fields(
            int[] ncrs,
            int mode,
            int[] crsStart,
            int[] intervals,
            float[] cellLengths,
            float[] cellAngles,
            int[] axisMapping,
            float densityMin,
            float densityMax,
            float densityMean,
            int spaceGroup,
            int symmetryBytes,
            int skewFlag,
            float[] skewMatrix,
            float[] skewTranslation,
            float[] futureUse,
            float[] originOverride,
            String mapId,
            int machineStamp,
            float rms,
            int labelCount,
            String labels
    ) {
        Fields withIntervals(int[] newIntervals) {
            return new Fields(ncrs, mode, crsStart, newIntervals, cellLengths, cellAngles, axisMapping,
                    densityMin, densityMax, densityMean, spaceGroup, symmetryBytes, skewFlag,
                    skewMatrix, skewTranslation, futureUse, originOverride, mapId, machineStamp, rms, labelCount, labels);
        }

        Fields withAxisMapping(int[] newAxisMapping) {
            return new Fields(ncrs, mode, crsStart, intervals, cellLengths, cellAngles, newAxisMapping,
                    densityMin, densityMax, densityMean, spaceGroup, symmetryBytes, skewFlag,
                    skewMatrix, skewTranslation, futureUse, originOverride, mapId, machineStamp, rms, labelCount, labels);
        }
    }
}
