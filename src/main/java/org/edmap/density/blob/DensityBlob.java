package org.edmap.density.blob;

import org.edmap.density.map.CoordinateSystem;
import org.edmap.density.map.DensityGrid;
import org.edmap.density.map.DensityHeader;
import org.edmap.density.map.GridCoord;
import org.edmap.density.map.XyzCoord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一组互相 26 连通的网格点（blob）及其聚合统计。
 * <p>
 * 聚合值（质心、几何中心、总密度、体积）总是由完整坐标集合重新计算，合并时整体替换，不做增量修补。
 * {@link #atoms()} 是留给外部流程（例如模型原子比对）填充的注解列表，本类从不读取其内容。
 */
public final class DensityBlob {

    static final double APPROX_TOLERANCE = 1e-6;

    private final DensityGrid grid;
    private final List<Object> atoms = new ArrayList<>();

    private Set<GridCoord> crsSet;
    private Aggregate aggregate;

    private DensityBlob(DensityGrid grid, Set<GridCoord> crsSet, Aggregate aggregate) {
        this.grid = grid;
        this.crsSet = crsSet;
        this.aggregate = aggregate;
    }

    /**
     * 由坐标集合构造 blob（坐标按出现顺序去重）。
     *
     * @throws DegenerateBlobException 总密度为 0 时
     */
    public static DensityBlob fromCoordinates(DensityGrid grid, Collection<GridCoord> coordinates) {
        Set<GridCoord> unique = new LinkedHashSet<>(coordinates);
        return new DensityBlob(grid, unique, Aggregate.compute(grid, unique));
    }

    /**
     * 用合并后的坐标集合整体替换当前状态；外部持有的引用会看到合并结果。
     */
    void replaceWith(Set<GridCoord> mergedCrs, List<Object> mergedAtoms) {
        Aggregate recomputed = Aggregate.compute(grid, mergedCrs);
        this.crsSet = mergedCrs;
        this.aggregate = recomputed;
        this.atoms.clear();
        this.atoms.addAll(mergedAtoms);
    }

    Set<GridCoord> crsSetRef() {
        return crsSet;
    }

    public DensityGrid grid() {
        return grid;
    }

    public DensityHeader header() {
        return grid.header();
    }

    public Set<GridCoord> crsSet() {
        return Collections.unmodifiableSet(crsSet);
    }

    public int size() {
        return crsSet.size();
    }

    /** 密度加权质心（物理坐标）。 */
    public XyzCoord centroid() {
        return aggregate.centroid();
    }

    /** 不加权的几何中心（物理坐标）。 */
    public XyzCoord coordCenter() {
        return aggregate.coordCenter();
    }

    public double totalDensity() {
        return aggregate.totalDensity();
    }

    /** 体素数 × 单个体素体积。 */
    public double volume() {
        return aggregate.volume();
    }

    /** 外部关联的原子注解（可变）。 */
    public List<Object> atoms() {
        return atoms;
    }

    /**
     * 近似相等：体积、总密度与质心各分量的差都小于 1e-6。
     * <p>
     * 仅用于测试/去重比较，不替代 {@link Object#equals(Object)}。
     */
    public boolean isApproximatelyEqual(DensityBlob other) {
        if (Math.abs(volume() - other.volume()) >= APPROX_TOLERANCE) {
            return false;
        }
        if (Math.abs(totalDensity() - other.totalDensity()) >= APPROX_TOLERANCE) {
            return false;
        }
        for (int axis = 0; axis < 3; axis++) {
            if (Math.abs(centroid().get(axis) - other.centroid().get(axis)) >= APPROX_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "DensityBlob{size=" + size() + ", totalDensity=" + totalDensity()
                + ", volume=" + volume() + ", centroid=" + centroid() + "}";
    }

    private record Aggregate(XyzCoord centroid, XyzCoord coordCenter, double totalDensity, double volume) {

        static Aggregate compute(DensityGrid grid, Set<GridCoord> crsSet) {
            if (crsSet.isEmpty()) {
                throw new DegenerateBlobException("blob 不包含任何网格点");
            }
            CoordinateSystem cs = grid.coordinateSystem();
            int n = crsSet.size();
            double[] densities = new double[n];
            XyzCoord[] positions = new XyzCoord[n];
            double total = 0.0;
            int i = 0;
            for (GridCoord crs : crsSet) {
                densities[i] = grid.pointDensity(crs);
                positions[i] = cs.crsToXyz(crs);
                total += densities[i];
                i++;
            }
            if (total == 0.0) {
                throw new DegenerateBlobException("blob 总密度为 0，无法计算密度加权质心（" + n + " 个网格点）");
            }

            // 先归一化权重再求和：单点 blob 的权重恰为 1，质心与该点坐标完全一致
            double[] centroid = new double[3];
            double[] center = new double[3];
            for (int k = 0; k < n; k++) {
                double weight = densities[k] / total;
                for (int axis = 0; axis < 3; axis++) {
                    centroid[axis] += weight * positions[k].get(axis);
                    center[axis] += positions[k].get(axis);
                }
            }
            for (int axis = 0; axis < 3; axis++) {
                center[axis] /= n;
            }
            return new Aggregate(XyzCoord.of(centroid), XyzCoord.of(center), total, n * grid.header().unitVolume());
        }
    }
}
