package org.edmap.density.blob;

import org.edmap.density.map.GridCoord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * blob 相邻/重叠判断与合并。
 */
public final class BlobMerger {

    private BlobMerger() {
    }

    /**
     * 两个 blob 是否重叠或紧邻：存在一对坐标在每个轴上相差都不超过 1。
     */
    public static boolean overlaps(DensityBlob a, DensityBlob b) {
        Set<GridCoord> small = a.size() <= b.size() ? a.crsSetRef() : b.crsSetRef();
        Set<GridCoord> large = small == a.crsSetRef() ? b.crsSetRef() : a.crsSetRef();
        for (GridCoord crs : small) {
            for (int dc = -1; dc <= 1; dc++) {
                for (int dr = -1; dr <= 1; dr++) {
                    for (int ds = -1; ds <= 1; ds++) {
                        if (large.contains(crs.offset(dc, dr, ds))) {
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }

    /**
     * 把 {@code other} 合并进 {@code target}：坐标取并集，聚合值由并集重新计算，
     * 原子注解按引用去重合并。{@code target} 原地更新并返回。
     */
    public static DensityBlob merge(DensityBlob target, DensityBlob other) {
        if (target.grid() != other.grid()) {
            throw new IllegalArgumentException("只能合并来自同一个密度网格的 blob");
        }
        Set<GridCoord> union = new LinkedHashSet<>(target.crsSetRef());
        union.addAll(other.crsSetRef());

        List<Object> atoms = new ArrayList<>(target.atoms());
        for (Object atom : other.atoms()) {
            if (!containsIdentity(atoms, atom)) {
                atoms.add(atom);
            }
        }
        target.replaceWith(union, atoms);
        return target;
    }

    /**
     * 反复合并列表中互相重叠的 blob，直到任意两个都不再重叠。
     *
     * @return 合并后保留下来的 blob（被吸收的 blob 不再出现）
     */
    public static List<DensityBlob> mergeOverlapping(List<DensityBlob> blobs) {
        List<DensityBlob> result = new ArrayList<>(blobs);
        boolean merged = true;
        while (merged) {
            merged = false;
            outer:
            for (int i = 0; i < result.size(); i++) {
                for (int j = i + 1; j < result.size(); j++) {
                    if (overlaps(result.get(i), result.get(j))) {
                        merge(result.get(i), result.remove(j));
                        merged = true;
                        break outer;
                    }
                }
            }
        }
        return result;
    }

    private static boolean containsIdentity(List<Object> atoms, Object atom) {
        for (Object existing : atoms) {
            if (existing == atom) {
                return true;
            }
        }
        return false;
    }
}
