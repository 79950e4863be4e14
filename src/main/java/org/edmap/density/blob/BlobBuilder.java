package org.edmap.density.blob;

import org.edmap.density.map.DensityGrid;
import org.edmap.density.map.GridCoord;
import org.edmap.density.map.XyzCoord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 把候选网格点划分为 26 连通分量，并为每个分量构造 {@link DensityBlob}。
 * <p>
 * 相邻定义：两个坐标在三个轴上相差都不超过 1（不含自身）。
 * 采用基于哈希集合的广度优先遍历，结果顺序与输入顺序一致（按每个分量首次出现的位置）。
 */
public final class BlobBuilder {

    private BlobBuilder() {
    }

    public static List<DensityBlob> buildBlobs(DensityGrid grid, Collection<GridCoord> coordinates) {
        List<Set<GridCoord>> components = connectedComponents(coordinates);
        List<DensityBlob> blobs = new ArrayList<>(components.size());
        for (Set<GridCoord> component : components) {
            blobs.add(DensityBlob.fromCoordinates(grid, component));
        }
        return blobs;
    }

    /**
     * 围绕一个或多个中心做球查询，按坐标去重合并后提取 blob。
     *
     * @param cutoff 密度阈值（&gt;0 找正密度异常，&lt;0 找负密度异常，0 表示全部点）
     */
    public static List<DensityBlob> findAberrantBlobs(DensityGrid grid, List<XyzCoord> centers, double radius, double cutoff) {
        Set<GridCoord> candidates = new LinkedHashSet<>();
        for (XyzCoord center : centers) {
            candidates.addAll(grid.sphereQuery(center, radius, cutoff));
        }
        return buildBlobs(grid, candidates);
    }

    public static List<Set<GridCoord>> connectedComponents(Collection<GridCoord> coordinates) {
        Set<GridCoord> remaining = new LinkedHashSet<>(coordinates);
        List<Set<GridCoord>> components = new ArrayList<>();
        Deque<GridCoord> queue = new ArrayDeque<>();

        while (!remaining.isEmpty()) {
            GridCoord seed = remaining.iterator().next();
            remaining.remove(seed);
            Set<GridCoord> component = new LinkedHashSet<>();
            component.add(seed);
            queue.add(seed);

            while (!queue.isEmpty()) {
                GridCoord current = queue.poll();
                for (int dc = -1; dc <= 1; dc++) {
                    for (int dr = -1; dr <= 1; dr++) {
                        for (int ds = -1; ds <= 1; ds++) {
                            if (dc == 0 && dr == 0 && ds == 0) {
                                continue;
                            }
                            GridCoord neighbor = current.offset(dc, dr, ds);
                            if (remaining.remove(neighbor)) {
                                component.add(neighbor);
                                queue.add(neighbor);
                            }
                        }
                    }
                }
            }
            components.add(component);
        }
        return components;
    }
}
