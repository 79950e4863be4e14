package org.edmap.density.map;

/**
 * 网格索引坐标（crs）：column 变化最快，section 变化最慢。
 */
public record GridCoord(int column, int row, int section) {

    public static GridCoord of(int[] crs) {
        if (crs == null || crs.length != 3) {
            throw new IllegalArgumentException("crs 坐标必须是 3 个整数");
        }
        return new GridCoord(crs[0], crs[1], crs[2]);
    }

    /**
     * 按轴下标取值：0=column，1=row，2=section。
     */
    public int get(int axis) {
        return switch (axis) {
            case 0 -> column;
            case 1 -> row;
            case 2 -> section;
            default -> throw new IndexOutOfBoundsException("axis 只能是 0/1/2：" + axis);
        };
    }

    public GridCoord offset(int dc, int dr, int ds) {
        return new GridCoord(column + dc, row + dr, section + ds);
    }

    /**
     * 两个坐标在每个轴上相差都不超过 1（切比雪夫距离 ≤ 1，包含相等）。
     */
    public boolean isAdjacentTo(GridCoord other) {
        return Math.abs(column - other.column) <= 1
                && Math.abs(row - other.row) <= 1
                && Math.abs(section - other.section) <= 1;
    }

    public int[] toArray() {
        return new int[]{column, row, section};
    }
}
