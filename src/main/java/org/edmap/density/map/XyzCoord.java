package org.edmap.density.map;

/**
 * 正交参考系下的物理坐标（单位 Å）。
 */
public record XyzCoord(double x, double y, double z) {

    public static final XyzCoord ZERO = new XyzCoord(0.0, 0.0, 0.0);

    public static XyzCoord of(double[] xyz) {
        if (xyz == null || xyz.length != 3) {
            throw new IllegalArgumentException("xyz 坐标必须是 3 个数值");
        }
        return new XyzCoord(xyz[0], xyz[1], xyz[2]);
    }

    public double get(int axis) {
        return switch (axis) {
            case 0 -> x;
            case 1 -> y;
            case 2 -> z;
            default -> throw new IndexOutOfBoundsException("axis 只能是 0/1/2：" + axis);
        };
    }

    public XyzCoord plus(double dx, double dy, double dz) {
        return new XyzCoord(x + dx, y + dy, z + dz);
    }

    public double distanceTo(XyzCoord other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public double[] toArray() {
        return new double[]{x, y, z};
    }
}
