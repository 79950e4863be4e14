package org.edmap.density.map;

/**
 * 周期性回绕后的网格坐标。
 *
 * @param coord 回绕后的坐标（仅当 valid=true 时可用于取值）
 * @param valid 回绕后该位置是否有密度数据
 */
public record WrappedCoord(GridCoord coord, boolean valid) {
}
