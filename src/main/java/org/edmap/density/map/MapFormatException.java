package org.edmap.density.map;

/**
 * 密度图二进制格式错误（致命，解码立即失败）。
 * <p>
 * {@link #reason()} 标明具体是哪一部分数据出了问题，便于调用方区分“对称性记录”与“密度数据体”。
 */
public class MapFormatException extends RuntimeException {

    public enum Reason {
        /** 头部不足 1024 字节。 */
        HEADER_TRUNCATED,
        /** 网格尺寸为负数。 */
        INVALID_EXTENT,
        /** 对称性记录长度为负数。 */
        INVALID_SYMMETRY_LENGTH,
        /** 列/行/层到 xyz 的映射不是 {1,2,3} 上的双射。 */
        INVALID_AXIS_MAPPING,
        /** 晶胞三个边长全部为 0。 */
        ZERO_CELL_EDGES,
        /** 正交化矩阵不可逆。 */
        DEGENERATE_CELL,
        /** 数据体长度恰好等于密度数据长度：对称性记录缺失。 */
        SYMMETRY_RECORDS_MISSING,
        /** 数据体长度恰好等于对称性记录长度：密度数据缺失。 */
        MAP_DATA_MISSING,
        /** 数据体比预期短。 */
        TRUNCATED_DATA,
        /** 数据体比预期长。 */
        EXCESS_DATA
    }

    private final Reason reason;

    public MapFormatException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
