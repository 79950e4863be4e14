package org.edmap.density.map;

/**
 * 一次完整解码的结果：头部、密度网格以及原样保存的对称性记录。
 */
public final class DensityMap {

    private final String source;
    private final DensityHeader header;
    private final DensityGrid grid;
    private final byte[] symmetryRecords;

    public DensityMap(String source, DensityHeader header, DensityGrid grid, byte[] symmetryRecords) {
        this.source = source;
        this.header = header;
        this.grid = grid;
        this.symmetryRecords = symmetryRecords.clone();
    }

    /** 数据来源（文件路径、URL 或 PDB id）。 */
    public String source() {
        return source;
    }

    public DensityHeader header() {
        return header;
    }

    public DensityGrid grid() {
        return grid;
    }

    public byte[] symmetryRecords() {
        return symmetryRecords.clone();
    }
}
