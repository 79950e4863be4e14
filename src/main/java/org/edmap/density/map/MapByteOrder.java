package org.edmap.density.map;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * 密度图文件的字节序。
 * <p>
 * 每次解码只判定一次，随后头部与数据体的所有多字节字段都按同一个字节序读取。
 */
public enum MapByteOrder {

    LITTLE_ENDIAN(ByteOrder.LITTLE_ENDIAN),
    BIG_ENDIAN(ByteOrder.BIG_ENDIAN);

    /**
     * mode 字段位于头部第 12~16 字节。
     */
    static final int MODE_OFFSET = 12;

    private final ByteOrder nioOrder;

    MapByteOrder(ByteOrder nioOrder) {
        this.nioOrder = nioOrder;
    }

    public ByteOrder nioOrder() {
        return nioOrder;
    }

    /**
     * 根据 mode 字段推断字节序：按小端读取 mode，落在 [0, 6] 内则整个文件为小端，否则为大端。
     *
     * @param fileHeader 至少 16 字节的头部
     */
    public static MapByteOrder detect(byte[] fileHeader) {
        if (fileHeader == null || fileHeader.length < MODE_OFFSET + 4) {
            throw new MapFormatException(MapFormatException.Reason.HEADER_TRUNCATED,
                    "头部长度不足，无法读取 mode 字段");
        }
        int mode = ByteBuffer.wrap(fileHeader, MODE_OFFSET, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
        return (mode >= 0 && mode <= 6) ? LITTLE_ENDIAN : BIG_ENDIAN;
    }
}
