package org.edmap.density.map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * CCP4/MRC 密度图完整解析入口：字节数组 -> {@link DensityMap}。
 * <p>
 * 文件布局：1024 字节头部 + {@code symmetryBytes} 字节对称性记录 + {@code ncrs[0]*ncrs[1]*ncrs[2]} 个 float。
 * 头部之后的剩余字节数必须严格等于 {@code symmetryBytes + mapSize}，否则解析失败。
 * <p>
 * 字节来源（本地文件/网络）由调用方负责，本类不做任何 I/O。
 *
 * @see <a href="http://www.ccp4.ac.uk/html/maplib.html">CCP4 map format</a>
 */
public final class Ccp4MapParser {

    private static final Logger log = LoggerFactory.getLogger(Ccp4MapParser.class);

    private Ccp4MapParser() {
    }

    public static DensityMap parse(byte[] data, String source) {
        if (data == null || data.length < DensityHeaderDecoder.HEADER_BYTES) {
            int length = data == null ? 0 : data.length;
            throw new MapFormatException(MapFormatException.Reason.HEADER_TRUNCATED,
                    "文件长度不足 1024 字节，不是有效的密度图：" + length + " 字节");
        }

        DensityHeader header = DensityHeaderDecoder.decode(Arrays.copyOf(data, DensityHeaderDecoder.HEADER_BYTES));
        long remaining = data.length - DensityHeaderDecoder.HEADER_BYTES;
        checkBodySize(header, remaining);

        int symmetryEnd = DensityHeaderDecoder.HEADER_BYTES + header.symmetryBytes();
        byte[] symmetry = Arrays.copyOfRange(data, DensityHeaderDecoder.HEADER_BYTES, symmetryEnd);

        int count = (int) (header.mapSize() / 4);
        float[] values = new float[count];
        ByteBuffer body = ByteBuffer.wrap(data, symmetryEnd, count * 4).order(header.byteOrder().nioOrder());
        body.asFloatBuffer().get(values);

        log.debug("已解析密度图 {}：{} 个体素，对称性记录 {} 字节", source, count, symmetry.length);
        return new DensityMap(source, header, DensityGrid.fromFlat(header, values), symmetry);
    }

    private static void checkBodySize(DensityHeader header, long remaining) {
        long symmetryBytes = header.symmetryBytes();
        long mapSize = header.mapSize();
        long expected = symmetryBytes + mapSize;
        if (remaining == expected) {
            return;
        }
        String detail = "（头部后剩余 " + remaining + " 字节，预期对称性记录 " + symmetryBytes
                + " + 密度数据 " + mapSize + " = " + expected + "）";
        if (symmetryBytes != 0 && remaining == mapSize) {
            throw new MapFormatException(MapFormatException.Reason.SYMMETRY_RECORDS_MISSING,
                    "文件中的对称性记录与头部声明不符" + detail);
        }
        if (mapSize != 0 && remaining == symmetryBytes) {
            throw new MapFormatException(MapFormatException.Reason.MAP_DATA_MISSING,
                    "文件不包含密度数据" + detail);
        }
        if (remaining < expected) {
            throw new MapFormatException(MapFormatException.Reason.TRUNCATED_DATA,
                    "文件数据不完整" + detail);
        }
        throw new MapFormatException(MapFormatException.Reason.EXCESS_DATA,
                "文件数据多于预期" + detail);
    }
}
