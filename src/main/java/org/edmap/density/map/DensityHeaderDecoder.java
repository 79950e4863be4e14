package org.edmap.density.map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 密度图 1024 字节头部解码器。
 * <p>
 * 头部前 224 字节依次为：10 个 int、6 个 float、3 个 int、3 个 float、3 个 int、27 个 float、
 * 4 个单字节字符、1 个 int、1 个 float、1 个 int；其余 800 字节为标签文本。
 * <p>
 * 解码流程：
 * <ol>
 *   <li>按小端读取 mode 推断字节序（见 {@link MapByteOrder#detect(byte[])}）。</li>
 *   <li>按该字节序读取全部字段。</li>
 *   <li>校验致命错误，并对可修正的字段应用默认值（记录告警）。</li>
 *   <li>构造 {@link DensityHeader}，计算派生参数。</li>
 * </ol>
 */
public final class DensityHeaderDecoder {

    private static final Logger log = LoggerFactory.getLogger(DensityHeaderDecoder.class);

    public static final int HEADER_BYTES = 1024;
    static final int FIELD_BYTES = 224;

    private DensityHeaderDecoder() {
    }

    public static DensityHeader decode(byte[] fileHeader) {
        if (fileHeader == null || fileHeader.length < HEADER_BYTES) {
            int length = fileHeader == null ? 0 : fileHeader.length;
            throw new MapFormatException(MapFormatException.Reason.HEADER_TRUNCATED,
                    "头部长度不足：" + length + " 字节（需要 " + HEADER_BYTES + "）");
        }

        MapByteOrder byteOrder = MapByteOrder.detect(fileHeader);
        ByteBuffer in = ByteBuffer.wrap(fileHeader, 0, FIELD_BYTES).order(byteOrder.nioOrder());

        int[] ncrs = readInts(in, 3);
        int mode = in.getInt();
        int[] crsStart = readInts(in, 3);
        int[] intervals = readInts(in, 3);
        float[] cellLengths = readFloats(in, 3);
        float[] cellAngles = readFloats(in, 3);
        int[] axisMapping = readInts(in, 3);
        float densityMin = in.getFloat();
        float densityMax = in.getFloat();
        float densityMean = in.getFloat();
        int spaceGroup = in.getInt();
        int symmetryBytes = in.getInt();
        int skewFlag = in.getInt();
        float[] skewMatrix = readFloats(in, 9);
        float[] skewTranslation = readFloats(in, 3);
        float[] futureUse = readFloats(in, 12);
        float[] originOverride = readFloats(in, 3);
        byte[] mapChars = new byte[4];
        in.get(mapChars);
        int machineStamp = in.getInt();
        float rms = in.getFloat();
        int labelCount = in.getInt();

        String labels = decodeLabels(fileHeader);

        log.debug("密度图头部：byteOrder={}, mode={}, ncrs={}, intervals={}", byteOrder, mode,
                Arrays.toString(ncrs), Arrays.toString(intervals));

        DensityHeader.Fields fields = new DensityHeader.Fields(
                ncrs, mode, crsStart, intervals, cellLengths, cellAngles, axisMapping,
                densityMin, densityMax, densityMean, spaceGroup, symmetryBytes, skewFlag,
                skewMatrix, skewTranslation, futureUse, originOverride,
                new String(mapChars, StandardCharsets.ISO_8859_1), machineStamp, rms, labelCount, labels
        );

        List<String> warnings = new ArrayList<>();
        fields = validateAndFix(fields, warnings);
        return new DensityHeader(fields, byteOrder, warnings);
    }

    private static DensityHeader.Fields validateAndFix(DensityHeader.Fields fields, List<String> warnings) {
        int[] ncrs = fields.ncrs();
        for (int i = 0; i < 3; i++) {
            if (ncrs[i] < 0) {
                throw new MapFormatException(MapFormatException.Reason.INVALID_EXTENT,
                        "网格尺寸不能为负数：" + Arrays.toString(ncrs));
            }
        }
        if (fields.symmetryBytes() < 0) {
            throw new MapFormatException(MapFormatException.Reason.INVALID_SYMMETRY_LENGTH,
                    "对称性记录长度不能为负数：" + fields.symmetryBytes());
        }

        float[] lengths = fields.cellLengths();
        if (lengths[0] == 0.0f && lengths[1] == 0.0f && lengths[2] == 0.0f) {
            throw new MapFormatException(MapFormatException.Reason.ZERO_CELL_EDGES,
                    "晶胞边长全部为 0，密度图无法与其它结构对齐");
        }

        int[] intervals = fields.intervals().clone();
        boolean intervalsFixed = false;
        String[] axisNames = {"X", "Y", "Z"};
        for (int i = 0; i < 3; i++) {
            if (intervals[i] == 0 && ncrs[i] > 0) {
                intervals[i] = ncrs[i] - 1;
                intervalsFixed = true;
                warn(warnings, "晶轴 " + axisNames[i] + " 的间隔数为 0，已修正为 " + intervals[i]);
            }
        }
        if (intervalsFixed) {
            fields = fields.withIntervals(intervals);
        }

        int[] axisMapping = fields.axisMapping();
        if (axisMapping[0] == 0 && axisMapping[1] == 0 && axisMapping[2] == 0) {
            fields = fields.withAxisMapping(new int[]{1, 2, 3});
            warn(warnings, "列/行/层到 xyz 的映射全部为 0，已修正为 1, 2, 3");
        } else if (!isPermutation(axisMapping)) {
            throw new MapFormatException(MapFormatException.Reason.INVALID_AXIS_MAPPING,
                    "列/行/层到 xyz 的映射不是 1/2/3 的排列：" + Arrays.toString(axisMapping));
        }

        if (fields.mode() != 2) {
            warn(warnings, "mode=" + fields.mode() + "：仅完整支持 mode 2（32 位实数密度），数据体仍按 float 解码");
        }
        return fields;
    }

    private static boolean isPermutation(int[] axisMapping) {
        boolean[] seen = new boolean[3];
        for (int value : axisMapping) {
            if (value < 1 || value > 3 || seen[value - 1]) {
                return false;
            }
            seen[value - 1] = true;
        }
        return true;
    }

    private static String decodeLabels(byte[] fileHeader) {
        byte[] out = new byte[HEADER_BYTES - FIELD_BYTES];
        int n = 0;
        for (int i = FIELD_BYTES; i < HEADER_BYTES; i++) {
            if (fileHeader[i] != ' ') {
                out[n++] = fileHeader[i];
            }
        }
        return new String(out, 0, n, StandardCharsets.ISO_8859_1);
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }

    private static int[] readInts(ByteBuffer in, int count) {
        int[] out = new int[count];
        for (int i = 0; i < count; i++) {
            out[i] = in.getInt();
        }
        return out;
    }

    private static float[] readFloats(ByteBuffer in, int count) {
        float[] out = new float[count];
        for (int i = 0; i < count; i++) {
            out[i] = in.getFloat();
        }
        return out;
    }
}
