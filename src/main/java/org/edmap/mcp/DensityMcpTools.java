package org.edmap.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.edmap.density.DensityMapCache;
import org.edmap.density.DensityMapLoader;
import org.edmap.density.DensityServerProperties;
import org.edmap.density.SecurePathResolver;
import org.edmap.density.blob.BlobBuilder;
import org.edmap.density.blob.DegenerateBlobException;
import org.edmap.density.blob.DensityBlob;
import org.edmap.density.dto.BlobSearchResult;
import org.edmap.density.dto.BlobSummary;
import org.edmap.density.dto.GridPoint;
import org.edmap.density.dto.MapHeaderResult;
import org.edmap.density.dto.MapRootsResult;
import org.edmap.density.dto.MapStatisticsResult;
import org.edmap.density.dto.PointDensityResult;
import org.edmap.density.dto.SphereQueryResult;
import org.edmap.density.map.CoordinateSystem;
import org.edmap.density.map.DensityGrid;
import org.edmap.density.map.DensityHeader;
import org.edmap.density.map.DensityMap;
import org.edmap.density.map.GridCoord;
import org.edmap.density.map.WrappedCoord;
import org.edmap.density.map.XyzCoord;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 电子密度图 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单与远程下载配置（{@code density_list_roots}）。</li>
 *   <li>读取头部与派生参数（{@code density_read_header}）。</li>
 *   <li>点查询 / 球查询（{@code density_point} / {@code density_sphere}）。</li>
 *   <li>异常密度 blob 提取（{@code density_find_blobs}）。</li>
 *   <li>整图统计（{@code density_statistics}）。</li>
 * </ul>
 * <p>
 * 数据来源：每个工具必须且只能指定 {@code path}（配合 rootId）、{@code pdbId}、{@code url} 之一。
 * 解析结果会按来源缓存，{@code refresh=true} 时跳过缓存重新加载。
 */
@Component
public class DensityMcpTools {

    /**
     * centers 参数解析用的 JSON 解析器。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final DensityServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final DensityMapLoader loader;
    private final DensityMapCache mapCache;

    public DensityMcpTools(DensityServerProperties properties, SecurePathResolver pathResolver, DensityMapLoader loader, DensityMapCache mapCache) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.loader = loader;
        this.mapCache = mapCache;
    }

    @Tool(
            name = "density_list_roots",
            description = "列出允许读取本地密度图（.ccp4/.map/.mrc）的根目录（rootId + path），以及按 URL/PDB id 远程下载的配置。"
    )
    public MapRootsResult listRoots() {
        return new MapRootsResult(
                pathResolver.listRoots(),
                properties.isRemoteEnabled(),
                properties.getPdbUrlPrefix() + "{id}" + properties.getPdbUrlSuffix()
        );
    }

    @Tool(
            name = "density_read_header",
            description = "读取 CCP4 密度图头部：网格尺寸、起始索引、晶胞参数、轴映射、空间群，以及推导出的字节序、网格间距、原点、单个体素体积等。"
    )
    public MapHeaderResult readHeader(
            @ToolParam(required = false, description = "rootId（可从 density_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "本地密度图路径（相对 rootId 或绝对路径）；与 pdbId/url 三选一") String path,
            @ToolParam(required = false, description = "PDB id（例如 1cbs）；与 path/url 三选一") String pdbId,
            @ToolParam(required = false, description = "密度图下载地址（http/https）；与 path/pdbId 三选一") String url,
            @ToolParam(required = false, description = "是否跳过缓存重新加载（默认 false）") Boolean refresh
    ) {
        LoadedMap loaded = loadMap(rootId, path, pdbId, url, refresh);
        DensityHeader header = loaded.map().header();
        return new MapHeaderResult(
                loaded.map().source(),
                loaded.cached(),
                header.byteOrder().name(),
                header.mode(),
                ints(header.ncrs()),
                ints(header.crsStart()),
                ints(header.intervals()),
                floats(header.cellLengths()),
                floats(header.cellAngles()),
                ints(header.axisMapping()),
                header.spaceGroup(),
                header.symmetryBytes(),
                header.densityMin(),
                header.densityMax(),
                header.densityMean(),
                header.rms(),
                doubles(header.gridSpacing()),
                xyz(header.origin()),
                header.unitVolume(),
                ints(header.uniqueExtent()),
                header.isOrthogonal(),
                header.mapId(),
                header.labels(),
                nullIfEmpty(loaded.warnings())
        );
    }

    @Tool(
            name = "density_point",
            description = "查询某个物理坐标（xyz，Å）处的密度：返回换算得到的网格坐标、周期回绕后的坐标与密度值；超出数据范围时密度为 0。"
    )
    public PointDensityResult pointDensity(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "本地密度图路径；与 pdbId/url 三选一") String path,
            @ToolParam(required = false, description = "PDB id；与 path/url 三选一") String pdbId,
            @ToolParam(required = false, description = "密度图下载地址；与 path/pdbId 三选一") String url,
            @ToolParam(description = "x 坐标（Å）") Double x,
            @ToolParam(description = "y 坐标（Å）") Double y,
            @ToolParam(description = "z 坐标（Å）") Double z,
            @ToolParam(required = false, description = "是否跳过缓存重新加载（默认 false）") Boolean refresh
    ) {
        XyzCoord point = requirePoint(x, y, z);
        LoadedMap loaded = loadMap(rootId, path, pdbId, url, refresh);
        DensityGrid grid = loaded.map().grid();
        CoordinateSystem cs = grid.coordinateSystem();

        GridCoord crs = cs.xyzToCrs(point);
        WrappedCoord wrapped = cs.validateAndWrap(crs);
        return new PointDensityResult(
                loaded.map().source(),
                xyz(point),
                ints(crs.toArray()),
                wrapped.valid() ? ints(wrapped.coord().toArray()) : null,
                wrapped.valid(),
                grid.pointDensity(crs),
                nullIfEmpty(loaded.warnings())
        );
    }

    @Tool(
            name = "density_sphere",
            description = "球查询：列出距球心不超过 radius 且满足密度阈值的网格点，并给出点数与密度总和。cutoff=0 表示全部点；cutoff>0 仅保留密度>cutoff；cutoff<0 仅保留密度<cutoff。"
    )
    public SphereQueryResult sphere(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "本地密度图路径；与 pdbId/url 三选一") String path,
            @ToolParam(required = false, description = "PDB id；与 path/url 三选一") String pdbId,
            @ToolParam(required = false, description = "密度图下载地址；与 path/pdbId 三选一") String url,
            @ToolParam(description = "球心 x（Å）") Double x,
            @ToolParam(description = "球心 y（Å）") Double y,
            @ToolParam(description = "球心 z（Å）") Double z,
            @ToolParam(description = "半径（Å，上限 app.density.sphere-max-radius）") Double radius,
            @ToolParam(required = false, description = "密度阈值（默认 0）") Double cutoff,
            @ToolParam(required = false, description = "最多返回多少个网格点明细（默认 app.density.sphere-default-max-points，上限 app.density.sphere-max-points）") Integer maxPoints,
            @ToolParam(required = false, description = "是否跳过缓存重新加载（默认 false）") Boolean refresh
    ) {
        XyzCoord center = requirePoint(x, y, z);
        double resolvedRadius = resolveRadius(radius);
        double resolvedCutoff = (cutoff == null) ? 0.0 : cutoff;
        int resolvedMaxPoints = resolveMaxPoints(maxPoints);

        LoadedMap loaded = loadMap(rootId, path, pdbId, url, refresh);
        DensityGrid grid = loaded.map().grid();
        CoordinateSystem cs = grid.coordinateSystem();

        Set<GridCoord> coords = grid.sphereQuery(center, resolvedRadius, resolvedCutoff);
        double total = 0.0;
        List<GridPoint> points = new ArrayList<>(Math.min(coords.size(), resolvedMaxPoints));
        for (GridCoord crs : coords) {
            float density = grid.pointDensity(crs);
            total += density;
            if (points.size() < resolvedMaxPoints) {
                points.add(new GridPoint(ints(crs.toArray()), xyz(cs.crsToXyz(crs)), density));
            }
        }
        return new SphereQueryResult(
                loaded.map().source(),
                xyz(center),
                resolvedRadius,
                resolvedCutoff,
                coords.size(),
                total,
                coords.size() > points.size(),
                points,
                nullIfEmpty(loaded.warnings())
        );
    }

    @Tool(
            name = "density_find_blobs",
            description = "在一个或多个中心附近提取异常密度 blob：对每个中心做球查询，按网格坐标去重合并后划分 26 连通分量，返回每个 blob 的点数、密度总和、体积、加权质心与几何中心（按 |总密度| 降序）。"
    )
    public BlobSearchResult findBlobs(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "本地密度图路径；与 pdbId/url 三选一") String path,
            @ToolParam(required = false, description = "PDB id；与 path/url 三选一") String pdbId,
            @ToolParam(required = false, description = "密度图下载地址；与 path/pdbId 三选一") String url,
            @ToolParam(description = "中心点 JSON：单个 [x,y,z] 或 [[x,y,z],[x,y,z],...]") String centers,
            @ToolParam(description = "每个中心的搜索半径（Å）") Double radius,
            @ToolParam(required = false, description = "密度阈值（>0 找正异常，<0 找负异常；为 0 或不传时所有点参与，总密度为 0 的连通分量会被跳过并在 warnings 中说明）") Double cutoff,
            @ToolParam(required = false, description = "是否合并不同中心之间重叠/相邻的 blob（默认 true）；false 时按中心各自提取，同一区域可能重复出现") Boolean merge,
            @ToolParam(required = false, description = "是否跳过缓存重新加载（默认 false）") Boolean refresh
    ) {
        List<XyzCoord> resolvedCenters = parseCenters(centers);
        double resolvedRadius = resolveRadius(radius);
        double resolvedCutoff = (cutoff == null) ? 0.0 : cutoff;

        LoadedMap loaded = loadMap(rootId, path, pdbId, url, refresh);
        DensityGrid grid = loaded.map().grid();

        Set<GridCoord> candidates = new LinkedHashSet<>();
        List<DensityBlob> blobs = new ArrayList<>();
        int degenerate = 0;
        for (XyzCoord center : resolvedCenters) {
            Set<GridCoord> sphere = grid.sphereQuery(center, resolvedRadius, resolvedCutoff);
            candidates.addAll(sphere);
            if (Boolean.FALSE.equals(merge)) {
                degenerate += collectBlobs(grid, sphere, blobs);
            }
        }
        if (!Boolean.FALSE.equals(merge)) {
            // 并集上的连通分量等价于逐中心提取后再做 BlobMerger.mergeOverlapping
            degenerate += collectBlobs(grid, candidates, blobs);
        }
        blobs.sort(Comparator.comparingDouble((DensityBlob b) -> Math.abs(b.totalDensity())).reversed());

        int limit = Math.min(blobs.size(), properties.getBlobMaxResults());
        List<BlobSummary> summaries = new ArrayList<>(limit);
        for (DensityBlob blob : blobs.subList(0, limit)) {
            summaries.add(new BlobSummary(
                    blob.size(),
                    blob.totalDensity(),
                    blob.volume(),
                    xyz(blob.centroid()),
                    xyz(blob.coordCenter())
            ));
        }

        List<String> warnings = loaded.warnings();
        if (degenerate > 0) {
            warnings.add(degenerate + " 个连通分量的密度总和为 0（无法计算加权质心），已跳过；可设置非 0 的 cutoff 排除空白区域。");
        }
        if (blobs.size() > limit) {
            warnings.add("blob 数量超过上限 app.density.blob-max-results=" + limit + "，已截断。");
        }
        return new BlobSearchResult(
                loaded.map().source(),
                resolvedCenters.size(),
                resolvedRadius,
                resolvedCutoff,
                candidates.size(),
                blobs.size(),
                blobs.size() > limit,
                summaries,
                nullIfEmpty(warnings)
        );
    }

    @Tool(
            name = "density_statistics",
            description = "整图密度统计：体素数、由全部体素计算的均值/总体标准差，以及头部声明的最小/最大/平均/均方根值。"
    )
    public MapStatisticsResult statistics(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "本地密度图路径；与 pdbId/url 三选一") String path,
            @ToolParam(required = false, description = "PDB id；与 path/url 三选一") String pdbId,
            @ToolParam(required = false, description = "密度图下载地址；与 path/pdbId 三选一") String url,
            @ToolParam(required = false, description = "是否跳过缓存重新加载（默认 false）") Boolean refresh
    ) {
        LoadedMap loaded = loadMap(rootId, path, pdbId, url, refresh);
        DensityGrid grid = loaded.map().grid();
        DensityHeader header = loaded.map().header();
        return new MapStatisticsResult(
                loaded.map().source(),
                grid.voxelCount(),
                grid.meanDensity(),
                grid.stdDensity(),
                header.densityMin(),
                header.densityMax(),
                header.densityMean(),
                header.rms(),
                nullIfEmpty(loaded.warnings())
        );
    }

    /**
     * 把坐标集合划分为连通分量并逐个构造 blob，追加到 {@code out}。
     *
     * @return 因密度总和为 0 而跳过的分量数
     */
    private static int collectBlobs(DensityGrid grid, Set<GridCoord> coords, List<DensityBlob> out) {
        int skipped = 0;
        for (Set<GridCoord> component : BlobBuilder.connectedComponents(coords)) {
            try {
                out.add(DensityBlob.fromCoordinates(grid, component));
            } catch (DegenerateBlobException e) {
                skipped++;
            }
        }
        return skipped;
    }

    private LoadedMap loadMap(String rootId, String path, String pdbId, String url, Boolean refresh) {
        boolean hasPath = path != null && !path.isBlank();
        boolean hasPdbId = pdbId != null && !pdbId.isBlank();
        boolean hasUrl = url != null && !url.isBlank();
        int sources = (hasPath ? 1 : 0) + (hasPdbId ? 1 : 0) + (hasUrl ? 1 : 0);
        if (sources != 1) {
            throw new IllegalArgumentException("参数错误：path、pdbId、url 必须且只能指定一个");
        }

        String key;
        SecurePathResolver.MapFile mapFile = null;
        if (hasPath) {
            mapFile = pathResolver.resolveMapFile(rootId, path);
            key = "file:" + mapFile.rootId() + ":" + mapFile.displayPath();
        } else if (hasPdbId) {
            key = "pdb:" + pdbId.trim().toLowerCase(Locale.ROOT);
        } else {
            key = "url:" + url.trim();
        }

        List<String> warnings = new ArrayList<>();
        if (Boolean.TRUE.equals(refresh)) {
            mapCache.invalidate(key);
        } else {
            DensityMap cached = mapCache.get(key);
            if (cached != null) {
                warnings.addAll(cached.header().warnings());
                warnings.add("密度图来自缓存；如需重新加载请设置 refresh=true。");
                return new LoadedMap(cached, true, warnings);
            }
        }

        DensityMap map;
        if (mapFile != null) {
            map = loader.readFile(mapFile);
        } else if (hasPdbId) {
            map = loader.readPdbId(pdbId.trim());
        } else {
            map = loader.readUrl(url.trim());
        }
        mapCache.put(key, map);
        warnings.addAll(map.header().warnings());
        return new LoadedMap(map, false, warnings);
    }

    private double resolveRadius(Double radius) {
        if (radius == null || radius.isNaN() || radius < 0) {
            throw new IllegalArgumentException("参数错误：radius 必须是非负数：" + radius);
        }
        if (radius > properties.getSphereMaxRadius()) {
            throw new IllegalArgumentException("参数错误：radius 超过上限 app.density.sphere-max-radius=" + properties.getSphereMaxRadius());
        }
        return radius;
    }

    private int resolveMaxPoints(Integer maxPoints) {
        // 明细条数上限保护：点数只影响返回体积，不影响 pointCount/totalDensity
        int resolved = (maxPoints == null) ? properties.getSphereDefaultMaxPoints() : maxPoints;
        resolved = Math.max(0, resolved);
        return Math.min(resolved, properties.getSphereMaxPoints());
    }

    private static XyzCoord requirePoint(Double x, Double y, Double z) {
        if (x == null || y == null || z == null) {
            throw new IllegalArgumentException("参数错误：x/y/z 不能为空");
        }
        return new XyzCoord(x, y, z);
    }

    List<XyzCoord> parseCenters(String centers) {
        if (centers == null || centers.isBlank()) {
            throw new IllegalArgumentException("参数错误：centers 不能为空");
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(centers);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("centers 不是合法的 JSON：" + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new IllegalArgumentException("centers 必须是 [x,y,z] 或 [[x,y,z],...]");
        }

        List<XyzCoord> result = new ArrayList<>();
        if (root.get(0).isNumber()) {
            result.add(toXyz(root));
        } else {
            for (JsonNode node : root) {
                result.add(toXyz(node));
            }
        }
        if (result.size() > properties.getBlobMaxCenters()) {
            throw new IllegalArgumentException("中心点数量超过上限 app.density.blob-max-centers=" + properties.getBlobMaxCenters());
        }
        return result;
    }

    private static XyzCoord toXyz(JsonNode node) {
        if (!node.isArray() || node.size() != 3) {
            throw new IllegalArgumentException("中心点必须是 3 个数值的数组：" + node);
        }
        for (JsonNode value : node) {
            if (!value.isNumber()) {
                throw new IllegalArgumentException("中心点坐标必须是数值：" + node);
            }
        }
        return new XyzCoord(node.get(0).asDouble(), node.get(1).asDouble(), node.get(2).asDouble());
    }

    private static List<Integer> ints(int[] values) {
        List<Integer> out = new ArrayList<>(values.length);
        for (int v : values) {
            out.add(v);
        }
        return out;
    }

    private static List<Double> floats(float[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (float v : values) {
            out.add((double) v);
        }
        return out;
    }

    private static List<Double> doubles(double[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values) {
            out.add(v);
        }
        return out;
    }

    private static List<Double> xyz(XyzCoord coord) {
        return List.of(coord.x(), coord.y(), coord.z());
    }

    private static List<String> nullIfEmpty(List<String> warnings) {
        return warnings.isEmpty() ? null : warnings;
    }

    private record LoadedMap(DensityMap map, boolean cached, List<String> warnings) {
    }
}
