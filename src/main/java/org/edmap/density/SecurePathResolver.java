package org.edmap.density;

import org.edmap.density.dto.MapRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 本地密度图文件定位：把调用方给出的 rootId + 路径解析为白名单目录内一个已存在的普通文件。
 * <p>
 * 规则：
 * <ul>
 *   <li>只能读取 {@code app.density.roots} 中的目录；{@code ../} 之类的穿越在规范化后被拒绝。</li>
 *   <li>{@code allow-symlink=false} 时，root 之下任何一级是符号链接都拒绝。</li>
 *   <li>无论是否允许链接，目标文件的真实路径都必须仍在 root 的真实路径之内（覆盖 junction）。</li>
 * </ul>
 * 解析结果 {@link MapFile} 直接交给 {@link DensityMapLoader} 读取，不再二次解析。
 */
public class SecurePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public SecurePathResolver(DensityServerProperties properties) {
        this.allowSymlink = properties.isAllowSymlink();
        this.roots = configuredRoots(properties.getRoots());
    }

    public List<MapRoot> listRoots() {
        return roots.stream().map(root -> new MapRoot(root.id(), root.path().toString())).toList();
    }

    /**
     * 定位一个密度图文件。
     *
     * @param rootId    根目录标识；为空时相对路径使用 root0，绝对路径匹配层级最深的 root
     * @param inputPath 相对 root 的路径或绝对路径
     */
    public MapFile resolveMapFile(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.density.roots）");
        }

        Path requested = Path.of(inputPath);
        Root root = selectRoot(rootId, requested);
        Path absolute = (requested.isAbsolute() ? requested : root.path().resolve(requested))
                .toAbsolutePath()
                .normalize();
        if (!absolute.startsWith(root.path())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + absolute);
        }

        String display = root.path().relativize(absolute).toString().replace('\\', '/');
        checkLinks(root, absolute);
        if (!Files.isRegularFile(absolute)) {
            throw new IllegalArgumentException("不是普通文件：" + display);
        }
        try {
            return new MapFile(root.id(), absolute, display, Files.size(absolute));
        } catch (IOException e) {
            throw new IllegalStateException("读取文件大小失败：" + display, e);
        }
    }

    private void checkLinks(Root root, Path absolute) {
        if (!allowSymlink) {
            Path current = root.path();
            for (Path name : root.path().relativize(absolute)) {
                current = current.resolve(name);
                if (Files.isSymbolicLink(current)) {
                    throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
                }
            }
        }

        Path rootReal = realPath(root.path(), "根目录不存在或无法解析：");
        Path targetReal = realPath(absolute, "路径无法解析：");
        if (!targetReal.startsWith(rootReal)) {
            throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + absolute);
        }
    }

    private static Path realPath(Path path, String message) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException(message + path, e);
        }
    }

    private Root selectRoot(String rootId, Path requested) {
        if (rootId != null && !rootId.isBlank()) {
            return roots.stream()
                    .filter(r -> r.id().equals(rootId))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("未知的 rootId：" + rootId));
        }
        if (!requested.isAbsolute()) {
            return roots.get(0);
        }
        Path absolute = requested.normalize();
        return roots.stream()
                .filter(r -> absolute.startsWith(r.path()))
                .max(Comparator.comparingInt(r -> r.path().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> configuredRoots(List<String> configured) {
        if (configured == null) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.density.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return List.copyOf(result);
    }

    private record Root(String id, Path path) {
    }

    /**
     * 已通过白名单校验的密度图文件。
     *
     * @param rootId       所属根目录
     * @param absolutePath 规范化后的绝对路径
     * @param displayPath  相对 root 的显示路径（统一使用 / 分隔）
     * @param size         文件字节数
     */
    public record MapFile(String rootId, Path absolutePath, String displayPath, long size) {
    }
}
