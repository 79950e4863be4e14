package org.edmap.density;

import org.edmap.density.map.Ccp4MapParser;
import org.edmap.density.map.DensityMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 密度图字节获取：本地文件（白名单内）、URL、PDB id 三种来源，最终都交给 {@link Ccp4MapParser} 解析。
 * <p>
 * 所有来源都受 {@code app.density.max-map-bytes} 限制，避免一次加载超大文件占满内存。
 */
public class DensityMapLoader {

    private static final Logger log = LoggerFactory.getLogger(DensityMapLoader.class);

    private static final Pattern PDB_ID = Pattern.compile("[0-9][A-Za-z0-9]{3}");

    private final DensityServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final HttpClient httpClient;

    public DensityMapLoader(DensityServerProperties properties, SecurePathResolver pathResolver) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(15))
                .build();
    }

    /**
     * 读取白名单目录内的本地密度图文件。
     */
    public DensityMap readFile(String rootId, String path) {
        return readFile(pathResolver.resolveMapFile(rootId, path));
    }

    /**
     * 读取已经通过 {@link SecurePathResolver} 校验的文件。
     */
    public DensityMap readFile(SecurePathResolver.MapFile file) {
        long maxBytes = properties.getMaxMapBytes().toBytes();
        if (file.size() > maxBytes) {
            throw new IllegalArgumentException("密度图文件过大：" + file.size() + " 字节（上限 " + maxBytes + "）");
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file.absolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("读取密度图文件失败：" + file.displayPath(), e);
        }
        log.info("读取本地密度图 {}（{} 字节）", file.displayPath(), bytes.length);
        return Ccp4MapParser.parse(bytes, file.rootId() + ":" + file.displayPath());
    }

    /**
     * 按 PDB id 从 {@code pdbUrlPrefix + 小写 id + pdbUrlSuffix} 下载密度图。
     */
    public DensityMap readPdbId(String pdbId) {
        return readUrl(pdbUrl(pdbId), pdbId.toLowerCase(Locale.ROOT));
    }

    public DensityMap readUrl(String url) {
        return readUrl(url, url);
    }

    String pdbUrl(String pdbId) {
        if (pdbId == null || !PDB_ID.matcher(pdbId.trim()).matches()) {
            throw new IllegalArgumentException("不是合法的 PDB id（4 位，首位为数字）：" + pdbId);
        }
        return properties.getPdbUrlPrefix() + pdbId.trim().toLowerCase(Locale.ROOT) + properties.getPdbUrlSuffix();
    }

    private DensityMap readUrl(String url, String source) {
        if (!properties.isRemoteEnabled()) {
            throw new IllegalArgumentException("未开启远程下载（app.density.remote-enabled=false）：" + url);
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URL 不合法：" + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("仅支持 http/https 地址：" + url);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.getHttpTimeout())
                .GET()
                .build();
        byte[] bytes;
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() != 200) {
                    throw new IllegalStateException("下载密度图失败：HTTP " + response.statusCode() + " " + url);
                }
                bytes = readLimited(body, properties.getMaxMapBytes().toBytes(), url);
            }
        } catch (IOException e) {
            throw new IllegalStateException("下载密度图失败：" + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("下载密度图被中断：" + url, e);
        }
        log.info("已下载密度图 {}（{} 字节）", url, bytes.length);
        return Ccp4MapParser.parse(bytes, source);
    }

    static byte[] readLimited(InputStream in, long maxBytes, String label) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[64 * 1024];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            total += read;
            if (total > maxBytes) {
                throw new IllegalArgumentException("密度图过大，超过上限 " + maxBytes + " 字节：" + label);
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }
}
