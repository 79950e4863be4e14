package org.edmap.density;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 密度图 MCP Server 的业务配置（{@code app.density.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取本地密度图的根目录白名单。</li>
 *   <li>通过 {@link #remoteEnabled} 与 {@link #pdbUrlPrefix}/{@link #pdbUrlSuffix} 控制按 URL/PDB id 远程下载。</li>
 *   <li>通过各种 max 配置控制单次查询的工作量与返回体积。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.density")
public class DensityServerProperties {

    /**
     * 允许读取密度图文件的根目录白名单（自动分配 rootId：root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 是否允许按 URL / PDB id 远程下载密度图。
     */
    private boolean remoteEnabled = true;

    /**
     * 按 PDB id 下载时的 URL 前缀；完整地址为 {@code prefix + 小写 id + suffix}。
     */
    @NotBlank
    private String pdbUrlPrefix = "https://www.ebi.ac.uk/pdbe/coordinates/files/";

    @NotNull
    private String pdbUrlSuffix = ".ccp4";

    /**
     * 远程下载的请求超时。
     */
    @NotNull
    private Duration httpTimeout = Duration.ofSeconds(60);

    /**
     * 单个密度图（本地文件或下载内容）允许的最大字节数。
     */
    @NotNull
    private DataSize maxMapBytes = DataSize.ofMegabytes(512);

    /**
     * 是否缓存已解析的密度图。
     * <p>
     * 说明：同一来源的多次查询（点/球/blob）可直接复用解析结果，避免重复下载与解码。
     */
    private boolean cacheEnabled = true;

    @NotNull
    private Duration cacheTtl = Duration.ofMinutes(30);

    /**
     * 最多缓存多少个密度图（LRU 淘汰）。单个密度图可能占用数百 MB 内存，默认值偏保守。
     */
    @Min(1)
    @Max(1_000)
    private int cacheMaxMaps = 4;

    /**
     * 球查询允许的最大半径（Å）。
     */
    @DecimalMin("0.0")
    @DecimalMax("1000.0")
    private double sphereMaxRadius = 20.0;

    /**
     * {@code density_sphere} 默认返回的网格点数。
     */
    @Min(0)
    @Max(1_000_000)
    private int sphereDefaultMaxPoints = 500;

    /**
     * {@code density_sphere} 允许返回的最大网格点数（上限保护）。
     */
    @Min(0)
    @Max(1_000_000)
    private int sphereMaxPoints = 20_000;

    /**
     * {@code density_find_blobs} 单次允许的最大中心点数。
     */
    @Min(1)
    @Max(1_000_000)
    private int blobMaxCenters = 10_000;

    /**
     * {@code density_find_blobs} 最多返回的 blob 数。
     */
    @Min(1)
    @Max(1_000_000)
    private int blobMaxResults = 1_000;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public boolean isRemoteEnabled() {
        return remoteEnabled;
    }

    public void setRemoteEnabled(boolean remoteEnabled) {
        this.remoteEnabled = remoteEnabled;
    }

    public String getPdbUrlPrefix() {
        return pdbUrlPrefix;
    }

    public void setPdbUrlPrefix(String pdbUrlPrefix) {
        this.pdbUrlPrefix = pdbUrlPrefix;
    }

    public String getPdbUrlSuffix() {
        return pdbUrlSuffix;
    }

    public void setPdbUrlSuffix(String pdbUrlSuffix) {
        this.pdbUrlSuffix = pdbUrlSuffix;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public void setHttpTimeout(Duration httpTimeout) {
        this.httpTimeout = httpTimeout;
    }

    public DataSize getMaxMapBytes() {
        return maxMapBytes;
    }

    public void setMaxMapBytes(DataSize maxMapBytes) {
        this.maxMapBytes = maxMapBytes;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public int getCacheMaxMaps() {
        return cacheMaxMaps;
    }

    public void setCacheMaxMaps(int cacheMaxMaps) {
        this.cacheMaxMaps = cacheMaxMaps;
    }

    public double getSphereMaxRadius() {
        return sphereMaxRadius;
    }

    public void setSphereMaxRadius(double sphereMaxRadius) {
        this.sphereMaxRadius = sphereMaxRadius;
    }

    public int getSphereDefaultMaxPoints() {
        return sphereDefaultMaxPoints;
    }

    public void setSphereDefaultMaxPoints(int sphereDefaultMaxPoints) {
        this.sphereDefaultMaxPoints = sphereDefaultMaxPoints;
    }

    public int getSphereMaxPoints() {
        return sphereMaxPoints;
    }

    public void setSphereMaxPoints(int sphereMaxPoints) {
        this.sphereMaxPoints = sphereMaxPoints;
    }

    public int getBlobMaxCenters() {
        return blobMaxCenters;
    }

    public void setBlobMaxCenters(int blobMaxCenters) {
        this.blobMaxCenters = blobMaxCenters;
    }

    public int getBlobMaxResults() {
        return blobMaxResults;
    }

    public void setBlobMaxResults(int blobMaxResults) {
        this.blobMaxResults = blobMaxResults;
    }
}
