package org.edmap.mcp;

import org.edmap.density.DensityMapCache;
import org.edmap.density.DensityMapLoader;
import org.edmap.density.DensityServerProperties;
import org.edmap.density.SecurePathResolver;
import org.edmap.density.dto.BlobSearchResult;
import org.edmap.density.dto.MapHeaderResult;
import org.edmap.density.dto.MapRootsResult;
import org.edmap.density.dto.MapStatisticsResult;
import org.edmap.density.dto.PointDensityResult;
import org.edmap.density.dto.SphereQueryResult;
import org.edmap.density.map.MapFixture;
import org.edmap.density.map.XyzCoord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DensityMcpToolsTest {

    @TempDir
    Path tempDir;

    private DensityServerProperties properties;
    private DensityMcpTools tools;

    @BeforeEach
    void setUp() throws IOException {
        // 10x10x10，网格间距 1Å
        Files.write(tempDir.resolve("model.ccp4"), MapFixture.create()
                .extent(10, 10, 10)
                .intervals(10, 10, 10)
                .cell(10f, 10f, 10f)
                .voxel(5, 5, 5, 3f)
                .voxel(6, 5, 5, 2f)
                .voxel(2, 2, 2, -4f)
                .voxel(8, 8, 8, 1f)
                .build());
        // 只覆盖半个晶胞
        Files.write(tempDir.resolve("partial.ccp4"), MapFixture.create()
                .extent(2, 2, 2)
                .intervals(4, 4, 4)
                .axisMapping(0, 0, 0)
                .values(1f, 1f, 1f, 1f, 1f, 1f, 1f, 1f)
                .build());

        properties = new DensityServerProperties();
        properties.setRoots(List.of(tempDir.toString()));
        SecurePathResolver resolver = new SecurePathResolver(properties);
        tools = new DensityMcpTools(properties, resolver, new DensityMapLoader(properties, resolver),
                new DensityMapCache(properties));
    }

    @Test
    void listRoots_reportsRootsAndPdbTemplate() {
        MapRootsResult result = tools.listRoots();

        assertThat(result.roots()).hasSize(1);
        assertThat(result.roots().get(0).rootId()).isEqualTo("root0");
        assertThat(result.remoteEnabled()).isTrue();
        assertThat(result.pdbUrlTemplate()).isEqualTo("https://www.ebi.ac.uk/pdbe/coordinates/files/{id}.ccp4");
    }

    @Test
    void readHeader_reportsDerivedValuesAndUsesCache() {
        MapHeaderResult first = tools.readHeader(null, "model.ccp4", null, null, null);

        assertThat(first.source()).isEqualTo("root0:model.ccp4");
        assertThat(first.cached()).isFalse();
        assertThat(first.byteOrder()).isEqualTo("LITTLE_ENDIAN");
        assertThat(first.ncrs()).containsExactly(10, 10, 10);
        assertThat(first.gridSpacing()).containsExactly(1.0, 1.0, 1.0);
        assertThat(first.unitVolume()).isCloseTo(1.0, within(1e-9));
        assertThat(first.orthogonal()).isTrue();
        assertThat(first.warnings()).isNull();

        MapHeaderResult second = tools.readHeader(null, "./model.ccp4", null, null, null);
        assertThat(second.cached()).isTrue();
        assertThat(second.warnings()).anyMatch(w -> w.contains("缓存"));

        MapHeaderResult refreshed = tools.readHeader(null, "model.ccp4", null, null, true);
        assertThat(refreshed.cached()).isFalse();
    }

    @Test
    void readHeader_surfacesDefaultFixWarnings() {
        MapHeaderResult result = tools.readHeader(null, "partial.ccp4", null, null, null);

        assertThat(result.axisMapping()).containsExactly(1, 2, 3);
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void everyTool_requiresExactlyOneSource() {
        assertThatThrownBy(() -> tools.statistics(null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("只能指定一个");
        assertThatThrownBy(() -> tools.statistics(null, "model.ccp4", "1abc", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pointDensity_returnsWrappedCoordinateAndDensity() {
        PointDensityResult result = tools.pointDensity(null, "model.ccp4", null, null, 16.0, 5.0, 5.0, null);

        assertThat(result.crs()).containsExactly(16, 5, 5);
        assertThat(result.wrappedCrs()).containsExactly(6, 5, 5);
        assertThat(result.valid()).isTrue();
        assertThat(result.density()).isEqualTo(2.0);
    }

    @Test
    void pointDensity_outsidePartialMapIsZeroNotError() {
        PointDensityResult result = tools.pointDensity(null, "partial.ccp4", null, null, 4.0, 0.0, 0.0, null);

        assertThat(result.crs()).containsExactly(2, 0, 0);
        assertThat(result.valid()).isFalse();
        assertThat(result.wrappedCrs()).isNull();
        assertThat(result.density()).isZero();
    }

    @Test
    void pointDensity_rejectsPositionBeyondGridIndexRange() {
        assertThatThrownBy(() -> tools.pointDensity(null, "model.ccp4", null, null, 2e12, 0.0, 0.0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("网格范围");
    }

    @Test
    void sphere_truncatesPointListButKeepsTotals() {
        SphereQueryResult result = tools.sphere(null, "model.ccp4", null, null, 5.0, 5.0, 5.0, 1.0, null, 3, null);

        assertThat(result.pointCount()).isEqualTo(7);
        assertThat(result.totalDensity()).isEqualTo(5.0);
        assertThat(result.points()).hasSize(3);
        assertThat(result.truncated()).isTrue();
        assertThat(result.cutoff()).isZero();
    }

    @Test
    void sphere_rejectsRadiusAboveLimit() {
        assertThatThrownBy(() -> tools.sphere(null, "model.ccp4", null, null, 5.0, 5.0, 5.0, 25.0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sphere-max-radius");
    }

    @Test
    void findBlobs_sortsByAbsoluteTotalDensity() {
        BlobSearchResult result = tools.findBlobs(null, "model.ccp4", null, null,
                "[[8,8,8],[5,5,5]]", 2.0, 0.5, null, null);

        assertThat(result.centerCount()).isEqualTo(2);
        assertThat(result.candidatePoints()).isEqualTo(3);
        assertThat(result.blobCount()).isEqualTo(2);
        assertThat(result.truncated()).isFalse();
        assertThat(result.blobs().get(0).pointCount()).isEqualTo(2);
        assertThat(result.blobs().get(0).totalDensity()).isEqualTo(5.0);
        assertThat(result.blobs().get(0).centroid().get(0)).isCloseTo(5.4, within(1e-9));
        assertThat(result.blobs().get(1).totalDensity()).isEqualTo(1.0);
        assertThat(result.blobs().get(1).centroid()).containsExactly(8.0, 8.0, 8.0);
    }

    @Test
    void findBlobs_withoutMergeKeepsPerCenterBlobs() {
        String centers = "[[5,5,5],[6,5,5]]";

        BlobSearchResult merged = tools.findBlobs(null, "model.ccp4", null, null, centers, 2.0, 0.5, null, null);
        BlobSearchResult separate = tools.findBlobs(null, "model.ccp4", null, null, centers, 2.0, 0.5, false, null);

        assertThat(merged.blobCount()).isEqualTo(1);
        assertThat(separate.blobCount()).isEqualTo(2);
        assertThat(separate.blobs()).allMatch(b -> b.pointCount() == 2);
    }

    @Test
    void findBlobs_acceptsSingleCenterAndNegativeCutoff() {
        BlobSearchResult result = tools.findBlobs(null, "model.ccp4", null, null, "[2, 2, 2]", 1.0, -1.0, null, null);

        assertThat(result.blobCount()).isEqualTo(1);
        assertThat(result.blobs().get(0).totalDensity()).isEqualTo(-4.0);
    }

    @Test
    void findBlobs_skipsZeroDensityComponentsWithWarning() {
        String centers = "[[5,5,5],[1,1,1]]";

        BlobSearchResult merged = tools.findBlobs(null, "model.ccp4", null, null, centers, 1.0, null, null, null);
        BlobSearchResult separate = tools.findBlobs(null, "model.ccp4", null, null, centers, 1.0, null, false, null);

        assertThat(merged.blobCount()).isEqualTo(1);
        assertThat(merged.blobs().get(0).totalDensity()).isEqualTo(5.0);
        assertThat(merged.warnings()).anyMatch(w -> w.contains("1 个连通分量") && w.contains("已跳过"));
        assertThat(separate.blobCount()).isEqualTo(1);
        assertThat(separate.warnings()).anyMatch(w -> w.contains("已跳过"));
    }

    @Test
    void findBlobs_truncatesToConfiguredMaximum() {
        properties.setBlobMaxResults(1);

        BlobSearchResult result = tools.findBlobs(null, "model.ccp4", null, null,
                "[[8,8,8],[5,5,5]]", 2.0, 0.5, null, null);

        assertThat(result.blobCount()).isEqualTo(2);
        assertThat(result.blobs()).hasSize(1);
        assertThat(result.truncated()).isTrue();
        assertThat(result.warnings()).anyMatch(w -> w.contains("blob-max-results"));
    }

    @Test
    void parseCenters_rejectsMalformedInput() {
        assertThat(tools.parseCenters("[[1,2,3.5]]")).containsExactly(new XyzCoord(1, 2, 3.5));

        assertThatThrownBy(() -> tools.parseCenters("[1,2]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.parseCenters("[[1,2,\"x\"]]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.parseCenters("not json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.parseCenters("[]")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statistics_computesOverAllVoxels() {
        MapStatisticsResult result = tools.statistics(null, "model.ccp4", null, null, null);

        assertThat(result.voxelCount()).isEqualTo(1000);
        assertThat(result.mean()).isCloseTo(0.002, within(1e-12));
        assertThat(result.headerMax()).isEqualTo(5.0);
        assertThat(result.headerRms()).isEqualTo(1.25);
    }
}
