package org.edmap.density.blob;

import org.edmap.density.map.DensityGrid;
import org.edmap.density.map.GridCoord;
import org.edmap.density.map.MapFixture;
import org.edmap.density.map.XyzCoord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BlobBuilderTest {

    /**
     * 10x10x10，网格间距 1Å：两团正密度 + 一个负密度点。
     */
    private static DensityGrid grid() {
        return MapFixture.create()
                .extent(10, 10, 10)
                .intervals(10, 10, 10)
                .cell(10f, 10f, 10f)
                .voxel(2, 2, 2, 1f)
                .voxel(3, 3, 3, 3f)
                .voxel(7, 7, 7, 2f)
                .voxel(5, 1, 8, -2f)
                .parse()
                .grid();
    }

    @Test
    void connectedComponents_usesTwentySixNeighbourhood() {
        List<Set<GridCoord>> components = BlobBuilder.connectedComponents(List.of(
                new GridCoord(0, 0, 0),
                new GridCoord(5, 5, 5),
                new GridCoord(1, 1, 1),
                new GridCoord(2, 2, 2),
                new GridCoord(5, 5, 7)
        ));

        assertThat(components).hasSize(3);
        assertThat(components.get(0)).containsExactly(
                new GridCoord(0, 0, 0), new GridCoord(1, 1, 1), new GridCoord(2, 2, 2));
        assertThat(components.get(1)).containsExactly(new GridCoord(5, 5, 5));
        assertThat(components.get(2)).containsExactly(new GridCoord(5, 5, 7));
    }

    @Test
    void connectedComponents_ignoresDuplicateCoordinates() {
        List<Set<GridCoord>> components = BlobBuilder.connectedComponents(List.of(
                new GridCoord(1, 1, 1), new GridCoord(1, 1, 1), new GridCoord(1, 1, 2)));

        assertThat(components).hasSize(1);
        assertThat(components.get(0)).hasSize(2);
    }

    @Test
    void buildBlobs_computesAggregatesPerComponent() {
        DensityGrid grid = grid();

        List<DensityBlob> blobs = BlobBuilder.buildBlobs(grid, List.of(
                new GridCoord(2, 2, 2), new GridCoord(3, 3, 3), new GridCoord(7, 7, 7)));

        assertThat(blobs).hasSize(2);
        DensityBlob pair = blobs.get(0);
        assertThat(pair.size()).isEqualTo(2);
        assertThat(pair.totalDensity()).isEqualTo(4.0);
        assertThat(pair.volume()).isCloseTo(2 * grid.header().unitVolume(), within(1e-12));
        assertThat(pair.centroid().x()).isCloseTo(2.75, within(1e-12));
        assertThat(pair.coordCenter().x()).isCloseTo(2.5, within(1e-12));
        assertThat(pair.header()).isSameAs(grid.header());

        DensityBlob single = blobs.get(1);
        assertThat(single.centroid()).isEqualTo(new XyzCoord(7.0, 7.0, 7.0));
    }

    @Test
    void findAberrantBlobs_unionsSphereResultsFromSeveralCenters() {
        DensityGrid grid = grid();

        List<DensityBlob> blobs = BlobBuilder.findAberrantBlobs(grid,
                List.of(new XyzCoord(2, 2, 2), new XyzCoord(3, 3, 3), new XyzCoord(7, 7, 7)), 2.0, 0.5);

        assertThat(blobs).hasSize(2);
        assertThat(blobs.get(0).crsSet()).containsExactlyInAnyOrder(new GridCoord(2, 2, 2), new GridCoord(3, 3, 3));
        assertThat(blobs.get(1).crsSet()).containsExactly(new GridCoord(7, 7, 7));
    }

    @Test
    void findAberrantBlobs_negativeCutoffFindsNegativeDensity() {
        List<DensityBlob> blobs = BlobBuilder.findAberrantBlobs(grid(), List.of(new XyzCoord(5, 1, 8)), 3.0, -0.5);

        assertThat(blobs).hasSize(1);
        assertThat(blobs.get(0).totalDensity()).isEqualTo(-2.0);
        assertThat(blobs.get(0).centroid()).isEqualTo(new XyzCoord(5.0, 1.0, 8.0));
    }

    @Test
    void buildBlobs_zeroDensityComponentIsDegenerate() {
        DensityGrid grid = grid();

        assertThatThrownBy(() -> BlobBuilder.buildBlobs(grid, List.of(new GridCoord(0, 0, 0))))
                .isInstanceOf(DegenerateBlobException.class);
    }

    @Test
    void fromCoordinates_rejectsEmptySet() {
        assertThatThrownBy(() -> DensityBlob.fromCoordinates(grid(), List.of()))
                .isInstanceOf(DegenerateBlobException.class);
    }

    @Test
    void singleVoxelScenario_blobMatchesVoxel() {
        DensityGrid grid = MapFixture.create()
                .extent(2, 2, 2)
                .intervals(2, 2, 2)
                .cell(2f, 2f, 2f)
                .voxel(0, 0, 0, 5f)
                .parse()
                .grid();

        List<DensityBlob> blobs = BlobBuilder.buildBlobs(grid, grid.sphereQuery(XyzCoord.ZERO, 0.5, 0.1));

        assertThat(blobs).hasSize(1);
        assertThat(blobs.get(0).totalDensity()).isEqualTo(5.0);
        assertThat(blobs.get(0).centroid()).isEqualTo(XyzCoord.ZERO);
        assertThat(blobs.get(0).volume()).isEqualTo(grid.header().unitVolume());
    }
}
