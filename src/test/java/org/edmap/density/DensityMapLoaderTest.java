package org.edmap.density;

import org.edmap.density.map.DensityMap;
import org.edmap.density.map.MapFixture;
import org.edmap.density.map.MapFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DensityMapLoaderTest {

    @TempDir
    Path tempDir;

    private DensityServerProperties properties() {
        DensityServerProperties properties = new DensityServerProperties();
        properties.setRoots(List.of(tempDir.toString()));
        return properties;
    }

    private static DensityMapLoader loader(DensityServerProperties properties) {
        return new DensityMapLoader(properties, new SecurePathResolver(properties));
    }

    @Test
    void readFile_parsesMapInsideRoot() throws IOException {
        Files.write(tempDir.resolve("1abc.ccp4"), MapFixture.create().voxel(1, 2, 3, 7f).build());

        DensityMap map = loader(properties()).readFile(null, "1abc.ccp4");

        assertThat(map.source()).isEqualTo("root0:1abc.ccp4");
        assertThat(map.grid().valueAt(1, 2, 3)).isEqualTo(7f);
    }

    @Test
    void readFile_propagatesFormatErrors() throws IOException {
        Files.write(tempDir.resolve("broken.ccp4"), new byte[2048]);

        assertThatThrownBy(() -> loader(properties()).readFile(null, "broken.ccp4"))
                .isInstanceOf(MapFormatException.class);
    }

    @Test
    void readFile_rejectsFilesOverSizeLimit() throws IOException {
        Files.write(tempDir.resolve("big.ccp4"), MapFixture.create().build());
        DensityServerProperties properties = properties();
        properties.setMaxMapBytes(DataSize.ofBytes(1024));

        assertThatThrownBy(() -> loader(properties).readFile(null, "big.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("过大");
    }

    @Test
    void readFile_rejectsDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve("maps"));

        assertThatThrownBy(() -> loader(properties()).readFile(null, "maps"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不是普通文件");
    }

    @Test
    void readFile_readsAlreadyResolvedFileWithoutConsultingRootsAgain() throws IOException {
        Files.write(tempDir.resolve("1abc.ccp4"), MapFixture.create().voxel(0, 0, 0, 4f).build());
        SecurePathResolver.MapFile file = new SecurePathResolver(properties()).resolveMapFile(null, "1abc.ccp4");

        DensityServerProperties noRoots = new DensityServerProperties();
        noRoots.setRoots(List.of());
        DensityMap map = loader(noRoots).readFile(file);

        assertThat(map.source()).isEqualTo("root0:1abc.ccp4");
        assertThat(map.grid().valueAt(0, 0, 0)).isEqualTo(4f);
    }

    @Test
    void pdbUrl_lowercasesIdBetweenPrefixAndSuffix() {
        DensityServerProperties properties = properties();
        properties.setPdbUrlPrefix("https://maps.example.org/");
        properties.setPdbUrlSuffix("_2fofc.ccp4");

        assertThat(loader(properties).pdbUrl(" 1ABC ")).isEqualTo("https://maps.example.org/1abc_2fofc.ccp4");
    }

    @Test
    void readPdbId_rejectsMalformedIds() {
        DensityMapLoader loader = loader(properties());

        assertThatThrownBy(() -> loader.readPdbId("abcd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.readPdbId("1abcd")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readUrl_requiresRemoteAccessAndHttpScheme() {
        DensityServerProperties properties = properties();

        assertThatThrownBy(() -> loader(properties).readUrl("ftp://example.org/1abc.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("http/https");

        properties.setRemoteEnabled(false);
        assertThatThrownBy(() -> loader(properties).readUrl("https://example.org/1abc.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("remote-enabled");
    }

    @Test
    void readLimited_stopsAtLimit() throws IOException {
        byte[] data = new byte[100];

        assertThat(DensityMapLoader.readLimited(new ByteArrayInputStream(data), 100, "x")).hasSize(100);
        assertThatThrownBy(() -> DensityMapLoader.readLimited(new ByteArrayInputStream(data), 99, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
