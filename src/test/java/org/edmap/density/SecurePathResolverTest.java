package org.edmap.density;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurePathResolverTest {

    @TempDir
    Path tempDir;

    private SecurePathResolver resolver(boolean allowSymlink, Path... roots) {
        DensityServerProperties properties = new DensityServerProperties();
        properties.setRoots(Arrays.stream(roots).map(Path::toString).toList());
        properties.setAllowSymlink(allowSymlink);
        return new SecurePathResolver(properties);
    }

    @Test
    void resolveMapFile_relativePathUsesFirstRoot() throws IOException {
        Files.createDirectories(tempDir.resolve("maps"));
        Files.write(tempDir.resolve("maps/1abc.ccp4"), new byte[]{1});

        SecurePathResolver.MapFile resolved = resolver(false, tempDir).resolveMapFile(null, "maps/1abc.ccp4");

        assertThat(resolved.rootId()).isEqualTo("root0");
        assertThat(resolved.displayPath()).isEqualTo("maps/1abc.ccp4");
        assertThat(resolved.absolutePath()).isEqualTo(tempDir.resolve("maps/1abc.ccp4").toAbsolutePath().normalize());
        assertThat(resolved.size()).isEqualTo(1L);
    }

    @Test
    void resolveMapFile_rejectsDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve("maps"));

        assertThatThrownBy(() -> resolver(false, tempDir).resolveMapFile(null, "maps"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不是普通文件");
    }

    @Test
    void resolveMapFile_absolutePathSelectsMostSpecificRoot() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Path file = Files.write(nested.resolve("2xyz.ccp4"), new byte[]{1});

        SecurePathResolver.MapFile resolved = resolver(false, tempDir, nested).resolveMapFile(null, file.toString());

        assertThat(resolved.rootId()).isEqualTo("root1");
        assertThat(resolved.displayPath()).isEqualTo("2xyz.ccp4");
    }

    @Test
    void resolveMapFile_rejectsTraversalOutsideRoot() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Files.write(tempDir.resolve("secret.ccp4"), new byte[]{1});

        assertThatThrownBy(() -> resolver(false, root).resolveMapFile("root0", "../secret.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("根目录");
    }

    @Test
    void resolveMapFile_rejectsMissingFileAndUnknownRoot() {
        SecurePathResolver resolver = resolver(false, tempDir);

        assertThatThrownBy(() -> resolver.resolveMapFile(null, "missing.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不存在");
        assertThatThrownBy(() -> resolver.resolveMapFile("root7", "missing.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rootId");
        assertThatThrownBy(() -> resolver.resolveMapFile(null, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveMapFile_rejectsSymlinksUnlessAllowedAndNeverAllowsEscape() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Path inside = Files.write(root.resolve("real.ccp4"), new byte[]{1});
        Path outside = Files.write(tempDir.resolve("outside.ccp4"), new byte[]{1});
        try {
            Files.createSymbolicLink(root.resolve("link.ccp4"), inside);
            Files.createSymbolicLink(root.resolve("escape.ccp4"), outside);
        } catch (IOException | UnsupportedOperationException e) {
            Assumptions.abort("当前文件系统不支持创建符号链接：" + e.getMessage());
        }

        assertThatThrownBy(() -> resolver(false, root).resolveMapFile(null, "link.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("符号链接");

        SecurePathResolver permissive = resolver(true, root);
        assertThat(permissive.resolveMapFile(null, "link.ccp4").displayPath()).isEqualTo("link.ccp4");
        assertThatThrownBy(() -> permissive.resolveMapFile(null, "escape.ccp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("逃逸");
    }

    @Test
    void listRoots_assignsSequentialIds() {
        Path other = tempDir.resolve("other");

        assertThat(resolver(false, tempDir, other).listRoots())
                .extracting(r -> r.rootId() + "=" + r.path())
                .containsExactly(
                        "root0=" + tempDir.toAbsolutePath().normalize(),
                        "root1=" + other.toAbsolutePath().normalize()
                );
    }

    @Test
    void resolveMapFile_failsWhenNoRootsConfigured() {
        DensityServerProperties properties = new DensityServerProperties();
        properties.setRoots(List.of());

        assertThatThrownBy(() -> new SecurePathResolver(properties).resolveMapFile(null, "a.ccp4"))
                .isInstanceOf(IllegalStateException.class);
    }
}
