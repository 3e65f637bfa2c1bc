package io.callscan.source;

import io.callscan.GoProjectFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModuleManifestTest {

    @TempDir
    Path tempDir;

    @Test
    void locate_findsManifestInParentDirectory() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/shop")
            .file("internal/cart/cart.go", "package cart\n");

        ModuleManifest manifest = ModuleManifest.locate(tempDir.resolve("internal/cart"));

        assertThat(manifest.modulePath()).isEqualTo("example.com/shop");
        assertThat(manifest.directory()).isEqualTo(tempDir.toAbsolutePath().normalize());
    }

    @Test
    void read_acceptsQuotedPathAndComments() throws IOException {
        Path goMod = tempDir.resolve("go.mod");
        Files.writeString(goMod, "// generated\nmodule \"github.com/acme/tool\" // main module\n\ngo 1.22\n");

        assertThat(ModuleManifest.read(goMod).modulePath()).isEqualTo("github.com/acme/tool");
    }

    @Test
    void read_failsWithoutModuleDirective() throws IOException {
        Path goMod = tempDir.resolve("go.mod");
        Files.writeString(goMod, "go 1.22\nrequire example.com/other v1.0.0\n");

        assertThatThrownBy(() -> ModuleManifest.read(goMod))
            .isInstanceOf(ManifestNotFoundException.class)
            .hasMessageContaining("module path not declared");
    }

    @Test
    void packagePathFor_appendsDirectoryRelativeToManifest() {
        ModuleManifest manifest = new ModuleManifest("example.com/shop", tempDir.toAbsolutePath().normalize());

        assertThat(manifest.packagePathFor(tempDir)).isEqualTo("example.com/shop");
        assertThat(manifest.packagePathFor(tempDir.resolve("internal/cart"))).isEqualTo("example.com/shop/internal/cart");
    }

    @Test
    void contains_matchesModuleAndSubpackagesOnly() {
        ModuleManifest manifest = new ModuleManifest("example.com/shop", tempDir);

        assertThat(manifest.contains("example.com/shop")).isTrue();
        assertThat(manifest.contains("example.com/shop/cart")).isTrue();
        assertThat(manifest.contains("example.com/shopping")).isFalse();
        assertThat(manifest.contains("fmt")).isFalse();
    }

    @Test
    void relativeDirectory_stripsModulePath() {
        ModuleManifest manifest = new ModuleManifest("example.com/shop", tempDir);

        assertThat(manifest.relativeDirectory("example.com/shop")).isEmpty();
        assertThat(manifest.relativeDirectory("example.com/shop/cmd/api")).isEqualTo("cmd/api");
        assertThat(manifest.relativeDirectory("example.com/shopping")).isEmpty();
    }
}
