package io.callscan.source;

import io.callscan.GoProjectFixture;
import io.callscan.ScanConfig;
import io.callscan.model.FunctionDescriptor;
import io.callscan.model.Parameter;
import io.callscan.model.ScanWarning;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceIndexerTest {

    @TempDir
    Path tempDir;

    @Test
    void index_extractsSignatureAndSpan() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/shop")
            .file("cart/cart.go", """
                package cart

                // Total sums the prices.
                func Total(prices []int, discount float64, extra ...int) (sum int, err error) {
                    return 0, nil
                }
                """);

        ProjectIndex index = new SourceIndexer().index(tempDir);

        FunctionDescriptor total = index.registry().get("cart.Total").orElseThrow();
        assertThat(total.packagePath()).isEqualTo("example.com/shop/cart");
        assertThat(total.startLine()).isEqualTo(4);
        assertThat(total.endLine()).isEqualTo(6);
        assertThat(total.parameters()).containsExactly(
            new Parameter("prices", "[]int"),
            new Parameter("discount", "float64"),
            new Parameter("extra", "...int"));
        assertThat(total.returns()).containsExactly("sum int", "err error");
        assertThat(total.hasBody()).isTrue();
    }

    @Test
    void index_groupedParametersShareTheirType() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/geo")
            .file("geo.go", """
                package geo

                func Distance(x1, y1, x2, y2 float64) float64 { return 0 }

                func Unnamed(int, string) {}
                """);

        ProjectIndex index = new SourceIndexer().index(tempDir);

        assertThat(index.registry().get("geo.Distance").orElseThrow().renderedParameters())
            .containsExactly("x1 float64", "y1 float64", "x2 float64", "y2 float64");
        assertThat(index.registry().get("geo.Distance").orElseThrow().returns()).containsExactly("float64");
        assertThat(index.registry().get("geo.Unnamed").orElseThrow().renderedParameters())
            .containsExactly("int", "string");
    }

    @Test
    void index_pointerAndValueReceiversShareIdentity() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/store")
            .file("store.go", """
                package store

                type Cache[K comparable] struct{}

                func (c *Cache[K]) Get(key K) {}

                func (c Cache[K]) Len() int { return 0 }
                """);

        ProjectIndex index = new SourceIndexer().index(tempDir);

        assertThat(index.registry().contains("store/Cache.Get")).isTrue();
        assertThat(index.registry().contains("store/Cache.Len")).isTrue();
        assertThat(index.registry().get("store/Cache.Get").orElseThrow().receiver()).isEqualTo("Cache");
    }

    @Test
    void index_sameMethodOnSameTypeNameInTwoPackagesStaysDistinct() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/app")
            .file("x/worker.go", """
                package x

                type Worker struct{}

                func (w *Worker) Run() {}
                """)
            .file("y/worker.go", """
                package y

                type Worker struct{}

                func (w Worker) Run() {}
                """);

        ProjectIndex index = new SourceIndexer().index(tempDir);

        assertThat(index.registry().contains("x/Worker.Run")).isTrue();
        assertThat(index.registry().contains("y/Worker.Run")).isTrue();
        assertThat(index.registry().size()).isEqualTo(2);
        assertThat(index.warnings()).isEmpty();
    }

    @Test
    void index_skipsVendorTestdataAndTestFiles() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/app")
            .file("main.go", "package main\n\nfunc main() {}\n")
            .file("main_test.go", "package main\n\nfunc TestMain() {}\n")
            .file("vendor/lib/lib.go", "package lib\n\nfunc Vendored() {}\n")
            .file("testdata/fixture.go", "package fixture\n\nfunc Fixture() {}\n")
            .file(".cache/hidden.go", "package hidden\n\nfunc Hidden() {}\n");

        ProjectIndex index = new SourceIndexer().index(tempDir);

        assertThat(index.registry().all()).extracting(FunctionDescriptor::identity).containsExactly("main.main");
        assertThat(index.files()).hasSize(1);
    }

    @Test
    void index_includesTestFilesWhenConfigured() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/app")
            .file("main.go", "package main\n\nfunc main() {}\n")
            .file("main_test.go", "package main\n\nfunc TestMain() {}\n");

        ProjectIndex index = new SourceIndexer(ScanConfig.defaults().withIncludeTestFiles(true)).index(tempDir);

        assertThat(index.registry().contains("main.TestMain")).isTrue();
    }

    @Test
    void index_skipsBrokenFileWithWarning() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/app")
            .file("good.go", "package main\n\nfunc Good() {}\n")
            .file("broken.go", "package main\n\nfunc Broken( {\n");

        ProjectIndex index = new SourceIndexer().index(tempDir);

        assertThat(index.registry().contains("main.Good")).isTrue();
        assertThat(index.registry().contains("main.Broken")).isFalse();
        assertThat(index.warnings()).hasSize(1);
        ScanWarning warning = index.warnings().get(0);
        assertThat(warning.file().getFileName().toString()).isEqualTo("broken.go");
        assertThat(warning.isFileLevel()).isTrue();
    }

    @Test
    void index_firstDeclarationWinsOnCollision() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/app")
            .file("a.go", "package main\n\nfunc helper() {}\n")
            .file("b.go", "package main\n\n\nfunc helper() {}\n");

        ProjectIndex index = new SourceIndexer().index(tempDir);

        FunctionDescriptor helper = index.registry().get("main.helper").orElseThrow();
        assertThat(helper.fileName()).isEqualTo("a.go");
        assertThat(helper.startLine()).isEqualTo(3);
        assertThat(index.warnings()).singleElement()
            .satisfies(w -> assertThat(w.function()).isEqualTo("main.helper"));
    }

    @Test
    void index_packagesSharingANameAreQualifiedByDirectory() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/app")
            .file("main.go", "package main\n\nfunc main() {}\n")
            .file("cmd/a/main.go", "package main\n\nfunc main() {}\n")
            .file("cmd/b/main.go", """
                package main

                type Server struct{}

                func main() {}

                func (s *Server) Run() {}
                """)
            .file("store/store.go", "package store\n\nfunc Open() {}\n");

        ProjectIndex index = new SourceIndexer().index(tempDir);

        assertThat(index.registry().all()).extracting(FunctionDescriptor::identity).containsExactly(
            "cmd/a/main.main", "cmd/b/main.main", "cmd/b/main/Server.Run", "main.main", "store.Open");
        assertThat(index.registry().get("cmd/b/main.main").orElseThrow().packagePath())
            .isEqualTo("example.com/app/cmd/b");
        assertThat(index.registry().get("main.main").orElseThrow().packagePath()).isEqualTo("example.com/app");
        assertThat(index.warnings()).isEmpty();
    }

    @Test
    void index_failsWhenRootIsMissing() {
        assertThatThrownBy(() -> new SourceIndexer().index(tempDir.resolve("missing")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("not a directory");
    }

    @Test
    void index_recordsBodylessDeclaration() throws IOException {
        GoProjectFixture.module(tempDir, "example.com/asm")
            .file("add.go", "package asm\n\nfunc add(a, b int) int\n");

        ProjectIndex index = new SourceIndexer().index(tempDir);

        assertThat(index.registry().get("asm.add").orElseThrow().hasBody()).isFalse();
    }
}
