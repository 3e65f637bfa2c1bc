package io.callscan;

import io.callscan.model.FunctionDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanConfigTest {

    @TempDir
    Path tempDir;

    private static FunctionDescriptor function(String pkg, String receiver, String name) {
        return new FunctionDescriptor(pkg, "example.com/app/" + pkg, receiver, name, Path.of(pkg + ".go"),
            1, 2, List.of(), List.of(), true);
    }

    @Test
    void defaults_skipVendorHiddenAndUnderscoreDirectories() {
        ScanConfig config = ScanConfig.defaults();

        assertThat(config.isSkippedDirectory("vendor")).isTrue();
        assertThat(config.isSkippedDirectory("testdata")).isTrue();
        assertThat(config.isSkippedDirectory(".git")).isTrue();
        assertThat(config.isSkippedDirectory("_examples")).isTrue();
        assertThat(config.isSkippedDirectory("internal")).isFalse();
        assertThat(config.isIncludeTestFiles()).isFalse();
        assertThat(config.getThreads()).isPositive();
    }

    @Test
    void load_readsEveryKey() throws IOException {
        Path file = tempDir.resolve("callscan.yaml");
        Files.writeString(file, """
            vendorDirectory: third_party
            skipDirectories: [gen, mocks]
            includeTestFiles: true
            threads: 3
            excludePackages: [mocks]
            excludeFunctions: [init]
            hideStandardLibrary: "true"
            """);

        ScanConfig config = ScanConfig.load(file);

        assertThat(config.getVendorDirectory()).isEqualTo("third_party");
        assertThat(config.isSkippedDirectory("vendor")).isFalse();
        assertThat(config.isSkippedDirectory("testdata")).isFalse();
        assertThat(config.getSkipDirectories()).containsExactly("gen", "mocks");
        assertThat(config.isIncludeTestFiles()).isTrue();
        assertThat(config.getThreads()).isEqualTo(3);
        assertThat(config.isHideStandardLibrary()).isTrue();
        assertThat(config.getExcludeFunctions()).containsExactly("init");
    }

    @Test
    void load_rejectsEmptyFileAndWrongTypes() throws IOException {
        Path empty = tempDir.resolve("empty.yaml");
        Files.writeString(empty, "");
        Path wrong = tempDir.resolve("wrong.yaml");
        Files.writeString(wrong, "vendorDirectory: [a, b]\n");

        assertThatThrownBy(() -> ScanConfig.load(empty)).isInstanceOf(IOException.class)
            .hasMessageContaining("Empty or invalid");
        assertThatThrownBy(() -> ScanConfig.load(wrong)).isInstanceOf(IOException.class)
            .hasMessageContaining("Invalid value type");
    }

    @Test
    void isFunctionExcluded_matchesNamesIdentitiesAndPrefixes() throws IOException {
        Path file = tempDir.resolve("callscan.yaml");
        Files.writeString(file, """
            excludeFunctions:
              - String
              - main.debug
              - store/Cache.
              - Test.
            """);
        ScanConfig config = ScanConfig.load(file);

        assertThat(config.isFunctionExcluded(function("model", "User", "String"))).isTrue();
        assertThat(config.isFunctionExcluded(function("main", "", "debug"))).isTrue();
        assertThat(config.isFunctionExcluded(function("util", "", "debug"))).isFalse();
        assertThat(config.isFunctionExcluded(function("store", "Cache", "Get"))).isTrue();
        assertThat(config.isFunctionExcluded(function("store", "Index", "Get"))).isFalse();
        assertThat(config.isFunctionExcluded(function("main", "", "TestRun"))).isTrue();
    }

    @Test
    void isPackageExcluded_matchesNameOrImportPath() throws IOException {
        Path file = tempDir.resolve("callscan.yaml");
        Files.writeString(file, "excludePackages: [mocks, example.com/app/gen.]\n");
        ScanConfig config = ScanConfig.load(file);

        assertThat(config.isPackageExcluded("mocks", "example.com/app/internal/mocks")).isTrue();
        assertThat(config.isPackageExcluded("proto", "example.com/app/gen/proto")).isTrue();
        assertThat(config.isPackageExcluded("store", "example.com/app/store")).isFalse();
        assertThat(config.isExcluded(function("mocks", "", "New"))).isTrue();
    }

    @Test
    void overridesReturnNewInstances() {
        ScanConfig base = ScanConfig.defaults();

        ScanConfig changed = base.withIncludeTestFiles(true).withThreads(2).withHideStandardLibrary(true);

        assertThat(base.isIncludeTestFiles()).isFalse();
        assertThat(changed.isIncludeTestFiles()).isTrue();
        assertThat(changed.getThreads()).isEqualTo(2);
        assertThat(changed.isHideStandardLibrary()).isTrue();
        assertThat(changed.withThreads(0).getThreads()).isEqualTo(2);
    }
}
