package io.callscan;

import io.callscan.model.FunctionDescriptor;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration loaded from a YAML file.
 * Every key is optional; {@link #defaults()} gives the values used without a file.
 */
public class ScanConfig {

    public static final String DEFAULT_VENDOR_DIRECTORY = "vendor";
    public static final Set<String> DEFAULT_SKIP_DIRECTORIES = Set.of("testdata");

    private final String vendorDirectory;
    private final Set<String> skipDirectories;
    private final boolean includeTestFiles;
    private final int threads;
    private final Set<String> excludePackages;
    private final List<String> excludeFunctions;
    private final boolean hideStandardLibrary;

    private ScanConfig(String vendorDirectory,
                       Set<String> skipDirectories,
                       boolean includeTestFiles,
                       int threads,
                       Set<String> excludePackages,
                       List<String> excludeFunctions,
                       boolean hideStandardLibrary) {
        this.vendorDirectory = vendorDirectory;
        this.skipDirectories = skipDirectories;
        this.includeTestFiles = includeTestFiles;
        this.threads = threads;
        this.excludePackages = excludePackages;
        this.excludeFunctions = excludeFunctions;
        this.hideStandardLibrary = hideStandardLibrary;
    }

    public static ScanConfig defaults() {
        return new ScanConfig(DEFAULT_VENDOR_DIRECTORY, DEFAULT_SKIP_DIRECTORIES, false,
            Runtime.getRuntime().availableProcessors(), Set.of(), List.of(), false);
    }

    /**
     * Load configuration from a YAML file.
     */
    @SuppressWarnings("unchecked")
    public static ScanConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Map<String, Object> data = yaml.load(in);
            if (data == null) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }
            ScanConfig defaults = defaults();

            String vendor = (String) data.get("vendorDirectory");
            String vendorDirectory = vendor == null || vendor.isBlank() ? defaults.vendorDirectory : vendor.trim();

            Set<String> skipDirectories = data.containsKey("skipDirectories")
                ? toSet((List<String>) data.get("skipDirectories"))
                : defaults.skipDirectories;

            boolean includeTestFiles = toBoolean(data.get("includeTestFiles"), defaults.includeTestFiles);
            boolean hideStandardLibrary = toBoolean(data.get("hideStandardLibrary"), defaults.hideStandardLibrary);

            Object threadsValue = data.get("threads");
            int threads = threadsValue instanceof Number n && n.intValue() > 0 ? n.intValue() : defaults.threads;

            // Graph pruning
            Set<String> excludePackages = toSet((List<String>) data.get("excludePackages"));
            List<String> excludeFunctions = toList((List<String>) data.get("excludeFunctions"));

            return new ScanConfig(vendorDirectory, skipDirectories, includeTestFiles, threads,
                excludePackages, excludeFunctions, hideStandardLibrary);
        } catch (ClassCastException e) {
            throw new IOException("Invalid value type in config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    public ScanConfig withIncludeTestFiles(boolean value) {
        return new ScanConfig(vendorDirectory, skipDirectories, value, threads,
            excludePackages, excludeFunctions, hideStandardLibrary);
    }

    public ScanConfig withThreads(int value) {
        return new ScanConfig(vendorDirectory, skipDirectories, includeTestFiles,
            value > 0 ? value : threads, excludePackages, excludeFunctions, hideStandardLibrary);
    }

    public ScanConfig withHideStandardLibrary(boolean value) {
        return new ScanConfig(vendorDirectory, skipDirectories, includeTestFiles, threads,
            excludePackages, excludeFunctions, value);
    }

    private static Set<String> toSet(List<String> list) {
        if (list == null || list.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String item : list) {
            if (item != null) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static List<String> toList(List<String> list) {
        if (list == null || list.isEmpty()) {
            return List.of();
        }
        return list.stream()
            .filter(s -> s != null && !s.trim().isEmpty())
            .map(String::trim)
            .toList();
    }

    private static boolean toBoolean(Object value, boolean fallback) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return fallback;
    }

    public String getVendorDirectory() {
        return vendorDirectory;
    }

    public Set<String> getSkipDirectories() {
        return skipDirectories;
    }

    public boolean isIncludeTestFiles() {
        return includeTestFiles;
    }

    public int getThreads() {
        return threads;
    }

    public Set<String> getExcludePackages() {
        return excludePackages;
    }

    public List<String> getExcludeFunctions() {
        return excludeFunctions;
    }

    public boolean isHideStandardLibrary() {
        return hideStandardLibrary;
    }

    /**
     * Whether a directory name is never walked.
     * Names starting with "." or "_" are ignored by the go tool and skipped here too.
     */
    public boolean isSkippedDirectory(String name) {
        return name.equals(vendorDirectory)
            || skipDirectories.contains(name)
            || name.startsWith(".")
            || name.startsWith("_");
    }

    /**
     * Check if a value matches a pattern.
     * Trailing dot means prefix match, otherwise exact match.
     */
    private static boolean matchesPattern(String value, String pattern) {
        if (pattern.isEmpty()) {
            return true;
        }
        if (pattern.endsWith(".")) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return value.equals(pattern);
    }

    /**
     * Check if a package is left out of the graph.
     * Patterns match the package name or its import path.
     */
    public boolean isPackageExcluded(String packageName, String packagePath) {
        for (String pattern : excludePackages) {
            if (matchesPattern(packageName, pattern) || matchesPattern(packagePath, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check if a function is pruned from the graph.
     * Pattern formats:
     * - "Name" - the function or method name in any package
     * - "pkg.Name" - a free function
     * - "pkg/Type.Name" - a method
     * - "pkg/Type." - prefix match, here every method of a type
     * - "Name." - prefix match on the bare name
     */
    public boolean isFunctionExcluded(FunctionDescriptor function) {
        for (String pattern : excludeFunctions) {
            String body = pattern.endsWith(".") ? pattern.substring(0, pattern.length() - 1) : pattern;
            boolean qualified = body.indexOf('.') >= 0 || body.indexOf('/') >= 0;
            String value = qualified ? function.identity() : function.name();
            if (matchesPattern(value, pattern)) {
                return true;
            }
        }
        return false;
    }

    public boolean isExcluded(FunctionDescriptor function) {
        return isPackageExcluded(function.packageName(), function.packagePath()) || isFunctionExcluded(function);
    }
}
