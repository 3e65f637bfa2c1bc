package io.callscan.source;

import io.callscan.ScanConfig;
import io.callscan.model.FunctionDescriptor;
import io.callscan.model.FunctionRegistry;
import io.callscan.model.ImportTable;
import io.callscan.model.ScanWarning;
import io.callscan.util.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Walks a Go source tree and builds the function registry.
 * <p>
 * Files are parsed in parallel; results are merged by a single thread in sorted path
 * order, so which declaration wins an identity collision does not depend on scheduling.
 */
public class SourceIndexer {

    private static final Logger log = LoggerFactory.getLogger(SourceIndexer.class);

    static final String GO_EXTENSION = ".go";
    static final String TEST_SUFFIX = "_test.go";

    private final ScanConfig config;
    private final WorkerPool pool;

    public SourceIndexer(ScanConfig config) {
        this.config = config;
        this.pool = new WorkerPool(config.getThreads());
    }

    public SourceIndexer() {
        this(ScanConfig.defaults());
    }

    /**
     * Indexes every Go file under {@code root}.
     *
     * @throws ManifestNotFoundException if no go.mod is found at or above the root
     * @throws IOException               if the root is not an accessible directory
     */
    public ProjectIndex index(Path root) throws IOException {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(absoluteRoot)) {
            throw new IOException("Project root is not a directory: " + root);
        }
        if (!Files.isReadable(absoluteRoot)) {
            throw new IOException("Project root is not readable: " + root);
        }
        ModuleManifest manifest = ModuleManifest.locate(absoluteRoot);
        log.debug("Module {} declared in {}", manifest.modulePath(), manifest.directory());

        List<Path> files = collectFiles(absoluteRoot);
        log.info("Indexing {} Go file(s) under {}", files.size(), absoluteRoot);

        List<Callable<FileScan>> tasks = new ArrayList<>();
        for (Path file : files) {
            tasks.add(() -> scanFile(file, manifest));
        }
        List<FileScan> scans = pool.runAll("indexer", tasks);

        return merge(manifest, absoluteRoot, scans);
    }

    /**
     * Regular Go files under the root, sorted by path.
     */
    List<Path> collectFiles(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && config.isSkippedDirectory(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString();
                if (attrs.isRegularFile() && name.endsWith(GO_EXTENSION)
                    && (config.isIncludeTestFiles() || !name.endsWith(TEST_SUFFIX))) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    private FileScan scanFile(Path file, ModuleManifest manifest) {
        GoSourceFile source;
        try {
            source = new GoParser().parse(file);
        } catch (SourceParseException e) {
            return FileScan.failed(file, e.getReason());
        }

        String packagePath = manifest.packagePathFor(file.getParent());
        List<FunctionDescriptor> functions = new ArrayList<>();
        for (TSNode decl : source.functionDeclarations()) {
            functions.add(DeclarationReader.read(source, packagePath, decl));
        }
        return new FileScan(file, packagePath, source.packageName(), ImportTableBuilder.build(source), functions,
            DeclarationReader.typeNames(source), null);
    }

    private ProjectIndex merge(ModuleManifest manifest, Path root, List<FileScan> scans) {
        FunctionRegistry.Builder registry = FunctionRegistry.builder();
        Map<Path, ImportTable> imports = new LinkedHashMap<>();
        List<Path> indexed = new ArrayList<>();
        List<ScanWarning> warnings = new ArrayList<>();
        Map<String, String> qualifiers = qualifiers(manifest, scans);

        for (FileScan scan : scans) {
            if (scan.error() != null) {
                log.warn("Skipping {}: {}", scan.file(), scan.error());
                warnings.add(ScanWarning.forFile(scan.file(), scan.error()));
                continue;
            }
            indexed.add(scan.file());
            imports.put(scan.file(), scan.imports());
            for (String type : scan.types()) {
                registry.addType(scan.packagePath(), type);
            }
            String qualifier = qualifiers.get(scan.packagePath() + " " + scan.packageName());
            for (FunctionDescriptor declared : scan.functions()) {
                FunctionDescriptor function = declared.withQualifier(qualifier);
                Optional<FunctionDescriptor> existing = registry.add(function);
                if (existing.isPresent()) {
                    FunctionDescriptor first = existing.get();
                    String message = "duplicate identity " + function.identity() + " at line " + function.startLine()
                        + ", already declared in " + first.file() + ":" + first.startLine();
                    log.warn("{}: {}", function.file(), message);
                    warnings.add(new ScanWarning(function.file(), function.identity(), message));
                }
            }
        }

        FunctionRegistry frozen = registry.build();
        log.info("Indexed {} function(s) from {} file(s), {} skipped",
            frozen.size(), indexed.size(), scans.size() - indexed.size());
        return new ProjectIndex(manifest, root, frozen, imports, indexed, warnings);
    }

    /**
     * Identity prefix per package. A package name declared by a single import path is its own prefix;
     * a name shared by several packages (every {@code cmd/*} holding {@code package main}) is prefixed
     * with the module-relative directory.
     */
    private static Map<String, String> qualifiers(ModuleManifest manifest, List<FileScan> scans) {
        Map<String, Set<String>> pathsByName = new HashMap<>();
        for (FileScan scan : scans) {
            if (scan.error() == null) {
                pathsByName.computeIfAbsent(scan.packageName(), k -> new TreeSet<>()).add(scan.packagePath());
            }
        }
        Map<String, String> qualifiers = new HashMap<>();
        pathsByName.forEach((name, paths) -> {
            for (String path : paths) {
                String directory = paths.size() > 1 ? manifest.relativeDirectory(path) : "";
                qualifiers.put(path + " " + name, directory.isEmpty() ? name : directory + "/" + name);
            }
        });
        return qualifiers;
    }

    /**
     * Outcome of parsing one file. {@code error} is non-null when the file was skipped.
     */
    private record FileScan(
        Path file,
        String packagePath,
        String packageName,
        ImportTable imports,
        List<FunctionDescriptor> functions,
        List<String> types,
        String error
    ) {
        static FileScan failed(Path file, String error) {
            return new FileScan(file, "", "", ImportTable.empty(), List.of(), List.of(), error);
        }
    }
}
