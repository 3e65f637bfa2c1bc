package io.callscan;

import io.callscan.analysis.CallGraphBuilder;
import io.callscan.analysis.CallResolver;
import io.callscan.analysis.ResolutionResult;
import io.callscan.coverage.CoverageAnalyzer;
import io.callscan.coverage.CoverageProfileException;
import io.callscan.coverage.CoverageReport;
import io.callscan.graph.CallGraph;
import io.callscan.model.FunctionRegistry;
import io.callscan.source.ProjectIndex;
import io.callscan.source.SourceIndexer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the pipeline: index, resolve, assemble. Each phase only starts once the previous one
 * has returned, so resolution always sees the complete registry.
 */
public class CallScanner {

    private final ScanConfig config;

    public CallScanner(ScanConfig config) {
        this.config = config;
    }

    public ProjectIndex index(Path root) throws IOException {
        return new SourceIndexer(config).index(root);
    }

    public ResolutionResult resolve(ProjectIndex index) {
        return new CallResolver(config).resolve(index);
    }

    public CallGraph assemble(FunctionRegistry registry, ResolutionResult resolution) {
        return new CallGraphBuilder(config).build(registry, resolution);
    }

    public CoverageReport analyzeCoverage(Path profile, ProjectIndex index) throws CoverageProfileException {
        return new CoverageAnalyzer().analyze(profile, index);
    }

    public ScanResult scan(Path root) throws IOException {
        ProjectIndex index = index(root);
        ResolutionResult resolution = resolve(index);
        CallGraph graph = assemble(index.registry(), resolution);
        return new ScanResult(index, resolution, graph);
    }

    public ScanConfig config() {
        return config;
    }
}
