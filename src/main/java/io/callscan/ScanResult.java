package io.callscan;

import io.callscan.analysis.ResolutionResult;
import io.callscan.graph.CallGraph;
import io.callscan.model.ScanWarning;
import io.callscan.source.ProjectIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one run of the pipeline produced.
 *
 * @param index      Registry, import tables and indexing warnings
 * @param resolution Call sites per function
 * @param graph      Assembled call graph
 */
public record ScanResult(ProjectIndex index, ResolutionResult resolution, CallGraph graph) {

    public List<ScanWarning> warnings() {
        List<ScanWarning> all = new ArrayList<>(index.warnings());
        all.addAll(resolution.warnings());
        return all;
    }
}
