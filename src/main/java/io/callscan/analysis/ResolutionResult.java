package io.callscan.analysis;

import io.callscan.model.CallSite;
import io.callscan.model.CallTarget;
import io.callscan.model.ExternalReference;
import io.callscan.model.ScanWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Call sites of every indexed function, keyed by canonical identity.
 *
 * @param callSites Top-level call sites per function, in source order
 * @param warnings  Functions whose bodies could not be re-read
 */
public record ResolutionResult(Map<String, List<CallSite>> callSites, List<ScanWarning> warnings) {

    public ResolutionResult {
        Map<String, List<CallSite>> copy = new LinkedHashMap<>();
        callSites.forEach((id, sites) -> copy.put(id, List.copyOf(sites)));
        callSites = Collections.unmodifiableMap(copy);
        warnings = List.copyOf(warnings);
    }

    public List<CallSite> callSites(String identity) {
        return callSites.getOrDefault(identity, List.of());
    }

    /**
     * Every call site of a function, nested ones included, depth first.
     */
    public List<CallSite> allCallSites(String identity) {
        return CallSite.flattenAll(callSites(identity));
    }

    /**
     * Distinct external references made by a function, in order of first appearance.
     */
    public List<ExternalReference> externals(String identity) {
        Set<ExternalReference> refs = new LinkedHashSet<>();
        for (CallSite site : allCallSites(identity)) {
            if (site.target() instanceof CallTarget.ExternalCall call) {
                refs.add(ExternalReference.of(call));
            }
        }
        return List.copyOf(refs);
    }

    /**
     * Distinct identities of indexed functions a function calls, in order of first appearance.
     */
    public List<String> internalCallees(String identity) {
        Set<String> callees = new LinkedHashSet<>();
        for (CallSite site : allCallSites(identity)) {
            if (site.target() instanceof CallTarget.LocalCall local) {
                callees.add(local.target().identity());
            } else if (site.target() instanceof CallTarget.CrossModuleCall cross) {
                callees.add(cross.target().identity());
            }
        }
        return List.copyOf(callees);
    }

    public int totalCallSites() {
        return callSites.keySet().stream().mapToInt(id -> allCallSites(id).size()).sum();
    }
}
