package io.callscan.analysis;

import io.callscan.ScanConfig;
import io.callscan.graph.CallGraph;
import io.callscan.graph.NodeKind;
import io.callscan.model.CallSite;
import io.callscan.model.CallTarget;
import io.callscan.model.ExternalReference;
import io.callscan.model.FunctionDescriptor;
import io.callscan.model.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the call graph from the registry and the resolved call sites.
 * <p>
 * Every indexed function becomes an internal node. Every call site, nested ones included,
 * becomes an edge from the enclosing function. Targets that are not indexed functions get
 * synthetic nodes whose keys carry a namespace prefix, so they never merge with internal nodes:
 * <ul>
 *   <li>{@code ext:<importPath>.<name>} for functions of packages outside the module</li>
 *   <li>{@code unresolved:<importPath>.<name>} for module functions that were not indexed</li>
 *   <li>{@code unresolved:<name>} for bare or computed callees of unknown origin</li>
 *   <li>{@code method:<receiver>.<method>} for method calls</li>
 *   <li>{@code literal:<caller>$func@<line>} for function literals invoked in place</li>
 * </ul>
 */
public class CallGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    public static final String EXTERNAL_PREFIX = "ext:";
    public static final String UNRESOLVED_PREFIX = "unresolved:";
    public static final String METHOD_PREFIX = "method:";
    public static final String LITERAL_PREFIX = "literal:";

    private final ScanConfig config;

    public CallGraphBuilder(ScanConfig config) {
        this.config = config;
    }

    public CallGraphBuilder() {
        this(ScanConfig.defaults());
    }

    public CallGraph build(FunctionRegistry registry, ResolutionResult resolution) {
        CallGraph.Builder graph = CallGraph.builder();

        for (FunctionDescriptor function : registry.all()) {
            if (!config.isExcluded(function)) {
                internalNode(graph, function);
            }
        }

        int skipped = 0;
        for (FunctionDescriptor function : registry.all()) {
            if (config.isExcluded(function)) {
                continue;
            }
            int caller = internalNode(graph, function);
            for (CallSite site : resolution.allCallSites(function.identity())) {
                Integer callee = site.target().accept(new TargetNodes(graph, function, site));
                if (callee == null) {
                    skipped++;
                    continue;
                }
                graph.addEdge(caller, callee);
            }
        }

        CallGraph built = graph.build();
        log.info("Call graph: {} node(s), {} edge(s)", built.nodeCount(), built.edgeCount());
        if (skipped > 0) {
            log.debug("{} call site(s) pruned by configuration", skipped);
        }
        return built;
    }

    private static int internalNode(CallGraph.Builder graph, FunctionDescriptor function) {
        return graph.ensureNode(function.identity(), NodeKind.INTERNAL,
            function.displayName(), function.qualifier(), function.receiver());
    }

    /**
     * Maps a call target to the handle of its node, or null when the call is pruned.
     */
    private final class TargetNodes implements CallTarget.Visitor<Integer> {
        private final CallGraph.Builder graph;
        private final FunctionDescriptor caller;
        private final CallSite site;

        TargetNodes(CallGraph.Builder graph, FunctionDescriptor caller, CallSite site) {
            this.graph = graph;
            this.caller = caller;
            this.site = site;
        }

        @Override
        public Integer visitLocal(CallTarget.LocalCall call) {
            return internalTarget(call.target());
        }

        @Override
        public Integer visitCrossModule(CallTarget.CrossModuleCall call) {
            return internalTarget(call.target());
        }

        private Integer internalTarget(FunctionDescriptor target) {
            if (config.isExcluded(target)) {
                return null;
            }
            return internalNode(graph, target);
        }

        @Override
        public Integer visitMethod(CallTarget.MethodCall call) {
            return graph.ensureNode(METHOD_PREFIX + call.receiver() + "." + call.method(),
                NodeKind.UNRESOLVED, call.calleeName(), "", "");
        }

        @Override
        public Integer visitExternal(CallTarget.ExternalCall call) {
            ExternalReference ref = ExternalReference.of(call);
            switch (call.origin()) {
                case IMPORTED:
                    if (ref.standardLibrary() && config.isHideStandardLibrary()) {
                        return null;
                    }
                    return graph.ensureNode(EXTERNAL_PREFIX + ref.qualifiedName(),
                        NodeKind.EXTERNAL, ref.qualifiedName(), "", "");
                case MISSING:
                    return graph.ensureNode(UNRESOLVED_PREFIX + ref.qualifiedName(),
                        NodeKind.UNRESOLVED, ref.qualifiedName(), "", "");
                default:
                    return graph.ensureNode(UNRESOLVED_PREFIX + call.name(),
                        NodeKind.UNRESOLVED, call.name(), "", "");
            }
        }

        @Override
        public Integer visitLiteral(CallTarget.LiteralInvocation call) {
            String key = LITERAL_PREFIX + caller.identity() + "$func@" + site.line();
            return graph.ensureNode(key, NodeKind.ANONYMOUS, "func@" + site.line(),
                caller.qualifier(), "");
        }
    }
}
