package io.callscan.analysis;

import io.callscan.ScanConfig;
import io.callscan.model.CallSite;
import io.callscan.model.CallTarget;
import io.callscan.model.CallTarget.CrossModuleCall;
import io.callscan.model.CallTarget.ExternalCall;
import io.callscan.model.CallTarget.LiteralInvocation;
import io.callscan.model.CallTarget.LocalCall;
import io.callscan.model.CallTarget.MethodCall;
import io.callscan.model.FunctionDescriptor;
import io.callscan.model.FunctionRegistry;
import io.callscan.model.ImportTable;
import io.callscan.model.ScanWarning;
import io.callscan.source.FunctionReparseException;
import io.callscan.source.GoParser;
import io.callscan.source.GoSourceFile;
import io.callscan.source.ProjectIndex;
import io.callscan.source.SourceParseException;
import io.callscan.util.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Finds the call expressions in each function body and classifies them against the
 * frozen registry and the file's import table.
 * <p>
 * There is no type information: a selector {@code X.Y(...)} is a package call only when
 * {@code X} is an import alias of the file, otherwise it is a method call on the value {@code X}.
 */
public class CallResolver {

    private static final Logger log = LoggerFactory.getLogger(CallResolver.class);

    private final WorkerPool pool;

    public CallResolver(ScanConfig config) {
        this.pool = new WorkerPool(config.getThreads());
    }

    public CallResolver() {
        this(ScanConfig.defaults());
    }

    /**
     * Resolves the call sites of every function in the index. Each file is parsed once.
     */
    public ResolutionResult resolve(ProjectIndex index) {
        Map<Path, List<FunctionDescriptor>> byFile = new LinkedHashMap<>();
        for (FunctionDescriptor function : index.registry().all()) {
            byFile.computeIfAbsent(function.file(), f -> new ArrayList<>()).add(function);
        }

        List<Callable<FileResolution>> tasks = new ArrayList<>();
        for (Map.Entry<Path, List<FunctionDescriptor>> entry : byFile.entrySet()) {
            tasks.add(() -> resolveFile(index, entry.getKey(), entry.getValue()));
        }
        List<FileResolution> results = pool.runAll("resolver", tasks);

        Map<String, List<CallSite>> callSites = new LinkedHashMap<>();
        List<ScanWarning> warnings = new ArrayList<>();
        for (FunctionDescriptor function : index.registry().all()) {
            callSites.put(function.identity(), List.of());
        }
        for (FileResolution result : results) {
            callSites.putAll(result.callSites());
            warnings.addAll(result.warnings());
        }

        ResolutionResult resolution = new ResolutionResult(callSites, warnings);
        log.info("Resolved {} call site(s) in {} function(s)", resolution.totalCallSites(), callSites.size());
        return resolution;
    }

    private FileResolution resolveFile(ProjectIndex index, Path path, List<FunctionDescriptor> functions) {
        Map<String, List<CallSite>> callSites = new LinkedHashMap<>();
        List<ScanWarning> warnings = new ArrayList<>();

        GoSourceFile file;
        try {
            file = new GoParser().parse(path);
        } catch (SourceParseException e) {
            for (FunctionDescriptor function : functions) {
                FunctionReparseException failure =
                    new FunctionReparseException(path, function.identity(), e.getReason(), e);
                skip(function, failure, warnings);
                callSites.put(function.identity(), List.of());
            }
            return new FileResolution(callSites, warnings);
        }

        for (FunctionDescriptor function : functions) {
            try {
                callSites.put(function.identity(), resolveFunction(index, function, file));
            } catch (FunctionReparseException e) {
                skip(function, e, warnings);
                callSites.put(function.identity(), List.of());
            }
        }
        return new FileResolution(callSites, warnings);
    }

    private static void skip(FunctionDescriptor function, FunctionReparseException e, List<ScanWarning> warnings) {
        log.warn("Skipping call sites of {}: {}", function.identity(), e.getReason());
        warnings.add(new ScanWarning(function.file(), function.identity(), e.getReason()));
    }

    /**
     * Resolves the call sites of one function whose file has already been parsed.
     *
     * @throws FunctionReparseException if the declaration is no longer at its indexed line
     */
    public List<CallSite> resolveFunction(ProjectIndex index, FunctionDescriptor function, GoSourceFile file)
            throws FunctionReparseException {
        TSNode decl = file.findFunction(function.name(), function.startLine())
            .orElseThrow(() -> new FunctionReparseException(function.file(), function.identity(),
                "declaration not found at line " + function.startLine()));
        TSNode body = GoSourceFile.field(decl, "body");
        if (body == null) {
            return List.of();
        }
        BodyScanner scanner = new BodyScanner(index, function, file, index.importsOf(function.file()));
        List<CallSite> sites = new ArrayList<>();
        scanner.collect(body, sites);
        return sites;
    }

    private record FileResolution(Map<String, List<CallSite>> callSites, List<ScanWarning> warnings) {
    }

    /**
     * Walks one function body. Not shared between threads.
     */
    private static final class BodyScanner {
        private final ProjectIndex index;
        private final FunctionRegistry registry;
        private final FunctionDescriptor function;
        private final GoSourceFile file;
        private final ImportTable imports;

        BodyScanner(ProjectIndex index, FunctionDescriptor function, GoSourceFile file, ImportTable imports) {
            this.index = index;
            this.registry = index.registry();
            this.function = function;
            this.file = file;
            this.imports = imports;
        }

        /**
         * Depth-first search for call expressions. Descent stops at each call found;
         * its arguments are scanned separately when the call site is built.
         */
        void collect(TSNode node, List<CallSite> out) {
            String type = node.getType();
            if ("call_expression".equals(type)) {
                addCall(node, file.line(node), out);
                return;
            }
            if ("type_conversion_expression".equals(type)) {
                addConversion(node, file.line(node), out);
                return;
            }
            if ("go_statement".equals(type) || "defer_statement".equals(type)) {
                int statementLine = file.line(node);
                for (TSNode child : GoSourceFile.namedChildren(node)) {
                    if ("call_expression".equals(child.getType())) {
                        addCall(child, statementLine, out);
                    } else if ("type_conversion_expression".equals(child.getType())) {
                        addConversion(child, statementLine, out);
                    } else {
                        collect(child, out);
                    }
                }
                return;
            }
            for (TSNode child : GoSourceFile.namedChildren(node)) {
                collect(child, out);
            }
        }

        private void addCall(TSNode call, int line, List<CallSite> out) {
            TSNode callee = GoSourceFile.field(call, "function");
            List<TSNode> arguments = GoSourceFile.namedChildren(GoSourceFile.field(call, "arguments"));

            List<CallSite> argumentCalls = new ArrayList<>();
            for (TSNode argument : arguments) {
                collect(argument, argumentCalls);
            }

            // Built-ins and conversions are not calls; what their arguments call still is
            if (callee == null || isConversionOrBuiltIn(callee)) {
                out.addAll(argumentCalls);
                return;
            }

            CallTarget target = classify(callee);
            List<CallSite> nested = argumentCalls;
            if (target instanceof LiteralInvocation) {
                nested = new ArrayList<>();
                TSNode body = GoSourceFile.field(unwrap(callee), "body");
                if (body != null) {
                    collect(body, nested);
                }
                nested.addAll(argumentCalls);
            }

            List<String> argumentText = arguments.stream().map(file::text).toList();
            out.add(new CallSite(target, line, file.text(call), argumentText, nested));
        }

        /**
         * {@code Map[int](xs)} and {@code pkg.Do[int](x)} parse as conversions to a generic type.
         * They are calls when the generic names a function of the project; otherwise only the
         * operand is scanned.
         */
        private void addConversion(TSNode conversion, int line, List<CallSite> out) {
            TSNode typeNode = GoSourceFile.field(conversion, "type");
            TSNode operand = GoSourceFile.field(conversion, "operand");

            List<CallSite> argumentCalls = new ArrayList<>();
            if (operand != null) {
                collect(operand, argumentCalls);
            }

            Optional<CallTarget> target = Optional.empty();
            if (typeNode != null && "generic_type".equals(typeNode.getType())) {
                target = instantiatedFunction(GoSourceFile.field(typeNode, "type"));
            }
            if (target.isEmpty()) {
                out.addAll(argumentCalls);
                return;
            }

            List<String> argumentText = operand != null ? List.of(file.text(operand)) : List.of();
            out.add(new CallSite(target.get(), line, file.text(conversion), argumentText, argumentCalls));
        }

        private Optional<CallTarget> instantiatedFunction(TSNode base) {
            if (base == null) {
                return Optional.empty();
            }
            if ("type_identifier".equals(base.getType())) {
                return resolveBareName(file.text(base));
            }
            if ("qualified_type".equals(base.getType())) {
                TSNode pkg = GoSourceFile.field(base, "package");
                TSNode name = GoSourceFile.field(base, "name");
                if (pkg == null || name == null) {
                    return Optional.empty();
                }
                Optional<String> importPath = packageImport(file.text(pkg));
                if (importPath.isPresent() && index.isInternal(importPath.get())) {
                    String path = importPath.get();
                    return registry.findFunction(path, file.text(name))
                        .<CallTarget>map(target -> new CrossModuleCall(target, path));
                }
            }
            return Optional.empty();
        }

        private boolean isConversionOrBuiltIn(TSNode callee) {
            TSNode node = unwrap(callee);
            String type = node.getType();
            if ("identifier".equals(type)) {
                String name = file.text(node);
                if (registry.findFunction(function.packagePath(), name).isPresent()) {
                    return false;
                }
                return BuiltIns.isBuiltIn(name) || registry.isDeclaredType(function.packagePath(), name);
            }
            if ("selector_expression".equals(type)) {
                TSNode operand = GoSourceFile.field(node, "operand");
                TSNode field = GoSourceFile.field(node, "field");
                if (operand != null && field != null && "identifier".equals(operand.getType())) {
                    Optional<String> importPath = packageImport(file.text(operand));
                    return importPath.isPresent() && registry.isDeclaredType(importPath.get(), file.text(field));
                }
                return false;
            }
            if ("index_expression".equals(type) || "generic_type".equals(type)) {
                TSNode operand = GoSourceFile.field(node, "operand");
                if (operand == null) {
                    operand = GoSourceFile.field(node, "type");
                }
                return operand != null && isConversionOrBuiltIn(operand);
            }
            return type.endsWith("_type");
        }

        CallTarget classify(TSNode callee) {
            TSNode node = unwrap(callee);
            switch (node.getType()) {
                case "identifier":
                    return classifyIdentifier(file.text(node));
                case "selector_expression":
                    return classifySelector(node);
                case "func_literal":
                    return new LiteralInvocation();
                case "index_expression":
                case "generic_type": {
                    TSNode operand = GoSourceFile.field(node, "operand");
                    if (operand == null) {
                        operand = GoSourceFile.field(node, "type");
                    }
                    if (operand != null) {
                        CallTarget inner = classify(operand);
                        if (inner instanceof LocalCall || inner instanceof CrossModuleCall) {
                            return inner;
                        }
                    }
                    return ExternalCall.unknown(render(node));
                }
                default:
                    return ExternalCall.unknown(render(node));
            }
        }

        private CallTarget classifyIdentifier(String name) {
            return resolveBareName(name).orElseGet(() -> ExternalCall.unknown(name));
        }

        /**
         * A bare name is local when the caller's own package declares it, then cross-module
         * when a dot-imported project package does.
         */
        private Optional<CallTarget> resolveBareName(String name) {
            Optional<FunctionDescriptor> local = registry.findFunction(function.packagePath(), name);
            if (local.isPresent()) {
                return Optional.of(new LocalCall(local.get()));
            }
            for (String dotImport : imports.dotImports()) {
                if (index.isInternal(dotImport)) {
                    Optional<FunctionDescriptor> target = registry.findFunction(dotImport, name);
                    if (target.isPresent()) {
                        return Optional.of(new CrossModuleCall(target.get(), dotImport));
                    }
                }
            }
            return Optional.empty();
        }

        private CallTarget classifySelector(TSNode selector) {
            TSNode operand = GoSourceFile.field(selector, "operand");
            String method = file.text(GoSourceFile.field(selector, "field"));

            if (operand != null && "identifier".equals(operand.getType())) {
                String alias = file.text(operand);
                Optional<String> importPath = packageImport(alias);
                if (importPath.isPresent()) {
                    String path = importPath.get();
                    if (!index.isInternal(path)) {
                        return new ExternalCall(method, alias, path, CallTarget.Origin.IMPORTED);
                    }
                    return registry.findFunction(path, method)
                        .<CallTarget>map(target -> new CrossModuleCall(target, path))
                        .orElseGet(() -> new ExternalCall(method, alias, path, CallTarget.Origin.MISSING));
                }
            }
            return new MethodCall(render(operand), method);
        }

        private Optional<String> packageImport(String alias) {
            return imports.isPackageAlias(alias) ? imports.importPath(alias) : Optional.empty();
        }

        /**
         * Source text with line breaks inside chained expressions removed.
         */
        private String render(TSNode node) {
            return file.text(node).replaceAll("\\s*\\R\\s*", "");
        }

        private static TSNode unwrap(TSNode node) {
            TSNode current = node;
            while ("parenthesized_expression".equals(current.getType())) {
                List<TSNode> inner = GoSourceFile.namedChildren(current);
                if (inner.isEmpty()) {
                    break;
                }
                current = inner.get(0);
            }
            return current;
        }
    }
}
