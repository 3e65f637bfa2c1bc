package io.callscan.model;

/**
 * What a call expression was resolved to. Exactly one of five kinds.
 */
public sealed interface CallTarget
    permits CallTarget.LocalCall, CallTarget.CrossModuleCall, CallTarget.MethodCall,
            CallTarget.ExternalCall, CallTarget.LiteralInvocation {

    <R> R accept(Visitor<R> visitor);

    /**
     * Name of the called function as it would be printed next to the call site.
     */
    String calleeName();

    interface Visitor<R> {
        R visitLocal(LocalCall call);

        R visitCrossModule(CrossModuleCall call);

        R visitMethod(MethodCall call);

        R visitExternal(ExternalCall call);

        R visitLiteral(LiteralInvocation call);
    }

    /**
     * Where an unresolved call was expected to come from.
     */
    enum Origin {
        /** Package-qualified call into a package outside the project module */
        IMPORTED,
        /** Package-qualified call into the project module that matched no indexed function */
        MISSING,
        /** Bare identifier or computed callee with no known origin */
        UNKNOWN
    }

    /**
     * Bare identifier resolved to a function of the caller's own package.
     */
    record LocalCall(FunctionDescriptor target) implements CallTarget {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocal(this);
        }

        @Override
        public String calleeName() {
            return target.name();
        }
    }

    /**
     * Package-qualified call resolved to a function of another in-project package.
     */
    record CrossModuleCall(FunctionDescriptor target, String importPath) implements CallTarget {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCrossModule(this);
        }

        @Override
        public String calleeName() {
            return target.packageName() + "." + target.name();
        }
    }

    /**
     * Selector call on a value. The receiver is kept as source text and never resolved to a type.
     */
    record MethodCall(String receiver, String method) implements CallTarget {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMethod(this);
        }

        @Override
        public String calleeName() {
            return receiver + "." + method;
        }
    }

    /**
     * Call that could not be tied to an indexed function.
     *
     * @param name       Called name (or the rendered callee for computed callees)
     * @param alias      Import alias used at the call site, empty for bare calls
     * @param importPath Full import path, empty when unknown
     * @param origin     Why the call stayed unresolved
     */
    record ExternalCall(String name, String alias, String importPath, Origin origin) implements CallTarget {
        public ExternalCall {
            alias = alias != null ? alias : "";
            importPath = importPath != null ? importPath : "";
        }

        public static ExternalCall unknown(String name) {
            return new ExternalCall(name, "", "", Origin.UNKNOWN);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExternal(this);
        }

        @Override
        public String calleeName() {
            return alias.isEmpty() ? name : alias + "." + name;
        }
    }

    /**
     * Anonymous function literal invoked where it is declared.
     */
    record LiteralInvocation() implements CallTarget {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String calleeName() {
            return "func";
        }
    }
}
