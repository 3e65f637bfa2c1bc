package io.callscan.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * All functions and methods declared in the indexed tree, keyed by canonical identity.
 * <p>
 * Only {@link Builder} is mutable. Once built the registry is read-only, so the
 * resolution phase can share it between worker threads without locking.
 */
public final class FunctionRegistry {

    private final Map<String, FunctionDescriptor> byIdentity;
    private final Map<String, FunctionDescriptor> byPackagePath;  // packagePath + "." + name, free functions only
    private final Set<String> declaredTypes;                      // packagePath + "." + type name

    private FunctionRegistry(Map<String, FunctionDescriptor> byIdentity,
                             Map<String, FunctionDescriptor> byPackagePath,
                             Set<String> declaredTypes) {
        this.byIdentity = Collections.unmodifiableMap(new TreeMap<>(byIdentity));
        this.byPackagePath = Map.copyOf(byPackagePath);
        this.declaredTypes = Set.copyOf(declaredTypes);
    }

    /**
     * Returns the descriptor with the given canonical identity.
     */
    public Optional<FunctionDescriptor> get(String identity) {
        return Optional.ofNullable(byIdentity.get(identity));
    }

    public boolean contains(String identity) {
        return byIdentity.containsKey(identity);
    }

    /**
     * Finds a free function declared in the package with the given import path.
     */
    public Optional<FunctionDescriptor> findFunction(String packagePath, String name) {
        return Optional.ofNullable(byPackagePath.get(packagePath + "." + name));
    }

    /**
     * Whether {@code name} is a type declared in the package with the given import path.
     * A call to it is a conversion, not a function call.
     */
    public boolean isDeclaredType(String packagePath, String name) {
        return declaredTypes.contains(packagePath + "." + name);
    }

    /**
     * All descriptors, sorted by identity.
     */
    public Collection<FunctionDescriptor> all() {
        return byIdentity.values();
    }

    public int size() {
        return byIdentity.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, FunctionDescriptor> byIdentity = new HashMap<>();
        private final Map<String, FunctionDescriptor> byPackagePath = new HashMap<>();
        private final Set<String> declaredTypes = new HashSet<>();

        /**
         * Registers a descriptor unless its identity is already taken.
         *
         * @return the descriptor already holding the identity, or empty if {@code descriptor} was added
         */
        public Optional<FunctionDescriptor> add(FunctionDescriptor descriptor) {
            FunctionDescriptor existing = byIdentity.putIfAbsent(descriptor.identity(), descriptor);
            if (existing != null) {
                return Optional.of(existing);
            }
            if (!descriptor.isMethod()) {
                byPackagePath.putIfAbsent(descriptor.packagePath() + "." + descriptor.name(), descriptor);
            }
            return Optional.empty();
        }

        public Builder addType(String packagePath, String typeName) {
            declaredTypes.add(packagePath + "." + typeName);
            return this;
        }

        public int size() {
            return byIdentity.size();
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(byIdentity, byPackagePath, declaredTypes);
        }
    }
}
