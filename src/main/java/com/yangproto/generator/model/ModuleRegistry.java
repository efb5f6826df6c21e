package com.yangproto.generator.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All module statements loaded for a run, keyed by module name.
 * Order of registration is the processing order.
 */
public class ModuleRegistry {

    private final Map<String, Statement> modulesByName = new LinkedHashMap<>();

    public ModuleRegistry() {
    }

    public ModuleRegistry(List<Statement> modules) {
        modules.forEach(this::register);
    }

    public void register(Statement module) {
        if (!module.isModule()) {
            throw new IllegalArgumentException("Not a module statement: " + module.describe());
        }
        modulesByName.put(module.getArgument(), module);
    }

    public Optional<Statement> find(String moduleName) {
        return Optional.ofNullable(modulesByName.get(moduleName));
    }

    /**
     * Resolves an import prefix as seen from the given module.
     */
    public Optional<Statement> resolvePrefix(Statement fromModule, String prefix) {
        if (fromModule == null) {
            return Optional.empty();
        }
        if (prefix.equals(fromModule.getModulePrefix())) {
            return Optional.of(fromModule);
        }
        String target = fromModule.getImports().get(prefix);
        return target == null ? Optional.empty() : find(target);
    }

    public Collection<Statement> getModules() {
        return Collections.unmodifiableCollection(modulesByName.values());
    }

    public int size() {
        return modulesByName.size();
    }
}
