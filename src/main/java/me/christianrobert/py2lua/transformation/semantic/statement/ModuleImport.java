package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.resolver.ImportBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code import module [as alias], ...}
 * Binds the alias (or module name) to the module itself, without an exported name.
 */
public class ModuleImport implements ImportStatement {

    private final List<ImportedName> modules;

    public ModuleImport(List<ImportedName> modules) {
        if (modules == null || modules.isEmpty()) {
            throw new IllegalArgumentException("ModuleImport must import at least one module");
        }
        this.modules = new ArrayList<>(modules);
    }

    public List<ImportedName> getModules() {
        return Collections.unmodifiableList(modules);
    }

    @Override
    public List<ImportBinding> getBindings() {
        return modules.stream()
                .map(imported -> new ImportBinding(imported.getLocalName(), imported.getName(), null))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ModuleImport{modules=" + modules + "}";
    }
}
