package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.resolver.ImportBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code from module import name [as alias], ...}
 *
 * <p>A relative import without module ({@code from . import x}) carries a null
 * module and binds nothing.
 */
public class FromImport implements ImportStatement {

    private final String module;
    private final List<ImportedName> names;

    public FromImport(String module, List<ImportedName> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("FromImport must import at least one name");
        }
        this.module = module;
        this.names = new ArrayList<>(names);
    }

    public String getModule() {
        return module;
    }

    public List<ImportedName> getNames() {
        return Collections.unmodifiableList(names);
    }

    @Override
    public List<ImportBinding> getBindings() {
        if (module == null) {
            return Collections.emptyList();
        }
        return names.stream()
                .map(imported -> new ImportBinding(imported.getLocalName(), module, imported.getName()))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "FromImport{module='" + module + "', names=" + names + "}";
    }
}
