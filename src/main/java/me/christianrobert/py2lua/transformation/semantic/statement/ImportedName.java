package me.christianrobert.py2lua.transformation.semantic.statement;

/**
 * One {@code name [as alias]} entry of an import statement.
 */
public class ImportedName {

    private final String name;
    private final String alias;  // null when not renamed

    public ImportedName(String name, String alias) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Imported name cannot be null or empty");
        }
        this.name = name;
        this.alias = alias;
    }

    public String getName() {
        return name;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * @return Name the import is bound to in the importing module
     */
    public String getLocalName() {
        return alias != null ? alias : name;
    }

    @Override
    public String toString() {
        return alias != null ? name + " as " + alias : name;
    }
}
