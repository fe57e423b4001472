package me.christianrobert.py2lua.transformation.semantic.statement;

/**
 * A function parameter together with the form it was declared in.
 * Only {@link Kind#POSITIONAL} parameters translate to Lua.
 */
public class Parameter {

    public enum Kind {
        POSITIONAL,
        DEFAULTED,
        VARIADIC,
        KEYWORD_ONLY,
        KEYWORD_VARIADIC
    }

    private final String name;
    private final Kind kind;

    public Parameter(String name) {
        this(name, Kind.POSITIONAL);
    }

    public Parameter(String name, Kind kind) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Parameter name cannot be null or empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Parameter kind cannot be null");
        }
        this.name = name;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isPositional() {
        return kind == Kind.POSITIONAL;
    }

    @Override
    public String toString() {
        return kind == Kind.POSITIONAL ? name : name + "(" + kind + ")";
    }
}
