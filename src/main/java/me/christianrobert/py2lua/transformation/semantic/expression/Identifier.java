package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;

/**
 * A bare name (variable, function, imported module alias).
 * Identifiers are passed through as-is.
 */
public class Identifier implements Expression {

    private final String name;

    public Identifier(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Identifier name cannot be null or empty");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toLua(TransformationContext context) {
        return name;
    }

    @Override
    public String toString() {
        return "Identifier{name='" + name + "'}";
    }
}
