package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;

/**
 * A string constant, emitted between double quotes.
 *
 * <p>Contents are copied verbatim; quotes, backslashes and newlines inside the
 * value are not escaped.
 */
public class StringLiteral implements Expression {

    private final String value;

    public StringLiteral(String value) {
        if (value == null) {
            throw new IllegalArgumentException("String literal value cannot be null");
        }
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toLua(TransformationContext context) {
        return "\"" + value + "\"";
    }

    @Override
    public String toString() {
        return "StringLiteral{value='" + value + "'}";
    }
}
