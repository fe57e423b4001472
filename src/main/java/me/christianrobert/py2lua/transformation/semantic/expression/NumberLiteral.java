package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;

/**
 * A numeric constant (integer or floating point), emitted in decimal form.
 */
public class NumberLiteral implements Expression {

    private final Number value;

    public NumberLiteral(Number value) {
        if (value == null) {
            throw new IllegalArgumentException("Number literal value cannot be null");
        }
        this.value = value;
    }

    public Number getValue() {
        return value;
    }

    @Override
    public String toLua(TransformationContext context) {
        return value.toString();
    }

    @Override
    public String toString() {
        return "NumberLiteral{value=" + value + "}";
    }
}
