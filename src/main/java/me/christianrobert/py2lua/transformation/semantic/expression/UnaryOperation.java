package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;

/**
 * Unary {@code OP operand}, emitted parenthesized: {@code -x} becomes {@code (-x)}.
 */
public class UnaryOperation implements Expression {

    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryOperation(UnaryOperator operator, Expression operand) {
        if (operator == null) {
            throw new IllegalArgumentException("UnaryOperation operator cannot be null");
        }
        if (operand == null) {
            throw new IllegalArgumentException("UnaryOperation operand cannot be null");
        }
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public String toLua(TransformationContext context) {
        String symbol = operator.toLua();
        return "(" + symbol + operand.toLua(context) + ")";
    }

    @Override
    public String toString() {
        return "UnaryOperation{" + operator + " " + operand + "}";
    }
}
