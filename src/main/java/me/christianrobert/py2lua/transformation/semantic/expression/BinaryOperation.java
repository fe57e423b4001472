package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;

/**
 * Arithmetic {@code left OP right}, always emitted fully parenthesized: {@code (a + b)}.
 * Source precedence is not reproduced, the parentheses carry it.
 */
public class BinaryOperation implements Expression {

    private final Expression left;
    private final BinaryOperator operator;
    private final Expression right;

    public BinaryOperation(Expression left, BinaryOperator operator, Expression right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("BinaryOperation operands cannot be null");
        }
        if (operator == null) {
            throw new IllegalArgumentException("BinaryOperation operator cannot be null");
        }
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String toLua(TransformationContext context) {
        String leftLua = left.toLua(context);
        String rightLua = right.toLua(context);
        return "(" + leftLua + " " + operator.toLua() + " " + rightLua + ")";
    }

    @Override
    public String toString() {
        return "BinaryOperation{" + left + " " + operator + " " + right + "}";
    }
}
