package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.context.UnsupportedConstructException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Comparison as the front-end delivers it: a left operand followed by
 * operator/comparator pairs ({@code a < b < c} has two of each).
 *
 * <p>Only a single pair translates, emitted parenthesized: {@code (a == b)}.
 * Chained comparisons fail.
 */
public class Comparison implements Expression {

    private final Expression left;
    private final List<ComparisonOperator> operators;
    private final List<Expression> comparators;

    public Comparison(Expression left, ComparisonOperator operator, Expression right) {
        this(left, List.of(operator), List.of(right));
    }

    public Comparison(Expression left, List<ComparisonOperator> operators, List<Expression> comparators) {
        if (left == null) {
            throw new IllegalArgumentException("Comparison left operand cannot be null");
        }
        if (operators == null || operators.isEmpty()) {
            throw new IllegalArgumentException("Comparison must have at least one operator");
        }
        if (comparators == null || comparators.size() != operators.size()) {
            throw new IllegalArgumentException("Comparison must have one comparator per operator");
        }
        this.left = left;
        this.operators = new ArrayList<>(operators);
        this.comparators = new ArrayList<>(comparators);
    }

    public Expression getLeft() {
        return left;
    }

    public List<ComparisonOperator> getOperators() {
        return Collections.unmodifiableList(operators);
    }

    public List<Expression> getComparators() {
        return Collections.unmodifiableList(comparators);
    }

    public boolean isChained() {
        return operators.size() > 1;
    }

    @Override
    public String toLua(TransformationContext context) {
        if (isChained()) {
            throw new UnsupportedConstructException(
                    UnsupportedConstructException.Reason.CHAINED_COMPARISON,
                    operators.size() + " operators " + operators);
        }
        String leftLua = left.toLua(context);
        String rightLua = comparators.get(0).toLua(context);
        return "(" + leftLua + " " + operators.get(0).toLua() + " " + rightLua + ")";
    }

    @Override
    public String toString() {
        return "Comparison{left=" + left + ", operators=" + operators + ", comparators=" + comparators + "}";
    }
}
