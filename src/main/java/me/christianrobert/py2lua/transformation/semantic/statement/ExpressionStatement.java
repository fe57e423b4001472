package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.semantic.expression.Expression;

/**
 * An expression used as a statement, typically a side-effecting call
 * such as {@code print(peripheral.get_names())}.
 */
public class ExpressionStatement implements Statement {

    private final Expression expression;

    public ExpressionStatement(Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("ExpressionStatement expression cannot be null");
        }
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public void toLua(TransformationContext context, LuaCodeWriter writer) {
        writer.emit(expression.toLua(context));
    }

    @Override
    public String toString() {
        return "ExpressionStatement{" + expression + "}";
    }
}
