package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.semantic.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * While loop, emitted as {@code while <test> do ... end}.
 */
public class WhileLoop implements Statement {

    private final Expression test;
    private final List<Statement> body;

    public WhileLoop(Expression test, List<Statement> body) {
        if (test == null) {
            throw new IllegalArgumentException("WhileLoop test cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("WhileLoop body cannot be null");
        }
        this.test = test;
        this.body = new ArrayList<>(body);
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return Collections.unmodifiableList(body);
    }

    @Override
    public void toLua(TransformationContext context, LuaCodeWriter writer) {
        writer.emit("while " + test.toLua(context) + " do");
        StatementBlock.emitIndented(body, context, writer);
        writer.emit("end");
    }

    @Override
    public String toString() {
        return "WhileLoop{test=" + test + ", body=" + body.size() + "}";
    }
}
