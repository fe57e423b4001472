package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.semantic.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * If statement with optional else branch.
 *
 * <p>Lua output:
 * <pre>
 * if (x &gt; 0) then
 *     local y = 1
 * else
 *     local y = (-1)
 * end
 * </pre>
 * An {@code elif} arrives from the front-end as a nested conditional in the else
 * branch and is emitted that way.
 */
public class Conditional implements Statement {

    private final Expression test;
    private final List<Statement> thenBody;
    private final List<Statement> elseBody;

    public Conditional(Expression test, List<Statement> thenBody, List<Statement> elseBody) {
        if (test == null) {
            throw new IllegalArgumentException("Conditional test cannot be null");
        }
        if (thenBody == null) {
            throw new IllegalArgumentException("Conditional then-body cannot be null");
        }
        this.test = test;
        this.thenBody = new ArrayList<>(thenBody);
        this.elseBody = elseBody != null ? new ArrayList<>(elseBody) : new ArrayList<>();
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getThenBody() {
        return Collections.unmodifiableList(thenBody);
    }

    public List<Statement> getElseBody() {
        return Collections.unmodifiableList(elseBody);
    }

    public boolean hasElse() {
        return !elseBody.isEmpty();
    }

    @Override
    public void toLua(TransformationContext context, LuaCodeWriter writer) {
        writer.emit("if " + test.toLua(context) + " then");
        StatementBlock.emitIndented(thenBody, context, writer);

        if (hasElse()) {
            writer.emit("else");
            StatementBlock.emitIndented(elseBody, context, writer);
        }

        writer.emit("end");
    }

    @Override
    public String toString() {
        return "Conditional{test=" + test + ", then=" + thenBody.size() + ", else=" + elseBody.size() + "}";
    }
}
