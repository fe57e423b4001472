package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.context.UnsupportedConstructException;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.semantic.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assignment {@code target = value}, emitted as {@code local target = value}.
 *
 * <p>Every assignment becomes a fresh local declaration, reassignments included.
 * The node keeps all targets the front-end reported so that {@code a = b = 1}
 * can be rejected explicitly.
 */
public class Assignment implements Statement {

    private final List<Expression> targets;
    private final Expression value;

    public Assignment(Expression target, Expression value) {
        this(List.of(target), value);
    }

    public Assignment(List<Expression> targets, Expression value) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("Assignment must have at least one target");
        }
        if (value == null) {
            throw new IllegalArgumentException("Assignment value cannot be null");
        }
        this.targets = new ArrayList<>(targets);
        this.value = value;
    }

    public List<Expression> getTargets() {
        return Collections.unmodifiableList(targets);
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public void toLua(TransformationContext context, LuaCodeWriter writer) {
        if (targets.size() != 1) {
            throw new UnsupportedConstructException(
                    UnsupportedConstructException.Reason.MULTIPLE_ASSIGNMENT_TARGETS,
                    targets.size() + " targets");
        }
        String targetLua = targets.get(0).toLua(context);
        String valueLua = value.toLua(context);
        writer.emit("local " + targetLua + " = " + valueLua);
    }

    @Override
    public String toString() {
        return "Assignment{targets=" + targets + ", value=" + value + "}";
    }
}
