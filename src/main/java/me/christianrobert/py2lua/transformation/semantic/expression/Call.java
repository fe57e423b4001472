package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Function or method call with positional arguments: {@code callee(a, b)}.
 *
 * <p>The callee is translated like any other expression. A bare imported name
 * called directly is not renamed; renaming only happens through {@link AttributeAccess}.
 */
public class Call implements Expression {

    private final Expression callee;
    private final List<Expression> arguments;

    public Call(Expression callee, List<Expression> arguments) {
        if (callee == null) {
            throw new IllegalArgumentException("Call callee cannot be null");
        }
        this.callee = callee;
        this.arguments = arguments != null ? new ArrayList<>(arguments) : new ArrayList<>();
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public String toLua(TransformationContext context) {
        String calleeLua = callee.toLua(context);
        String argumentsLua = arguments.stream()
                .map(argument -> argument.toLua(context))
                .collect(Collectors.joining(", "));
        return calleeLua + "(" + argumentsLua + ")";
    }

    @Override
    public String toString() {
        return "Call{callee=" + callee + ", arguments=" + arguments.size() + "}";
    }
}
