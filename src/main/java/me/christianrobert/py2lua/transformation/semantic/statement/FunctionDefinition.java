package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.context.UnsupportedConstructException;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Function definition with plain positional parameters.
 *
 * <p>Lua output:
 * <pre>
 * function scan(side, depth)
 *     ...
 * end
 * </pre>
 * Defaults, {@code *args}, keyword-only and {@code **kwargs} parameters fail.
 * A function named {@value #ENTRY_POINT_NAME} is the module's entry point.
 */
public class FunctionDefinition implements Statement {

    public static final String ENTRY_POINT_NAME = "main";

    private final String name;
    private final List<Parameter> parameters;
    private final List<Statement> body;

    public FunctionDefinition(String name, List<Parameter> parameters, List<Statement> body) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be null or empty");
        }
        if (body == null) {
            throw new IllegalArgumentException("Function body cannot be null");
        }
        this.name = name;
        this.parameters = parameters != null ? new ArrayList<>(parameters) : new ArrayList<>();
        this.body = new ArrayList<>(body);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<Statement> getBody() {
        return Collections.unmodifiableList(body);
    }

    public boolean isEntryPoint() {
        return ENTRY_POINT_NAME.equals(name);
    }

    @Override
    public void toLua(TransformationContext context, LuaCodeWriter writer) {
        for (Parameter parameter : parameters) {
            if (!parameter.isPositional()) {
                throw new UnsupportedConstructException(
                        UnsupportedConstructException.Reason.NON_POSITIONAL_PARAMETER,
                        parameter.getName() + " (" + parameter.getKind() + ")",
                        "function " + name);
            }
        }

        String parameterList = parameters.stream()
                .map(Parameter::getName)
                .collect(Collectors.joining(", "));

        writer.emit("function " + name + "(" + parameterList + ")");
        StatementBlock.emitIndented(body, context, writer);
        writer.emit("end");
    }

    @Override
    public String toString() {
        return "FunctionDefinition{name='" + name + "', parameters=" + parameters + ", body=" + body.size() + "}";
    }
}
