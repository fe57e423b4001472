package me.christianrobert.py2lua.transformation.semantic;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.semantic.statement.FunctionDefinition;
import me.christianrobert.py2lua.transformation.semantic.statement.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of the semantic tree: the ordered top-level statements of one source file.
 *
 * <p>Python runs top-level code directly, the generated Lua calls its entry point
 * explicitly. When a function named {@code main} is defined at module top level,
 * a trailing {@code main()} line is emitted after all statements.
 */
public class Module {

    private final List<Statement> statements;

    public Module(List<Statement> statements) {
        if (statements == null) {
            throw new IllegalArgumentException("Module statements cannot be null");
        }
        this.statements = new ArrayList<>(statements);
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * @return true if a top-level function named main is defined
     */
    public boolean definesEntryPoint() {
        return statements.stream()
                .anyMatch(statement -> statement instanceof FunctionDefinition
                        && ((FunctionDefinition) statement).isEntryPoint());
    }

    public void toLua(TransformationContext context, LuaCodeWriter writer) {
        for (Statement statement : statements) {
            statement.toLua(context, writer);
        }

        if (definesEntryPoint()) {
            writer.emit(FunctionDefinition.ENTRY_POINT_NAME + "()");
        }
    }

    @Override
    public String toString() {
        return "Module{statements=" + statements.size() + "}";
    }
}
