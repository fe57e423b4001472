package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;

import java.util.List;

/**
 * Emits a nested body one level deeper than the enclosing block header.
 */
final class StatementBlock {

    private StatementBlock() {
    }

    static void emitIndented(List<Statement> body, TransformationContext context, LuaCodeWriter writer) {
        try (LuaCodeWriter.IndentScope ignored = writer.indent()) {
            for (Statement statement : body) {
                statement.toLua(context, writer);
            }
        }
    }
}
