package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;

/**
 * Base interface for all statement nodes of the semantic tree.
 *
 * <p>A statement emits zero or more lines into the writer. Nested bodies are
 * emitted one indentation level deeper; the writer's depth after {@code toLua}
 * returns (or throws) equals its depth before the call.
 */
public interface Statement {

    /**
     * Transform this statement to Lua.
     *
     * @param context Import bindings and API mappings of the current translation
     * @param writer Line sink receiving the generated code
     */
    void toLua(TransformationContext context, LuaCodeWriter writer);
}
