package me.christianrobert.py2lua.transformation.semantic.statement;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.resolver.ImportBinding;

import java.util.List;

/**
 * Import-style statement. Contributes bindings to the import resolver and emits no Lua.
 */
public interface ImportStatement extends Statement {

    List<ImportBinding> getBindings();

    @Override
    default void toLua(TransformationContext context, LuaCodeWriter writer) {
        // resolved up front, nothing to emit
    }
}
