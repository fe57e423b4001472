package me.christianrobert.py2lua.transformation;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.context.TransformationException;
import me.christianrobert.py2lua.transformation.mapping.ApiMappingTable;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.resolver.ImportBindings;
import me.christianrobert.py2lua.transformation.resolver.ImportResolver;
import me.christianrobert.py2lua.transformation.semantic.Module;

/**
 * Entry point of the translation core.
 *
 * <p>Architecture:
 * <pre>
 * Module ──► ImportResolver ──► TransformationContext
 *    │                                  │
 *    └──────► Statement.toLua(context, writer) ──► Expression.toLua(context)
 *                              │
 *                         LuaCodeWriter ──► Lua text
 * </pre>
 *
 * <p>Each call owns its own context and writer, so concurrent calls need no coordination.
 * No I/O happens here.
 */
public final class LuaTranspiler {

    private LuaTranspiler() {
    }

    /**
     * Translates a semantic tree to Lua source text.
     *
     * @param module Root of the tree produced by the front-end
     * @param apiMappings Origins whose attribute members are renamed
     * @return Lua source, lines joined by '\n'
     * @throws TransformationException if the tree uses a construct that does not translate
     */
    public static String transpile(Module module, ApiMappingTable apiMappings) {
        if (module == null) {
            throw new TransformationException("Module cannot be null");
        }
        if (apiMappings == null) {
            throw new TransformationException("API mapping table cannot be null");
        }

        ImportBindings imports = ImportResolver.resolve(module.getStatements());
        TransformationContext context = new TransformationContext(imports, apiMappings);

        LuaCodeWriter writer = new LuaCodeWriter();
        module.toLua(context, writer);
        return writer.toCode();
    }
}
