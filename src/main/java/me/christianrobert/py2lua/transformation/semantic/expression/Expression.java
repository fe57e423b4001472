package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;

/**
 * Base interface for all expression nodes of the semantic tree.
 * Each expression knows how to render itself as Lua source text.
 *
 * <p>Supported variants: literals, identifiers, attribute access, arithmetic,
 * unary minus, single comparisons and positional calls.
 */
public interface Expression {

    /**
     * Transform this expression to its Lua equivalent.
     *
     * @param context Import bindings and API mappings of the current translation
     * @return Lua expression text
     */
    String toLua(TransformationContext context);
}
