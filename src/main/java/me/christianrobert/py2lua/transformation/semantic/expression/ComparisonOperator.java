package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.UnsupportedConstructException;

/**
 * Python comparison operators, keyed by their {@code ast} class name.
 * Equality becomes {@code ==}, inequality becomes Lua's {@code ~=},
 * relational operators pass through. Identity and membership tests do not translate.
 */
public enum ComparisonOperator {
    EQUAL("Eq", "=="),
    NOT_EQUAL("NotEq", "~="),
    LESS("Lt", "<"),
    LESS_OR_EQUAL("LtE", "<="),
    GREATER("Gt", ">"),
    GREATER_OR_EQUAL("GtE", ">="),
    IS("Is", null),
    IS_NOT("IsNot", null),
    IN("In", null),
    NOT_IN("NotIn", null);

    private final String sourceName;
    private final String luaSymbol;

    ComparisonOperator(String sourceName, String luaSymbol) {
        this.sourceName = sourceName;
        this.luaSymbol = luaSymbol;
    }

    public boolean isSupported() {
        return luaSymbol != null;
    }

    public String toLua() {
        if (luaSymbol == null) {
            throw new UnsupportedConstructException(UnsupportedConstructException.Reason.UNSUPPORTED_OPERATOR, sourceName);
        }
        return luaSymbol;
    }

    public static ComparisonOperator fromSourceName(String sourceName) {
        for (ComparisonOperator operator : values()) {
            if (operator.sourceName.equals(sourceName)) {
                return operator;
            }
        }
        return null;
    }
}
