package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.UnsupportedConstructException;

/**
 * Python unary operators, keyed by their {@code ast} class name. Only negation translates.
 */
public enum UnaryOperator {
    NEGATE("USub", "-"),
    PLUS("UAdd", null),
    NOT("Not", null),
    INVERT("Invert", null);

    private final String sourceName;
    private final String luaSymbol;

    UnaryOperator(String sourceName, String luaSymbol) {
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

    public static UnaryOperator fromSourceName(String sourceName) {
        for (UnaryOperator operator : values()) {
            if (operator.sourceName.equals(sourceName)) {
                return operator;
            }
        }
        return null;
    }
}
