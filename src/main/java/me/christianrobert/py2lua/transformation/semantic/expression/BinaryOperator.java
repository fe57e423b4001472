package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.UnsupportedConstructException;

/**
 * Python binary operators, keyed by their {@code ast} class name.
 * Only the four arithmetic operators have a Lua symbol; the rest fail on translation.
 */
public enum BinaryOperator {
    ADD("Add", "+"),
    SUBTRACT("Sub", "-"),
    MULTIPLY("Mult", "*"),
    DIVIDE("Div", "/"),
    FLOOR_DIVIDE("FloorDiv", null),
    MODULO("Mod", null),
    POWER("Pow", null),
    MATRIX_MULTIPLY("MatMult", null),
    LEFT_SHIFT("LShift", null),
    RIGHT_SHIFT("RShift", null),
    BIT_OR("BitOr", null),
    BIT_XOR("BitXor", null),
    BIT_AND("BitAnd", null);

    private final String sourceName;
    private final String luaSymbol;

    BinaryOperator(String sourceName, String luaSymbol) {
        this.sourceName = sourceName;
        this.luaSymbol = luaSymbol;
    }

    public boolean isSupported() {
        return luaSymbol != null;
    }

    /**
     * @return Lua operator symbol
     * @throws UnsupportedConstructException if Lua translation of this operator is not supported
     */
    public String toLua() {
        if (luaSymbol == null) {
            throw new UnsupportedConstructException(UnsupportedConstructException.Reason.UNSUPPORTED_OPERATOR, sourceName);
        }
        return luaSymbol;
    }

    /**
     * @return Operator for the given ast class name, or null if unknown
     */
    public static BinaryOperator fromSourceName(String sourceName) {
        for (BinaryOperator operator : values()) {
            if (operator.sourceName.equals(sourceName)) {
                return operator;
            }
        }
        return null;
    }
}
