package me.christianrobert.py2lua.transformation.mapping;

import me.christianrobert.py2lua.core.tools.NamingConverter;

import java.util.function.Function;

/**
 * How a member name accessed on an imported alias is written in Lua.
 */
public enum MemberNamingRule {

    /** Member name is emitted exactly as written in the source. */
    VERBATIM(Function.identity()),

    /** snake_case member name is emitted as camelCase (peripheral.get_names -> peripheral.getNames). */
    SNAKE_TO_CAMEL(NamingConverter::snakeToCamel);

    private final Function<String, String> transform;

    MemberNamingRule(Function<String, String> transform) {
        this.transform = transform;
    }

    public String apply(String memberName) {
        return transform.apply(memberName);
    }
}
