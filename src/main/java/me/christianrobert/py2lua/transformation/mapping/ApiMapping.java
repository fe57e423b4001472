package me.christianrobert.py2lua.transformation.mapping;

/**
 * Static knowledge about one import origin whose members map onto the Lua API.
 * Pure metadata: the translator consults it, nothing ever invokes it.
 */
public class ApiMapping {

    private final String origin;
    private final MemberNamingRule namingRule;

    public ApiMapping(String origin, MemberNamingRule namingRule) {
        if (origin == null || origin.trim().isEmpty()) {
            throw new IllegalArgumentException("API mapping origin cannot be null or empty");
        }
        if (namingRule == null) {
            throw new IllegalArgumentException("API mapping naming rule cannot be null");
        }
        this.origin = origin;
        this.namingRule = namingRule;
    }

    public String getOrigin() {
        return origin;
    }

    public MemberNamingRule getNamingRule() {
        return namingRule;
    }

    @Override
    public String toString() {
        return "ApiMapping{origin='" + origin + "', namingRule=" + namingRule + "}";
    }
}
