package me.christianrobert.py2lua.transformation.mapping;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable registry of {@link ApiMapping} entries keyed by import origin.
 *
 * <p>The table is handed to the translator explicitly; there is no global registry.
 * The default table contains the single designated origin {@value #DESIGNATED_ORIGIN},
 * whose attribute members are renamed from snake_case to camelCase.
 *
 * <p>Usage:
 * <pre>
 * ApiMappingTable table = ApiMappingTable.defaults();
 * table.namingRuleFor("cc_lib");   // SNAKE_TO_CAMEL
 * table.namingRuleFor("os");       // VERBATIM
 * </pre>
 */
public class ApiMappingTable {

    public static final String DESIGNATED_ORIGIN = "cc_lib";

    private final Map<String, ApiMapping> mappingsByOrigin;

    private ApiMappingTable(Map<String, ApiMapping> mappingsByOrigin) {
        this.mappingsByOrigin = Collections.unmodifiableMap(mappingsByOrigin);
    }

    /**
     * Builds a table from explicit entries. A later entry for the same origin replaces an earlier one.
     */
    public static ApiMappingTable of(Collection<ApiMapping> mappings) {
        if (mappings == null) {
            throw new IllegalArgumentException("API mappings cannot be null");
        }
        Map<String, ApiMapping> byOrigin = new LinkedHashMap<>();
        for (ApiMapping mapping : mappings) {
            byOrigin.put(mapping.getOrigin(), mapping);
        }
        return new ApiMappingTable(byOrigin);
    }

    /**
     * Builds a table where every given origin uses the snake_case to camelCase rule.
     */
    public static ApiMappingTable forOrigins(Collection<String> origins) {
        if (origins == null) {
            throw new IllegalArgumentException("API origins cannot be null");
        }
        List<ApiMapping> mappings = origins.stream()
                .map(origin -> new ApiMapping(origin, MemberNamingRule.SNAKE_TO_CAMEL))
                .collect(Collectors.toList());
        return of(mappings);
    }

    public static ApiMappingTable defaults() {
        return forOrigins(List.of(DESIGNATED_ORIGIN));
    }

    public static ApiMappingTable empty() {
        return new ApiMappingTable(new LinkedHashMap<>());
    }

    public boolean isMapped(String origin) {
        return origin != null && mappingsByOrigin.containsKey(origin);
    }

    /**
     * Naming rule for members of the given origin; {@link MemberNamingRule#VERBATIM} when the origin is not mapped.
     */
    public MemberNamingRule namingRuleFor(String origin) {
        if (!isMapped(origin)) {
            return MemberNamingRule.VERBATIM;
        }
        return mappingsByOrigin.get(origin).getNamingRule();
    }

    public Collection<ApiMapping> getMappings() {
        return mappingsByOrigin.values();
    }

    @Override
    public String toString() {
        return "ApiMappingTable{origins=" + mappingsByOrigin.keySet() + "}";
    }
}
