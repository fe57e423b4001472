package me.christianrobert.py2lua.transformation.context;

import me.christianrobert.py2lua.transformation.mapping.ApiMappingTable;
import me.christianrobert.py2lua.transformation.mapping.MemberNamingRule;
import me.christianrobert.py2lua.transformation.resolver.ImportBinding;
import me.christianrobert.py2lua.transformation.resolver.ImportBindings;

/**
 * Provides the read-only knowledge every semantic node needs while emitting Lua.
 *
 * <p>Contains:
 * <ul>
 *   <li>Import bindings resolved from the module's top level</li>
 *   <li>The API mapping table deciding which imported origins get member renaming</li>
 * </ul>
 *
 * <p>One context per translation run; it is never shared between runs.
 */
public class TransformationContext {

    private final ImportBindings imports;
    private final ApiMappingTable apiMappings;

    public TransformationContext(ImportBindings imports, ApiMappingTable apiMappings) {
        if (imports == null) {
            throw new IllegalArgumentException("Import bindings cannot be null");
        }
        if (apiMappings == null) {
            throw new IllegalArgumentException("API mapping table cannot be null");
        }
        this.imports = imports;
        this.apiMappings = apiMappings;
    }

    // ========== Import Resolution ==========

    /**
     * @param localName Name as written in the source
     * @return Import binding or null if the name is not imported at module level
     */
    public ImportBinding resolveImport(String localName) {
        return imports.resolve(localName);
    }

    /**
     * Decides how members accessed on a bare name are written.
     * Only names imported from a mapped origin get a non-verbatim rule.
     *
     * @param localName Name the attribute access is based on
     * @return Naming rule for that name's members
     */
    public MemberNamingRule memberNamingRuleFor(String localName) {
        ImportBinding binding = resolveImport(localName);
        if (binding == null) {
            return MemberNamingRule.VERBATIM;
        }
        return apiMappings.namingRuleFor(binding.getOrigin());
    }
}
