package me.christianrobert.py2lua.transformation.resolver;

import me.christianrobert.py2lua.transformation.semantic.statement.ImportStatement;
import me.christianrobert.py2lua.transformation.semantic.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects import bindings from the top-level statements of a module.
 *
 * <p>Single pass, run before any code is emitted. Only module top level is scanned;
 * imports nested inside function bodies or branches are not resolved.
 * Re-importing a local name replaces the earlier binding (last one wins).
 */
public class ImportResolver {

    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    private ImportResolver() {
    }

    public static ImportBindings resolve(List<Statement> topLevelStatements) {
        if (topLevelStatements == null) {
            throw new IllegalArgumentException("Top-level statements cannot be null");
        }

        Map<String, ImportBinding> bindings = new LinkedHashMap<>();
        for (Statement statement : topLevelStatements) {
            if (!(statement instanceof ImportStatement)) {
                continue;
            }
            for (ImportBinding binding : ((ImportStatement) statement).getBindings()) {
                ImportBinding previous = bindings.put(binding.getLocalName(), binding);
                if (previous != null) {
                    log.debug("Import '{}' rebound: {} replaced by {}", binding.getLocalName(), previous, binding);
                }
            }
        }

        log.debug("Resolved {} import binding(s)", bindings.size());
        return new ImportBindings(bindings);
    }
}
