package me.christianrobert.py2lua.transformation.service;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.py2lua.config.service.ConfigService;
import me.christianrobert.py2lua.transformation.LuaTranspiler;
import me.christianrobert.py2lua.transformation.builder.SemanticTreeBuilder;
import me.christianrobert.py2lua.transformation.context.TransformationException;
import me.christianrobert.py2lua.transformation.context.TransformationResult;
import me.christianrobert.py2lua.transformation.mapping.ApiMappingTable;
import me.christianrobert.py2lua.transformation.parser.ParseResult;
import me.christianrobert.py2lua.transformation.parser.SyntaxTreeReader;
import me.christianrobert.py2lua.transformation.semantic.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level service for transforming a serialized Python syntax tree to Lua.
 * This is the main entry point for the REST endpoint and the file driver.
 *
 * <p>Architecture:
 * <pre>
 * JSON tree → SyntaxTreeReader → SemanticTreeBuilder → LuaTranspiler → Lua
 *                   ↓                    ↓                   ↓
 *               JsonNode              Module          toLua(context, writer)
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * TransformationResult result = service.transpile(treeJson);
 * if (result.isSuccess()) {
 *     String lua = result.getLuaCode();
 * } else {
 *     // Handle error: result.getErrorMessage()
 * }
 * </pre>
 *
 * <p>Never throws: every failure becomes a failure result.
 */
@ApplicationScoped
public class TranspilationService {

    private static final Logger log = LoggerFactory.getLogger(TranspilationService.class);

    @Inject
    SyntaxTreeReader reader;

    @Inject
    ConfigService configService;

    /**
     * Transpiles using the API origins from configuration.
     */
    public TransformationResult transpile(String treeJson) {
        return transpile(treeJson, currentApiMappings());
    }

    /**
     * Transforms a serialized syntax tree to Lua.
     *
     * @param treeJson Syntax tree produced by the Python front-end
     * @param apiMappings Origins whose attribute members are renamed
     * @return TransformationResult containing either Lua code or error details
     */
    public TransformationResult transpile(String treeJson, ApiMappingTable apiMappings) {
        if (treeJson == null || treeJson.trim().isEmpty()) {
            return TransformationResult.failure(treeJson, "Syntax tree cannot be null or empty");
        }
        if (apiMappings == null) {
            return TransformationResult.failure(treeJson, "API mapping table cannot be null");
        }

        log.trace("Syntax tree: {}", treeJson);

        try {
            // STEP 1: Read JSON tree
            log.debug("Step 1: Reading syntax tree");
            ParseResult parseResult = reader.read(treeJson);
            if (parseResult.hasErrors()) {
                String errorMsg = "Parse errors: " + parseResult.getErrorMessage();
                log.warn("Reading syntax tree failed: {}", errorMsg);
                return TransformationResult.failure(treeJson, errorMsg);
            }

            // STEP 2: Build semantic tree
            log.debug("Step 2: Building semantic tree");
            JsonNode tree = parseResult.getTree();
            Module module = new SemanticTreeBuilder().buildModule(tree);

            // STEP 3: Emit Lua
            log.debug("Step 3: Emitting Lua with {}", apiMappings);
            String luaCode = LuaTranspiler.transpile(module, apiMappings);

            log.info("Successfully transpiled module with {} top-level statement(s)", module.getStatements().size());
            log.debug("Lua code: {}", luaCode);

            return TransformationResult.success(treeJson, luaCode);

        } catch (TransformationException e) {
            log.error("Transpilation failed: {}", e.getDetailedMessage());
            return TransformationResult.failure(treeJson, e);

        } catch (Exception e) {
            log.error("Unexpected error during transpilation", e);
            return TransformationResult.failure(treeJson, "Unexpected error: " + e.getMessage());
        }
    }

    ApiMappingTable currentApiMappings() {
        return ApiMappingTable.forOrigins(configService.getConfigValueAsStringList(ConfigService.API_ORIGINS));
    }
}
