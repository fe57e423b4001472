package me.christianrobert.py2lua.transformation.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.py2lua.driver.service.FileTranspilationService;
import me.christianrobert.py2lua.driver.service.SourceFileNotFoundException;
import me.christianrobert.py2lua.transformation.context.TransformationResult;
import me.christianrobert.py2lua.transformation.service.TranspilationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * REST endpoint for Python to Lua transpilation.
 *
 * <p>Usage:
 * <pre>
 * # Transpile a syntax tree (dumped by the Python front-end)
 * curl -X POST "http://localhost:8080/api/transpilation/lua" \
 *   -H "Content-Type: application/json" \
 *   --data @transpiler_in.json
 *
 * # Transpile the configured input file to the configured output file
 * curl -X POST "http://localhost:8080/api/transpilation/file"
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "luaCode": "...",
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * An unsupported construct is a valid business outcome, not an HTTP error.
 */
@Path("/api/transpilation")
@Produces(MediaType.APPLICATION_JSON)
public class TranspilationResource {

    private static final Logger log = LoggerFactory.getLogger(TranspilationResource.class);

    @Inject
    TranspilationService transpilationService;

    @Inject
    FileTranspilationService fileTranspilationService;

    @POST
    @Path("/lua")
    @Consumes(MediaType.APPLICATION_JSON)
    public TransformationResult transpile(String treeJson) {
        log.info("Transpilation request received via REST API");

        if (treeJson == null || treeJson.trim().isEmpty()) {
            log.warn("Empty syntax tree received");
            return TransformationResult.failure("", "Syntax tree cannot be empty");
        }

        TransformationResult result = transpilationService.transpile(treeJson);
        if (result.isSuccess()) {
            log.info("Transpilation succeeded");
        } else {
            log.warn("Transpilation failed: {}", result.getErrorMessage());
        }
        return result;
    }

    @POST
    @Path("/file")
    public TransformationResult transpileConfiguredFiles() {
        log.info("File transpilation request received via REST API");

        try {
            return fileTranspilationService.transpileConfiguredFiles();
        } catch (SourceFileNotFoundException e) {
            log.warn(e.getMessage());
            return TransformationResult.failure(null, e.getMessage());
        } catch (IOException e) {
            log.error("I/O error during file transpilation", e);
            return TransformationResult.failure(null, "I/O error: " + e.getMessage());
        }
    }
}
