package me.christianrobert.py2lua.transformation.service;

import me.christianrobert.py2lua.config.service.ConfigService;
import me.christianrobert.py2lua.transformation.context.TransformationResult;
import me.christianrobert.py2lua.transformation.mapping.ApiMappingTable;
import me.christianrobert.py2lua.transformation.parser.SyntaxTreeReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full pipeline from serialized tree to Lua text.
 */
class TranspilationServiceTest {

    private static final String IMPORT_AND_CALL = """
            {"_type": "Module", "body": [
              {"_type": "ImportFrom", "module": "cc_lib",
               "names": [{"_type": "alias", "name": "peripheral", "asname": null}]},
              {"_type": "Expr", "value": {"_type": "Call",
                "func": {"_type": "Attribute", "value": {"_type": "Name", "id": "peripheral"}, "attr": "get_names"},
                "args": [], "keywords": []}}]}
            """;

    private TranspilationService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        service = new TranspilationService();
        service.reader = new SyntaxTreeReader();
        service.configService = configService;
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = TranspilationServiceTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void transpilesFixtureProgram() throws IOException {
        TransformationResult result = service.transpile(fixture("peripheral_scan.json"));

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals(fixture("peripheral_scan.lua").strip(), result.getLuaCode());
        assertNull(result.getErrorMessage());
    }

    @Test
    void unsupportedConstructBecomesFailure() throws IOException {
        TransformationResult result = service.transpile(fixture("unsupported_for.json"));

        assertTrue(result.isFailure());
        assertNull(result.getLuaCode());
        assertTrue(result.getErrorMessage().startsWith("Unsupported node kind: For at line 1"),
                result.getErrorMessage());
    }

    @Test
    void malformedJsonBecomesParseFailure() {
        TransformationResult result = service.transpile("{\"_type\": \"Module\", ");

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Parse errors: "));
    }

    @Test
    void emptyInputBecomesFailure() {
        TransformationResult result = service.transpile("  ");

        assertTrue(result.isFailure());
        assertEquals("Syntax tree cannot be null or empty", result.getErrorMessage());
    }

    @Test
    void configuredOriginsDecideRenaming() {
        assertEquals("peripheral.getNames()", service.transpile(IMPORT_AND_CALL).getLuaCode());

        configService.setConfigValue(ConfigService.API_ORIGINS, "other_lib");
        assertEquals("peripheral.get_names()", service.transpile(IMPORT_AND_CALL).getLuaCode());
    }

    @Test
    void originsStoredAsListStillRename() {
        configService.setConfigValue(ConfigService.API_ORIGINS, List.of("cc_lib", "cc_extra"));

        TransformationResult result = service.transpile(IMPORT_AND_CALL);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals("peripheral.getNames()", result.getLuaCode());
    }

    @Test
    void malformedNodeIsReportedAsTransformationFailure() {
        TransformationResult result = service.transpile("""
                {"_type": "Module", "body": [
                  {"_type": "Assign", "lineno": 2, "targets": [],
                   "value": {"_type": "Constant", "value": 1}}]}
                """);

        assertTrue(result.isFailure());
        assertFalse(result.getErrorMessage().startsWith("Unexpected error"), result.getErrorMessage());
        assertTrue(result.getErrorMessage().contains("Assign at line 2"), result.getErrorMessage());
    }

    @Test
    void explicitMappingTableOverridesConfiguration() {
        TransformationResult result = service.transpile(IMPORT_AND_CALL, ApiMappingTable.forOrigins(List.of()));

        assertTrue(result.isSuccess());
        assertEquals("peripheral.get_names()", result.getLuaCode());
    }

    @Test
    void nullMappingTableRejected() {
        TransformationResult result = service.transpile(IMPORT_AND_CALL, null);
        assertTrue(result.isFailure());
    }

    @Test
    void sourceTreeIsKeptInResult() {
        TransformationResult result = service.transpile(IMPORT_AND_CALL);
        assertEquals(IMPORT_AND_CALL, result.getSourceTree());
    }
}
