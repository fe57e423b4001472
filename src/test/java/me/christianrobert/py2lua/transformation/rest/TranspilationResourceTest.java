package me.christianrobert.py2lua.transformation.rest;

import me.christianrobert.py2lua.driver.service.FileTranspilationService;
import me.christianrobert.py2lua.driver.service.SourceFileNotFoundException;
import me.christianrobert.py2lua.transformation.context.TransformationResult;
import me.christianrobert.py2lua.transformation.service.TranspilationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TranspilationResourceTest {

    private TranspilationService transpilationService;
    private FileTranspilationService fileTranspilationService;
    private TranspilationResource resource;

    @BeforeEach
    void setUp() {
        transpilationService = mock(TranspilationService.class);
        fileTranspilationService = mock(FileTranspilationService.class);

        resource = new TranspilationResource();
        resource.transpilationService = transpilationService;
        resource.fileTranspilationService = fileTranspilationService;
    }

    @Test
    void emptyBodyFailsWithoutCallingService() {
        TransformationResult result = resource.transpile("");

        assertTrue(result.isFailure());
        assertEquals("Syntax tree cannot be empty", result.getErrorMessage());
        verifyNoInteractions(transpilationService);
    }

    @Test
    void delegatesTreeToService() {
        TransformationResult expected = TransformationResult.success("{}", "local x = 1");
        when(transpilationService.transpile("{}")).thenReturn(expected);

        assertSame(expected, resource.transpile("{}"));
    }

    @Test
    void missingConfiguredFileBecomesFailure() throws Exception {
        when(fileTranspilationService.transpileConfiguredFiles())
                .thenThrow(new SourceFileNotFoundException(Path.of("transpiler_in.json")));

        TransformationResult result = resource.transpileConfiguredFiles();

        assertTrue(result.isFailure());
        assertEquals("Source file transpiler_in.json not found", result.getErrorMessage());
    }

    @Test
    void ioErrorBecomesFailure() throws Exception {
        when(fileTranspilationService.transpileConfiguredFiles()).thenThrow(new IOException("read-only"));

        TransformationResult result = resource.transpileConfiguredFiles();

        assertEquals("I/O error: read-only", result.getErrorMessage());
    }
}
