package me.christianrobert.py2lua.driver.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.py2lua.config.service.ConfigService;
import me.christianrobert.py2lua.transformation.context.TransformationResult;
import me.christianrobert.py2lua.transformation.service.TranspilationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a syntax tree file, transpiles it and writes the Lua file.
 * Paths come from the caller or from {@link ConfigService}.
 *
 * <p>The output file is only written when transpilation succeeds.
 */
@ApplicationScoped
public class FileTranspilationService {

    private static final Logger log = LoggerFactory.getLogger(FileTranspilationService.class);

    @Inject
    TranspilationService transpilationService;

    @Inject
    ConfigService configService;

    public Path configuredSource() {
        return Path.of(configService.getConfigValueAsString(ConfigService.IN_FILE));
    }

    public Path configuredTarget() {
        return Path.of(configService.getConfigValueAsString(ConfigService.OUT_FILE));
    }

    public TransformationResult transpileConfiguredFiles() throws IOException {
        return transpileFile(configuredSource(), configuredTarget());
    }

    /**
     * @param source Syntax tree JSON file
     * @param target Lua file, parent directories are created when missing
     * @return Result of the transpilation; the target is untouched on failure
     * @throws SourceFileNotFoundException if the source does not exist
     * @throws IOException if reading or writing fails
     */
    public TransformationResult transpileFile(Path source, Path target) throws IOException {
        if (!Files.exists(source)) {
            log.error("Source file {} not found", source);
            throw new SourceFileNotFoundException(source);
        }

        log.debug("Reading syntax tree from {}", source);
        String treeJson = Files.readString(source, StandardCharsets.UTF_8);

        TransformationResult result = transpilationService.transpile(treeJson);
        if (result.isFailure()) {
            log.warn("Transpiling {} failed, {} not written: {}", source, target, result.getErrorMessage());
            return result;
        }

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, result.getLuaCode(), StandardCharsets.UTF_8);

        log.info("Transpiled {} -> {}", source, target);
        return result;
    }
}
