package me.christianrobert.py2lua.driver;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import me.christianrobert.py2lua.config.service.ConfigService;
import me.christianrobert.py2lua.driver.service.FileTranspilationService;
import me.christianrobert.py2lua.driver.service.SourceFileNotFoundException;
import me.christianrobert.py2lua.transformation.context.TransformationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Application entry point.
 *
 * <pre>
 * py2lua &lt;tree.json&gt; &lt;out.lua&gt;     transpile one file and exit
 * py2lua                            transpile configured files if run_on_start=true,
 *                                   otherwise serve the REST API
 * </pre>
 *
 * Exit codes: 0 success, 1 missing input / I/O error / unsupported construct, 2 usage.
 *
 * <p>The input is the tree of Python's {@code ast} module as JSON, one object per node with
 * its class name in {@code _type}. See {@code README.md} for a dumper script.
 */
@QuarkusMain
public class TranspilerMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(TranspilerMain.class);

    @Inject
    FileTranspilationService fileTranspilationService;

    @Inject
    ConfigService configService;

    public static void main(String... args) {
        Quarkus.run(TranspilerMain.class, args);
    }

    @Override
    public int run(String... args) {
        if (args.length == 2) {
            return transpile(Path.of(args[0]), Path.of(args[1]));
        }
        if (args.length != 0) {
            System.err.println("usage: py2lua [<tree.json> <out.lua>]");
            return 2;
        }

        if (Boolean.TRUE.equals(configService.getConfigValueAsBoolean(ConfigService.RUN_ON_START))) {
            return transpile(fileTranspilationService.configuredSource(), fileTranspilationService.configuredTarget());
        }

        log.info("No input given, serving REST API");
        Quarkus.waitForExit();
        return 0;
    }

    int transpile(Path source, Path target) {
        try {
            TransformationResult result = fileTranspilationService.transpileFile(source, target);
            if (result.isFailure()) {
                System.err.println(result.getErrorMessage());
                return 1;
            }
            System.out.println("Transpiled " + source + " -> " + target);
            return 0;
        } catch (SourceFileNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O error while transpiling {}", source, e);
            System.err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }
}
