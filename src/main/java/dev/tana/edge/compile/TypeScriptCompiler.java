package dev.tana.edge.compile;

import dev.tana.edge.error.EdgeException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

/**
 * Runs {@code typescript.js}' {@code transpileModule} (ES2020 target, ESNext modules) in a private
 * GraalJS context. The compiler is loaded lazily and calls are serialized.
 */
public final class TypeScriptCompiler implements SourceCompiler, AutoCloseable {
    private static final Logger log = LogManager.getLogger(TypeScriptCompiler.class);

    private static final String TRANSPILE = "(function (source, fileName) {\n"
        + "  return ts.transpileModule(source, {\n"
        + "    fileName: fileName,\n"
        + "    compilerOptions: { target: ts.ScriptTarget.ES2020, module: ts.ModuleKind.ESNext }\n"
        + "  }).outputText;\n"
        + "})";

    private final Path compilerScript;
    private Context context;
    private Value transpile;

    public TypeScriptCompiler(Path compilerScript) {
        this.compilerScript = compilerScript;
    }

    @Override
    public synchronized String compile(String source, String fileName) {
        Value fn = ensureLoaded();
        try {
            return fn.execute(source, fileName).asString();
        } catch (PolyglotException ex) {
            throw EdgeException.setup("Failed to compile " + fileName + ": " + ex.getMessage(), ex);
        }
    }

    private Value ensureLoaded() {
        if (transpile != null) {
            return transpile;
        }
        if (compilerScript == null || !Files.isRegularFile(compilerScript)) {
            throw EdgeException.setup("Missing typescript.js: " + compilerScript);
        }
        long started = System.nanoTime();
        Context created = Context.newBuilder("js")
            .allowExperimentalOptions(true)
            .option("engine.WarnInterpreterOnly", "false")
            .option("js.ecmascript-version", "2022")
            .build();
        try {
            created.eval(Source.newBuilder("js", compilerScript.toFile()).build());
            transpile = created.eval("js", TRANSPILE);
        } catch (IOException | PolyglotException ex) {
            created.close();
            throw EdgeException.setup("Failed to load TypeScript from " + compilerScript + ": " + ex.getMessage(), ex);
        }
        context = created;
        log.info("Loaded TypeScript compiler from {} in {}ms", compilerScript, (System.nanoTime() - started) / 1_000_000);
        return transpile;
    }

    @Override
    public synchronized void close() {
        if (context != null) {
            context.close();
            context = null;
            transpile = null;
        }
    }
}
