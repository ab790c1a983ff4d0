package io.surfworks.yovec;

import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.config.CompilerOptions;
import io.surfworks.yovec.lower.ExportPair;
import io.surfworks.yovec.lower.ExportRenamer;
import io.surfworks.yovec.lower.TranspileResult;
import io.surfworks.yovec.lower.Transpiler;
import io.surfworks.yovec.mangle.Mangler;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Runs the full lowering pipeline: transpile, rename exports, mangle.
 *
 * <p>Example usage:
 * <pre>{@code
 * YovecCompiler compiler = new YovecCompiler(CompilerOptions.defaults());
 * CompilationResult result = compiler.compile(program);
 * String json = SyntaxTreeJson.write(result.program());
 * }</pre>
 *
 * <p>The compiler holds no per-compilation state and can be reused. Any
 * {@link CompileException} aborts the whole compilation.
 */
public final class YovecCompiler {

    private static final Logger LOG = Logger.getLogger(YovecCompiler.class.getName());

    private final CompilerOptions options;

    public YovecCompiler() {
        this(CompilerOptions.defaults());
    }

    public YovecCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public CompilerOptions options() {
        return options;
    }

    public CompilationResult compile(SyntaxNode program) {
        TranspileResult lowered = new Transpiler(options.environmentOptions()).transpile(program);
        SyntaxNode output = lowered.program();

        Set<String> exported = new LinkedHashSet<>();
        for (ExportPair pair : lowered.exports()) {
            exported.add(pair.after());
        }
        if (options.renameExports()) {
            ExportRenamer.Result renamed = new ExportRenamer(lowered.environment(), lowered.exports(), lowered.imports())
                    .rename(output);
            output = renamed.program();
            exported.addAll(renamed.producedNames());
        }

        Set<String> protectedNames = new LinkedHashSet<>(lowered.imports());
        protectedNames.addAll(exported);

        Map<String, String> manglings = Map.of();
        if (options.mangleNames()) {
            Mangler mangler = new Mangler(lowered.imports(), exported, options.reservedNames());
            output = mangler.apply(output);
            manglings = mangler.replacements();
        }

        LOG.fine(() -> "Compiled program into " + lowered.program().childCount() + " lines");
        return new CompilationResult(output, lowered.imports(), lowered.exports(), protectedNames, manglings);
    }
}
