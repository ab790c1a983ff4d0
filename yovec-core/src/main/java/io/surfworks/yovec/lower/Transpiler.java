package io.surfworks.yovec.lower;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;
import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.env.Binding;
import io.surfworks.yovec.env.Environment;
import io.surfworks.yovec.env.EnvironmentOptions;
import io.surfworks.yovec.symbolic.Assigned;
import io.surfworks.yovec.symbolic.Shape;
import io.surfworks.yovec.symbolic.SimpleMatrix;
import io.surfworks.yovec.symbolic.SimpleNumber;
import io.surfworks.yovec.symbolic.SimpleVector;
import io.surfworks.yovec.symbolic.SymbolicValue;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lowers a Yovec program into a YOLOL program.
 *
 * <p>Statements are processed in order while the environment and the next register
 * index are threaded through the walk:
 * <ul>
 *   <li>{@code import} binds an imported name and emits nothing</li>
 *   <li>{@code export} checks its source, records the pair and emits nothing</li>
 *   <li>{@code let} assigns its value at the next register index and emits one line</li>
 *   <li>{@code comment} is ignored</li>
 * </ul>
 *
 * <p>The register index grows by one per {@code let}, whatever the value's width.
 * Export renaming is left to {@link ExportRenamer} so callers can inspect the
 * register-named program.
 */
public final class Transpiler {

    private static final Logger LOG = Logger.getLogger(Transpiler.class.getName());

    private final EnvironmentOptions options;

    public Transpiler() {
        this(EnvironmentOptions.defaults());
    }

    public Transpiler(EnvironmentOptions options) {
        this.options = options;
    }

    public TranspileResult transpile(SyntaxNode program) {
        if (program.kind() != NodeKind.PROGRAM) {
            throw CompileException.internal("expected a program node but got %s", program.kind());
        }

        Environment env = Environment.empty(options);
        int index = 0;
        List<SyntaxNode> lines = new ArrayList<>();
        List<String> imports = new ArrayList<>();
        List<ExportPair> exports = new ArrayList<>();

        for (SyntaxNode line : program.children()) {
            if (line.kind() != NodeKind.LINE) {
                throw CompileException.internal("program children must be lines, got %s", line.kind());
            }
            SyntaxNode statement = line.child(0);
            switch (statement.kind()) {
                case IMPORT -> {
                    String ident = statement.child(0).identifier();
                    env = env.bindImport(ident);
                    imports.add(ident);
                    LOG.finer(() -> "import " + ident);
                }
                case EXPORT -> {
                    ExportPair pair = new ExportPair(
                            statement.child(0).identifier(),
                            statement.child(1).identifier());
                    env = transpileExport(env, pair);
                    exports.add(pair);
                    LOG.finer(() -> "export " + pair.before() + " as " + pair.after());
                }
                case LET, VEC_LET, NUM_LET, MAT_LET -> {
                    env = transpileLet(env, index, statement, lines);
                    index++;
                }
                case COMMENT -> {
                }
                default -> throw CompileException.internal("unknown statement kind: %s", statement.kind());
            }
        }

        int registers = index;
        LOG.fine(() -> String.format("Lowered %d statements into %d lines (%d imports, %d exports)",
                program.childCount(), registers, imports.size(), exports.size()));
        return new TranspileResult(SyntaxNode.of(NodeKind.PROGRAM, lines), env, imports, exports);
    }

    private static Environment transpileExport(Environment env, ExportPair pair) {
        if (!env.contains(pair.before())) {
            throw new CompileException(ErrorKind.EXPORT_OF_UNDEFINED_VARIABLE,
                    "cannot export undefined variable: " + pair.before());
        }
        if (!(env.lookup(pair.before()) instanceof Binding.Register)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    "cannot export imported variable: " + pair.before());
        }
        if (env.contains(pair.after()) && env.lookup(pair.after()) instanceof Binding.Imported) {
            throw new CompileException(ErrorKind.CONFLICTING_ALIAS_TARGET,
                    "export name " + pair.after() + " is already an imported variable");
        }
        return env.bindExport(pair.before()).bindAlias(pair.before(), pair.after());
    }

    private static Environment transpileLet(Environment env, int index, SyntaxNode let, List<SyntaxNode> lines) {
        String ident = let.child(0).identifier();
        SymbolicValue value = new ExpressionLowerer(env).lower(let.child(1));
        requireDeclaredShape(let.kind(), ident, value);

        Assigned<? extends SymbolicValue> assigned = value.assign(index);
        lines.add(SyntaxNode.of(NodeKind.LINE, SyntaxNode.of(NodeKind.MULTI, assigned.statements())));
        LOG.finer(() -> String.format("let %s -> register %d (%d statements)",
                ident, index, assigned.statements().size()));

        SymbolicValue residual = assigned.residual();
        if (residual instanceof SimpleNumber number) {
            return env.bindNumber(ident, index, number);
        } else if (residual instanceof SimpleVector vector) {
            return env.bindVector(ident, index, vector);
        } else {
            return env.bindMatrix(ident, index, (SimpleMatrix) residual);
        }
    }

    private static void requireDeclaredShape(NodeKind letKind, String ident, SymbolicValue value) {
        Shape expected = switch (letKind) {
            case VEC_LET -> Shape.VECTOR;
            case NUM_LET -> Shape.NUMBER;
            case MAT_LET -> Shape.MATRIX;
            default -> null;
        };
        if (expected != null && value.shape() != expected) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH, String.format(
                    "%s %s expects a %s but got a %s", letKind, ident,
                    ExpressionLowerer.describe(expected), ExpressionLowerer.describe(value.shape())));
        }
    }
}
