package io.surfworks.yovec.lower;

import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.env.Environment;

import java.util.List;

/**
 * Output of {@link Transpiler#transpile}.
 *
 * @param program     YOLOL program with register names ({@code v{index}e{element}})
 * @param environment environment after the last statement
 * @param imports     imported identifiers in declaration order
 * @param exports     export pairs in declaration order
 */
public record TranspileResult(
        SyntaxNode program,
        Environment environment,
        List<String> imports,
        List<ExportPair> exports
) {
    public TranspileResult {
        imports = List.copyOf(imports);
        exports = List.copyOf(exports);
    }
}
