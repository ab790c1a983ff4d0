package io.surfworks.yovec;

import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.lower.ExportPair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A compiled YOLOL program plus the name contracts it was compiled under.
 *
 * @param program        final output tree, ready for a printer
 * @param imports        imported names, unchanged in the output
 * @param exports        export pairs in declaration order
 * @param protectedNames names kept stable by mangling (imports, export names and
 *                       every name the export rename produced)
 * @param manglings      original register name to mangled name, empty when mangling is off
 */
public record CompilationResult(
        SyntaxNode program,
        List<String> imports,
        List<ExportPair> exports,
        Set<String> protectedNames,
        Map<String, String> manglings
) {
    public CompilationResult {
        imports = List.copyOf(imports);
        exports = List.copyOf(exports);
        protectedNames = Collections.unmodifiableSet(new LinkedHashSet<>(protectedNames));
        manglings = Collections.unmodifiableMap(new LinkedHashMap<>(manglings));
    }

    public int lineCount() {
        return program.childCount();
    }
}
