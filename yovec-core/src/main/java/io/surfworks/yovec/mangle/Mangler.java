package io.surfworks.yovec.mangle;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Renames every variable of a YOLOL program to the shortest free name.
 *
 * <p>Imported and exported names are left alone and never handed out as
 * replacements. Reserved words of the target language are never handed out either. Every other distinct name gets the next name from a {@link NamePool},
 * in order of first appearance in a preorder scan, and keeps it everywhere it occurs.
 * The input tree is not modified.
 *
 * <p>Example:
 * <pre>{@code
 * SyntaxNode mangled = Mangler.mangle(program, Set.of("A"), Set.of("OUT"));
 * }</pre>
 */
public final class Mangler {

    private static final Logger LOG = Logger.getLogger(Mangler.class.getName());

    /** YOLOL keywords and builtin operators, which cannot be used as variable names. */
    public static final Set<String> RESERVED_WORDS = Set.of(
            "if", "then", "else", "end", "goto",
            "and", "or", "not",
            "abs", "sqrt", "sin", "cos", "tan", "asin", "acos", "atan");

    private final Set<String> excluded;
    private final NamePool pool;
    private final Map<String, String> replacements = new LinkedHashMap<>();

    public Mangler(Collection<String> imported, Collection<String> exported) {
        this(imported, exported, RESERVED_WORDS);
    }

    public Mangler(Collection<String> imported, Collection<String> exported, Collection<String> reserved) {
        Set<String> protectedNames = new HashSet<>(imported);
        protectedNames.addAll(exported);
        this.excluded = Set.copyOf(protectedNames);
        Set<String> unavailable = new HashSet<>(protectedNames);
        unavailable.addAll(reserved);
        this.pool = new NamePool(unavailable);
    }

    public static SyntaxNode mangle(SyntaxNode program, Collection<String> imported, Collection<String> exported) {
        return new Mangler(imported, exported).apply(program);
    }

    public SyntaxNode apply(SyntaxNode program) {
        if (program.kind() != NodeKind.PROGRAM) {
            throw CompileException.internal("can only mangle a program, got %s", program.kind());
        }
        // Preorder scan fixes the first-encounter order before the bottom-up rewrite.
        for (SyntaxNode variable : program.find(node -> node.kind() == NodeKind.VARIABLE)) {
            replace(variable.value());
        }
        SyntaxNode mangled = program.copy().rewrite(node ->
                node.kind() == NodeKind.VARIABLE ? node.withValue(replace(node.value())) : node);
        LOG.fine(() -> "Mangled " + replacements.size() + " names, kept " + excluded.size() + " protected names");
        return mangled;
    }

    /**
     * Replacement for a name, chosen on first request and memoized.
     */
    public String replace(String name) {
        if (excluded.contains(name)) {
            return name;
        }
        return replacements.computeIfAbsent(name, ignored -> pool.next());
    }

    /**
     * Replacements chosen so far, in the order they were chosen.
     */
    public Map<String, String> replacements() {
        return Collections.unmodifiableMap(replacements);
    }
}
