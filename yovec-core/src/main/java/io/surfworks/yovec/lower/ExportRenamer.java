package io.surfworks.yovec.lower;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;
import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.env.Binding;
import io.surfworks.yovec.env.Environment;
import io.surfworks.yovec.symbolic.RegisterNames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renames the registers of exported variables to their export names.
 *
 * <p>A variable whose name starts with the register prefix of an export's source
 * ({@code v{index}e}) gets that prefix replaced by the export name, keeping the
 * element suffix: {@code v3e1} becomes {@code POS1} for {@code export p as POS}.
 * Exports are tried in declaration order and the first match wins.
 */
public final class ExportRenamer {

    private final List<Rule> rules;
    private final Set<String> imported;

    public ExportRenamer(Environment env, List<ExportPair> exports, Collection<String> imported) {
        this.rules = new ArrayList<>(exports.size());
        for (ExportPair pair : exports) {
            int index = env.lookup(pair.before(), Binding.Register.class).index();
            rules.add(new Rule(RegisterNames.prefix(index), pair.after()));
        }
        this.imported = Set.copyOf(imported);
    }

    /**
     * Rewrites the program and reports every name that was produced.
     *
     * @throws CompileException {@code CONFLICTING_ALIAS_TARGET} if a produced name is
     *         produced by two exports, or equals an import or a register that is kept
     */
    public Result rename(SyntaxNode program) {
        Map<String, Rule> producedBy = new LinkedHashMap<>();
        Set<String> kept = new HashSet<>(imported);
        SyntaxNode renamed = program.rewrite(node -> {
            if (node.kind() != NodeKind.VARIABLE || imported.contains(node.value())) {
                return node;
            }
            for (Rule rule : rules) {
                if (node.value().startsWith(rule.prefix())) {
                    String name = rule.after() + node.value().substring(rule.prefix().length());
                    Rule previous = producedBy.putIfAbsent(name, rule);
                    if (previous != null && previous != rule) {
                        throw new CompileException(ErrorKind.CONFLICTING_ALIAS_TARGET, String.format(
                                "exports %s and %s both produce %s", previous.after(), rule.after(), name));
                    }
                    return node.withValue(name);
                }
            }
            kept.add(node.value());
            return node;
        });
        for (String name : producedBy.keySet()) {
            if (kept.contains(name)) {
                throw new CompileException(ErrorKind.CONFLICTING_ALIAS_TARGET,
                        "exported name " + name + " collides with a variable of the same name");
            }
        }
        return new Result(renamed, producedBy.keySet());
    }

    /**
     * @param program       the renamed program
     * @param producedNames names written by the rename, in first-seen order
     */
    public record Result(SyntaxNode program, Set<String> producedNames) {
        public Result {
            producedNames = Collections.unmodifiableSet(new LinkedHashSet<>(producedNames));
        }
    }

    private record Rule(String prefix, String after) {}
}
