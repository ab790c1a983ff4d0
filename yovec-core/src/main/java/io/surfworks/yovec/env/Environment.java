package io.surfworks.yovec.env;

import clojure.lang.IPersistentMap;
import clojure.lang.PersistentHashMap;
import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;
import io.surfworks.yovec.symbolic.SimpleMatrix;
import io.surfworks.yovec.symbolic.SimpleNumber;
import io.surfworks.yovec.symbolic.SimpleVector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persistent symbol environment for one program.
 *
 * <p>Holds variable bindings (imports, export markers, register bindings) and
 * aliases. Every {@code bind*} method returns a new environment and leaves the
 * receiver as it was, so a caller can keep an older environment around and keep
 * observing the state before the update:
 * <pre>{@code
 * Environment before = Environment.empty();
 * Environment after = before.bindImport("A");
 * before.contains("A"); // false
 * after.contains("A");  // true
 * }</pre>
 *
 * <p>Identifiers are never shadowed or rebound. The tables are Clojure persistent
 * hash maps, so an update shares structure with the environment it came from.
 */
public final class Environment {

    /** Export markers live under this prefix so they never collide with variables. */
    public static final String EXPORT_PREFIX = "#exported:";

    private static final Binding IMPORTED = new Binding.Imported();
    private static final Binding EXPORTED = new Binding.Exported();

    // String -> Binding
    private final IPersistentMap variables;
    // alias -> target
    private final IPersistentMap aliases;
    // target -> alias
    private final IPersistentMap aliasTargets;
    private final EnvironmentOptions options;

    private Environment(IPersistentMap variables,
                        IPersistentMap aliases,
                        IPersistentMap aliasTargets,
                        EnvironmentOptions options) {
        this.variables = variables;
        this.aliases = aliases;
        this.aliasTargets = aliasTargets;
        this.options = options;
    }

    public static Environment empty() {
        return empty(EnvironmentOptions.defaults());
    }

    public static Environment empty(EnvironmentOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        return new Environment(PersistentHashMap.EMPTY, PersistentHashMap.EMPTY, PersistentHashMap.EMPTY, options);
    }

    public EnvironmentOptions options() {
        return options;
    }

    // ==================== Variables ====================

    public boolean contains(String ident) {
        return variables.containsKey(ident);
    }

    public Binding lookup(String ident) {
        Binding binding = (Binding) variables.valAt(ident);
        if (binding == null) {
            throw new CompileException(ErrorKind.UNDEFINED_VARIABLE, "undefined variable: " + ident);
        }
        return binding;
    }

    /**
     * Looks up a binding and checks its kind.
     *
     * @throws CompileException {@code TYPE_MISMATCH} if the binding is not an {@code expected}
     */
    public <T extends Binding> T lookup(String ident, Class<T> expected) {
        Binding binding = lookup(ident);
        if (!expected.isInstance(binding)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH, String.format(
                    "expected %s to be a %s, but it is a %s",
                    ident, describe(expected), binding.describe()));
        }
        return expected.cast(binding);
    }

    public boolean isExported(String ident) {
        return variables.containsKey(EXPORT_PREFIX + ident);
    }

    public Environment bindImport(String ident) {
        if (variables.containsKey(ident)) {
            throw new CompileException(ErrorKind.IMPORT_REDEFINITION, "cannot redefine existing variable by import: " + ident);
        }
        return withVariable(ident, IMPORTED);
    }

    public Environment bindExport(String ident) {
        String key = EXPORT_PREFIX + ident;
        if (variables.containsKey(key)) {
            throw new CompileException(ErrorKind.EXPORT_REDEFINITION, "variable already exported: " + ident);
        }
        return withVariable(key, EXPORTED);
    }

    public Environment bindNumber(String ident, int index, SimpleNumber value) {
        return bindRegister(ident, new Binding.NumberBinding(index, value));
    }

    public Environment bindVector(String ident, int index, SimpleVector value) {
        return bindRegister(ident, new Binding.VectorBinding(index, value));
    }

    public Environment bindMatrix(String ident, int index, SimpleMatrix value) {
        return bindRegister(ident, new Binding.MatrixBinding(index, value));
    }

    private Environment bindRegister(String ident, Binding.Register binding) {
        if (binding.index() < 0) {
            throw CompileException.internal("negative register index %d for %s", binding.index(), ident);
        }
        if (variables.containsKey(ident)) {
            throw new CompileException(ErrorKind.REDEFINITION, "cannot redefine existing variable: " + ident);
        }
        return withVariable(ident, binding);
    }

    /**
     * Snapshot of all variable bindings, export markers included.
     */
    public Map<String, Binding> variables() {
        Map<String, Binding> snapshot = new LinkedHashMap<>();
        for (Object entry : variables) {
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) entry;
            snapshot.put((String) e.getKey(), (Binding) e.getValue());
        }
        return snapshot;
    }

    // ==================== Aliases ====================

    public String lookupAlias(String alias) {
        String target = (String) aliases.valAt(alias);
        if (target == null) {
            throw new CompileException(ErrorKind.UNDEFINED_ALIAS, "undefined alias: " + alias);
        }
        return target;
    }

    /**
     * Binds {@code alias} to {@code target}. Targets are unique across all aliases.
     */
    public Environment bindAlias(String alias, String target) {
        if (aliases.containsKey(alias)) {
            throw new CompileException(ErrorKind.REDEFINITION, "cannot redefine existing alias: " + alias);
        }
        if (aliasTargets.containsKey(target)) {
            throw new CompileException(ErrorKind.CONFLICTING_ALIAS_TARGET, String.format(
                    "conflicting alias target: %s is already the target of %s", target, aliasTargets.valAt(target)));
        }
        if (options.isExportStyle(alias) && !(variables.valAt(alias) instanceof Binding.Register)) {
            throw new CompileException(ErrorKind.EXPORT_OF_UNDEFINED_VARIABLE, "cannot export undefined variable: " + alias);
        }
        return new Environment(variables, aliases.assoc(alias, target), aliasTargets.assoc(target, alias), options);
    }

    public Map<String, String> aliases() {
        Map<String, String> snapshot = new LinkedHashMap<>();
        for (Object entry : aliases) {
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) entry;
            snapshot.put((String) e.getKey(), (String) e.getValue());
        }
        return snapshot;
    }

    private Environment withVariable(String key, Binding binding) {
        return new Environment(variables.assoc(key, binding), aliases, aliasTargets, options);
    }

    private static String describe(Class<? extends Binding> kind) {
        if (kind == Binding.NumberBinding.class) return "number";
        if (kind == Binding.VectorBinding.class) return "vector";
        if (kind == Binding.MatrixBinding.class) return "matrix";
        if (kind == Binding.Imported.class) return "import";
        if (kind == Binding.Exported.class) return "export";
        return "variable";
    }

    @Override
    public String toString() {
        return String.format("Environment[variables=%d, aliases=%d]", variables.count(), aliases.count());
    }
}
