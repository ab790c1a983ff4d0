package io.surfworks.yovec.config;

import io.surfworks.yovec.env.EnvironmentOptions;
import io.surfworks.yovec.mangle.Mangler;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration for a {@link io.surfworks.yovec.YovecCompiler}.
 *
 * <p>Options are loaded in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/yovec/compiler.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param mangleNames       shorten emitted names after lowering
 * @param renameExports     rename exported registers to their export names
 * @param exportNamePattern regex for export-style alias names; empty disables the check
 * @param reservedNames     names mangling never hands out, on top of imports and exports
 */
public record CompilerOptions(
        boolean mangleNames,
        boolean renameExports,
        String exportNamePattern,
        Set<String> reservedNames
) {

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "yovec"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "compiler.json";

    public CompilerOptions {
        Objects.requireNonNull(exportNamePattern, "exportNamePattern cannot be null");
        reservedNames = Set.copyOf(reservedNames);
        if (!exportNamePattern.isEmpty()) {
            try {
                Pattern.compile(exportNamePattern);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid exportNamePattern: " + exportNamePattern, e);
            }
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(true, true, EnvironmentOptions.DEFAULT_EXPORT_NAME_PATTERN.pattern(),
                Mangler.RESERVED_WORDS);
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public CompilerOptions withMangleNames(boolean mangle) {
        return new CompilerOptions(mangle, renameExports, exportNamePattern, reservedNames);
    }

    public CompilerOptions withRenameExports(boolean rename) {
        return new CompilerOptions(mangleNames, rename, exportNamePattern, reservedNames);
    }

    public CompilerOptions withExportNamePattern(String pattern) {
        return new CompilerOptions(mangleNames, renameExports, pattern, reservedNames);
    }

    public CompilerOptions withReservedNames(Set<String> names) {
        return new CompilerOptions(mangleNames, renameExports, exportNamePattern, names);
    }

    /**
     * Environment validation settings derived from these options.
     */
    public EnvironmentOptions environmentOptions() {
        if (exportNamePattern.isEmpty()) {
            return EnvironmentOptions.lenient();
        }
        return new EnvironmentOptions(Pattern.compile(exportNamePattern));
    }
}
