package io.surfworks.yovec.env;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validation settings for an {@link Environment}.
 *
 * @param exportNamePattern names matching this pattern are treated as export-style:
 *                          binding one as an alias requires it to be a declared
 *                          variable. Null disables the check.
 */
public record EnvironmentOptions(Pattern exportNamePattern) {

    /** Export-style identifiers are conventionally upper case with underscores. */
    public static final Pattern DEFAULT_EXPORT_NAME_PATTERN = Pattern.compile("^[A-Z_]+$");

    public static EnvironmentOptions defaults() {
        return new EnvironmentOptions(DEFAULT_EXPORT_NAME_PATTERN);
    }

    public static EnvironmentOptions lenient() {
        return new EnvironmentOptions(null);
    }

    public Optional<Pattern> exportNameCheck() {
        return Optional.ofNullable(exportNamePattern);
    }

    public boolean isExportStyle(String name) {
        return exportNamePattern != null && exportNamePattern.matcher(name).matches();
    }
}
