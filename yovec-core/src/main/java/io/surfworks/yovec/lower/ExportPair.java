package io.surfworks.yovec.lower;

import java.util.Objects;

/**
 * An {@code export before as after} declaration.
 */
public record ExportPair(String before, String after) {

    public ExportPair {
        Objects.requireNonNull(before, "before cannot be null");
        Objects.requireNonNull(after, "after cannot be null");
    }
}
