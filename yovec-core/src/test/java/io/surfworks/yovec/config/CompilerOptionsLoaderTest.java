package io.surfworks.yovec.config;

import io.surfworks.yovec.env.EnvironmentOptions;
import io.surfworks.yovec.mangle.Mangler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompilerOptionsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() throws IOException {
        assertEquals(CompilerOptions.defaults(), CompilerOptionsLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void missingFieldsKeepDefaults() throws IOException {
        CompilerOptions options = CompilerOptionsLoader.parse("{\"mangleNames\": false}");

        assertFalse(options.mangleNames());
        assertTrue(options.renameExports());
        assertEquals(EnvironmentOptions.DEFAULT_EXPORT_NAME_PATTERN.pattern(), options.exportNamePattern());
    }

    @Test
    void emptyPatternDisablesExportStyleCheck() throws IOException {
        CompilerOptions options = CompilerOptionsLoader.parse("{\"exportNamePattern\": \"\"}");
        assertFalse(options.environmentOptions().exportNameCheck().isPresent());
    }

    @Test
    void reservedNamesReplaceTheDefaults() throws IOException {
        CompilerOptions options = CompilerOptionsLoader.parse("{\"reservedNames\": [\"z\", \"goto\"]}");

        assertEquals(Set.of("z", "goto"), options.reservedNames());
        assertEquals(Mangler.RESERVED_WORDS, CompilerOptions.defaults().reservedNames());
    }

    @Test
    void saveThenLoad() throws IOException {
        Path file = tempDir.resolve("nested").resolve(CompilerOptions.CONFIG_FILE);
        CompilerOptions options = CompilerOptions.defaults()
                .withRenameExports(false)
                .withExportNamePattern("^OUT_.*$")
                .withReservedNames(Set.of("if", "q"));

        CompilerOptionsLoader.save(options, file);

        assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("\"renameExports\": false"));
        assertEquals(options, CompilerOptionsLoader.load(file));
    }

    @Test
    void malformedFileIsIOException() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"mangleNames\": ", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> CompilerOptionsLoader.load(file));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[1, 2]",
            "{\"mangleNames\": {}}",
            "{\"exportNamePattern\": \"[\"}",
            "{\"reservedNames\": \"if\"}",
            "{\"reservedNames\": [{}]}",
            "not json {"
    })
    void invalidConfigIsIOException(String json) {
        assertThrows(IOException.class, () -> CompilerOptionsLoader.parse(json));
    }

    @Test
    void invalidPatternIsRejectedAtConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> CompilerOptions.defaults().withExportNamePattern("(unclosed"));
    }
}
