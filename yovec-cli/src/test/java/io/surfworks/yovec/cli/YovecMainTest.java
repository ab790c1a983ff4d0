package io.surfworks.yovec.cli;

import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.ast.SyntaxTreeJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YovecMainTest {

    /** import A; let v = [A, 2]; export v as OUT */
    private static final String VECTOR_PROGRAM = """
            {"kind": "program", "children": [
              {"kind": "line", "children": [
                {"kind": "import", "children": [
                  {"kind": "variable", "children": [{"kind": "ident", "value": "A"}]}]}]},
              {"kind": "line", "children": [
                {"kind": "let", "children": [
                  {"kind": "variable", "children": [{"kind": "ident", "value": "v"}]},
                  {"kind": "vector", "children": [
                    {"kind": "variable", "children": [{"kind": "ident", "value": "A"}]},
                    {"kind": "number", "children": [{"kind": "literal", "value": "2"}]}]}]}]},
              {"kind": "line", "children": [
                {"kind": "export", "children": [
                  {"kind": "variable", "children": [{"kind": "ident", "value": "v"}]},
                  {"kind": "variable", "children": [{"kind": "ident", "value": "OUT"}]}]}]}
            ]}
            """;

    private static final String UNDEFINED_EXPORT_PROGRAM = """
            {"kind": "program", "children": [
              {"kind": "line", "children": [
                {"kind": "export", "children": [
                  {"kind": "variable", "children": [{"kind": "ident", "value": "nothing"}]},
                  {"kind": "variable", "children": [{"kind": "ident", "value": "OUT"}]}]}]}
            ]}
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private YovecMain main;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        main = new YovecMain(
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return main.run(args);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /** Keeps tests away from the user's real config file. */
    private String noConfig() {
        return tempDir.resolve("no-such-config.json").toString();
    }

    @Nested
    @DisplayName("compile")
    class CompileTests {

        @Test
        void writesOutputFile() throws IOException {
            Path input = write("in.json", VECTOR_PROGRAM);
            Path output = tempDir.resolve("out").resolve("result.json");

            int code = run("compile", input.toString(), "--output", output.toString(), "--config", noConfig());

            assertEquals(YovecMain.EXIT_OK, code, err());
            assertTrue(out().contains("Wrote 1 lines to"));
            SyntaxNode program = SyntaxTreeJson.read(output);
            assertEquals(NodeKind.PROGRAM, program.kind());
            SyntaxNode multi = program.child(0).child(0);
            assertEquals("OUT0", multi.child(0).child(0).value());
            assertEquals("A", multi.child(0).child(1).value());
            assertEquals("OUT1", multi.child(1).child(0).value());
        }

        @Test
        void printsToStdoutWithoutOutputFlag() throws IOException {
            Path input = write("in.json", VECTOR_PROGRAM);

            int code = run("compile", input.toString(), "--config", noConfig());

            assertEquals(YovecMain.EXIT_OK, code, err());
            SyntaxNode program = SyntaxTreeJson.read(out());
            assertEquals(1, program.childCount());
        }

        @Test
        void compactOutputIsOneLine() throws IOException {
            Path input = write("in.json", VECTOR_PROGRAM);

            int code = run("compile", input.toString(), "--config", noConfig(), "--compact");

            assertEquals(YovecMain.EXIT_OK, code, err());
            String json = out().strip();
            assertFalse(json.contains("\n"));
            assertTrue(json.startsWith("{\"kind\":\"program\",\"children\":["));
            assertEquals(1, SyntaxTreeJson.read(json).childCount());
        }

        @Test
        void compactOutputFile() throws IOException {
            Path input = write("in.json", VECTOR_PROGRAM);
            Path output = tempDir.resolve("compact.json");

            assertEquals(YovecMain.EXIT_OK,
                    run("compile", input.toString(), "--config", noConfig(), "--compact", "--output", output.toString()));
            assertEquals(1, Files.readAllLines(output, StandardCharsets.UTF_8).size());
        }

        @Test
        void noRenameKeepsRegisterNames() throws IOException {
            Path input = write("in.json", VECTOR_PROGRAM);

            int code = run("compile", input.toString(), "--config", noConfig(), "--no-rename-exports", "--no-mangle");

            assertEquals(YovecMain.EXIT_OK, code, err());
            SyntaxNode multi = SyntaxTreeJson.read(out()).child(0).child(0);
            assertEquals("v0e0", multi.child(0).child(0).value());
        }

        @Test
        void configFileIsHonoured() throws IOException {
            Path input = write("in.json", VECTOR_PROGRAM);
            Path config = write("compiler.json", "{\"renameExports\": false, \"mangleNames\": false}");

            assertEquals(YovecMain.EXIT_OK, run("compile", input.toString(), "--config", config.toString()));
            assertEquals("v0e1", SyntaxTreeJson.read(out()).child(0).child(0).child(1).child(0).value());
        }

        @Test
        void missingInputFileIsAnError() {
            int code = run("compile", tempDir.resolve("missing.json").toString(), "--config", noConfig());

            assertEquals(YovecMain.EXIT_ERROR, code);
            assertTrue(err().contains("File not found"));
        }

        @Test
        void compileErrorExitsWithOne() throws IOException {
            Path input = write("bad.json", UNDEFINED_EXPORT_PROGRAM);

            int code = run("compile", input.toString(), "--config", noConfig());

            assertEquals(YovecMain.EXIT_ERROR, code);
            assertTrue(err().contains("EXPORT_OF_UNDEFINED_VARIABLE"), err());
        }

        @Test
        void malformedTreeExitsWithTwo() throws IOException {
            Path input = write("weird.json", "{\"kind\": \"program\", \"children\": [{\"kind\": \"bogus\"}]}");

            int code = run("compile", input.toString(), "--config", noConfig());

            assertEquals(YovecMain.EXIT_INTERNAL, code);
            assertTrue(err().contains("Internal error"));
        }

        @Test
        void invalidExportPatternIsAnError() throws IOException {
            Path input = write("in.json", VECTOR_PROGRAM);

            int code = run("compile", input.toString(), "--config", noConfig(), "--export-pattern", "(");

            assertEquals(YovecMain.EXIT_ERROR, code);
        }
    }

    @Nested
    @DisplayName("other commands")
    class CommandTests {

        @Test
        void helpAndVersion() {
            assertEquals(YovecMain.EXIT_OK, run("--help"));
            assertTrue(out().contains("Usage: yovec"));
            assertEquals(YovecMain.EXIT_OK, run("--version"));
            assertTrue(out().contains("yovec 0.1.0"));
        }

        @Test
        void unknownCommandExitsWithOne() {
            assertEquals(YovecMain.EXIT_ERROR, run("frobnicate"));
            assertTrue(err().contains("Unknown command: frobnicate"));
        }

        @Test
        void configShowsEffectiveOptions() {
            int code = run("config", "--config", noConfig(), "--no-mangle", "--export-pattern", "");

            assertEquals(YovecMain.EXIT_OK, code);
            assertTrue(out().contains("mangleNames:       false"));
            assertTrue(out().contains("exportNamePattern: (disabled)"));
            assertTrue(out().contains("reservedNames:     [abs, acos,"));
        }
    }
}
