package io.surfworks.yovec.cli;

import io.surfworks.yovec.CompilationResult;
import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.YovecCompiler;
import io.surfworks.yovec.ast.SyntaxNode;
import io.surfworks.yovec.ast.SyntaxTreeJson;
import io.surfworks.yovec.config.CompilerOptions;
import io.surfworks.yovec.config.CompilerOptionsLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.TreeSet;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Yovec CLI - compiles a parsed Yovec program (JSON syntax tree) into a YOLOL syntax tree.
 *
 * <p>Commands:
 * <ul>
 *   <li>compile - Lower a program and write the output tree</li>
 *   <li>config - Show the effective compiler configuration</li>
 * </ul>
 *
 * <p>Exit codes: 0 on success, 1 for errors in the program or its invocation,
 * 2 when the input tree violates the grammar.
 */
public final class YovecMain {

    private static final String VERSION = "0.1.0";
    private static final Logger LOG = Logger.getLogger(YovecMain.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INTERNAL = 2;

    private final PrintStream out;
    private final PrintStream err;

    YovecMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new YovecMain(System.out, System.err).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    int run(String[] args) {
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("-h")) {
            printHelp();
            return EXIT_OK;
        }
        if (args[0].equals("--version") || args[0].equals("-v")) {
            out.println("yovec " + VERSION);
            return EXIT_OK;
        }

        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);
        if (hasFlag(commandArgs, "--verbose")) {
            enableVerboseLogging();
        }

        try {
            return switch (command) {
                case "compile" -> handleCompile(commandArgs);
                case "config" -> handleConfig(commandArgs);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'yovec --help' for usage.");
                    yield EXIT_ERROR;
                }
            };
        } catch (CompileException e) {
            if (e.isInternal()) {
                LOG.log(Level.SEVERE, "Input tree violates the grammar", e);
                err.println("Internal error: " + e.getMessage());
                return EXIT_INTERNAL;
            }
            err.println("Compile error (" + e.getKind() + "): " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int handleCompile(String[] args) throws IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            printCompileHelp();
            return args.length == 0 ? EXIT_ERROR : EXIT_OK;
        }

        Path input = Path.of(args[0]);
        if (!Files.exists(input)) {
            err.println("Error: File not found: " + input);
            return EXIT_ERROR;
        }

        CompilerOptions options = loadOptions(args);
        SyntaxNode program = SyntaxTreeJson.read(input);
        CompilationResult result = new YovecCompiler(options).compile(program);
        LOG.info(() -> "Compiled " + input + " into " + result.lineCount() + " lines");

        boolean compact = hasFlag(args, "--compact");
        String output = getFlagValue(args, "--output");
        if (output != null) {
            SyntaxTreeJson.write(result.program(), Path.of(output), compact);
            out.println("Wrote " + result.lineCount() + " lines to " + output);
        } else {
            out.println(compact
                    ? SyntaxTreeJson.writeCompact(result.program())
                    : SyntaxTreeJson.write(result.program()));
        }
        return EXIT_OK;
    }

    private int handleConfig(String[] args) throws IOException {
        CompilerOptions options = loadOptions(args);
        out.println("mangleNames:       " + options.mangleNames());
        out.println("renameExports:     " + options.renameExports());
        out.println("exportNamePattern: " + (options.exportNamePattern().isEmpty()
                ? "(disabled)" : options.exportNamePattern()));
        out.println("reservedNames:     " + new TreeSet<>(options.reservedNames()));
        return EXIT_OK;
    }

    /**
     * Config file first, then CLI flags on top.
     */
    private static CompilerOptions loadOptions(String[] args) throws IOException {
        String configPath = getFlagValue(args, "--config");
        CompilerOptions options = configPath != null
                ? CompilerOptionsLoader.load(Path.of(configPath))
                : CompilerOptionsLoader.load();

        if (hasFlag(args, "--no-mangle")) {
            options = options.withMangleNames(false);
        }
        if (hasFlag(args, "--no-rename-exports")) {
            options = options.withRenameExports(false);
        }
        String pattern = getFlagValue(args, "--export-pattern");
        if (pattern != null) {
            options = options.withExportNamePattern(pattern);
        }
        return options;
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("io.surfworks.yovec");
        root.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) {
                return true;
            }
        }
        return false;
    }

    private static String getFlagValue(String[] args, String flag) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(flag)) {
                return args[i + 1];
            }
        }
        return null;
    }

    private void printHelp() {
        out.println("Yovec - vector algebra to YOLOL lowering");
        out.println();
        out.println("Usage: yovec <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  compile FILE    Compile a JSON Yovec syntax tree");
        out.println("  config          Show the effective compiler configuration");
        out.println();
        out.println("Global options:");
        out.println("  --help, -h      Print this help message");
        out.println("  --version, -v   Print the version");
    }

    private void printCompileHelp() {
        out.println("Usage: yovec compile FILE [options]");
        out.println();
        out.println("Options:");
        out.println("  --output FILE           Write the output tree to FILE instead of stdout");
        out.println("  --compact               Write the output tree on a single line");
        out.println("  --config FILE           Read compiler options from FILE");
        out.println("  --no-mangle             Keep register names (v{index}e{element})");
        out.println("  --no-rename-exports     Keep exported registers under their register names");
        out.println("  --export-pattern REGEX  Export-style alias names (empty string disables)");
        out.println("  --verbose               Log pipeline details to stderr");
    }
}
