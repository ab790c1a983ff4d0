package io.surfworks.yovec.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Loads and saves {@link CompilerOptions} as JSON.
 *
 * <p>Missing fields keep their default values:
 * <pre>{@code
 * {"mangleNames": false, "exportNamePattern": "", "reservedNames": ["if", "goto"]}
 * }</pre>
 */
public final class CompilerOptionsLoader {

    private static final Logger LOG = Logger.getLogger(CompilerOptionsLoader.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private CompilerOptionsLoader() {}

    /**
     * Loads options from the default config file, or returns defaults if it does not exist.
     */
    public static CompilerOptions load() throws IOException {
        return load(CompilerOptions.configFile());
    }

    public static CompilerOptions load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            LOG.fine(() -> "No compiler config at " + configFile + ", using defaults");
            return CompilerOptions.defaults();
        }
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            return parse(JsonParser.parseReader(reader), configFile.toString());
        } catch (JsonParseException e) {
            throw new IOException("malformed compiler config " + configFile + ": " + e.getMessage(), e);
        }
    }

    public static CompilerOptions parse(String json) throws IOException {
        return parse(parseJson(json), "<string>");
    }

    public static void save(CompilerOptions options, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }
        JsonObject root = new JsonObject();
        root.addProperty("mangleNames", options.mangleNames());
        root.addProperty("renameExports", options.renameExports());
        root.addProperty("exportNamePattern", options.exportNamePattern());
        JsonArray reserved = new JsonArray();
        for (String name : new TreeSet<>(options.reservedNames())) {
            reserved.add(name);
        }
        root.add("reservedNames", reserved);
        Files.writeString(configFile, GSON.toJson(root), StandardCharsets.UTF_8);
    }

    private static JsonElement parseJson(String json) throws IOException {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IOException("malformed compiler config: " + e.getMessage(), e);
        }
    }

    private static CompilerOptions parse(JsonElement element, String source) throws IOException {
        if (!element.isJsonObject()) {
            throw new IOException("compiler config must be a JSON object: " + source);
        }
        JsonObject root = element.getAsJsonObject();
        CompilerOptions options = CompilerOptions.defaults();
        try {
            if (root.has("mangleNames")) {
                options = options.withMangleNames(root.get("mangleNames").getAsBoolean());
            }
            if (root.has("renameExports")) {
                options = options.withRenameExports(root.get("renameExports").getAsBoolean());
            }
            if (root.has("exportNamePattern")) {
                options = options.withExportNamePattern(root.get("exportNamePattern").getAsString());
            }
            if (root.has("reservedNames")) {
                Set<String> reserved = new LinkedHashSet<>();
                for (JsonElement name : root.get("reservedNames").getAsJsonArray()) {
                    reserved.add(name.getAsString());
                }
                options = options.withReservedNames(reserved);
            }
        } catch (IllegalStateException | UnsupportedOperationException | IllegalArgumentException e) {
            throw new IOException("invalid compiler config " + source + ": " + e.getMessage(), e);
        }
        return options;
    }
}
