package io.surfworks.yovec.ast;

import io.surfworks.yovec.CompileException;
import io.surfworks.yovec.ErrorKind;

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
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * JSON wire format for syntax trees exchanged with the external parser and printer.
 *
 * <p>Each node is an object:
 * <pre>{@code
 * {"kind": "assignment", "children": [
 *     {"kind": "variable", "value": "v0e0"},
 *     {"kind": "number", "value": "2"}]}
 * }</pre>
 * {@code value} and {@code children} are omitted when absent. A node with an empty
 * {@code children} array is an internal node without children, not a leaf.
 */
public final class SyntaxTreeJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private static final Gson COMPACT = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private SyntaxTreeJson() {}

    public static SyntaxNode read(String json) {
        return fromJson(parse(JsonParser::parseString, json));
    }

    public static SyntaxNode read(Reader reader) {
        return fromJson(parse(JsonParser::parseReader, reader));
    }

    public static SyntaxNode read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static String write(SyntaxNode node) {
        return GSON.toJson(toJson(node));
    }

    public static String writeCompact(SyntaxNode node) {
        return COMPACT.toJson(toJson(node));
    }

    public static void write(SyntaxNode node, Path path) throws IOException {
        write(node, path, false);
    }

    public static void write(SyntaxNode node, Path path, boolean compact) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, compact ? writeCompact(node) : write(node), StandardCharsets.UTF_8);
    }

    public static JsonObject toJson(SyntaxNode node) {
        JsonObject object = new JsonObject();
        object.addProperty("kind", node.kind().tag());
        if (node.value() != null) {
            object.addProperty("value", node.value());
        }
        if (!node.isLeaf()) {
            JsonArray children = new JsonArray();
            for (SyntaxNode child : node.children()) {
                children.add(toJson(child));
            }
            object.add("children", children);
        }
        return object;
    }

    public static SyntaxNode fromJson(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw CompileException.internal("syntax node must be a JSON object, got %s", element);
        }
        JsonObject object = element.getAsJsonObject();
        JsonElement kindElement = object.get("kind");
        if (kindElement == null || !kindElement.isJsonPrimitive()) {
            throw CompileException.internal("syntax node is missing its kind: %s", object);
        }
        NodeKind kind = NodeKind.fromTag(kindElement.getAsString());

        String value = null;
        JsonElement valueElement = object.get("value");
        if (valueElement != null && !valueElement.isJsonNull()) {
            value = valueElement.getAsString();
        }

        List<SyntaxNode> children = null;
        JsonElement childrenElement = object.get("children");
        if (childrenElement != null && !childrenElement.isJsonNull()) {
            if (!childrenElement.isJsonArray()) {
                throw CompileException.internal("children of %s must be an array", kind);
            }
            children = new ArrayList<>();
            for (JsonElement child : childrenElement.getAsJsonArray()) {
                children.add(fromJson(child));
            }
        }
        return SyntaxNode.valued(kind, value, children);
    }

    private static <T> JsonElement parse(Function<T, JsonElement> parser, T source) {
        try {
            return parser.apply(source);
        } catch (JsonParseException e) {
            throw new CompileException(ErrorKind.INTERNAL_INVARIANT_VIOLATION,
                    "malformed syntax tree JSON: " + e.getMessage(), e);
        }
    }
}
