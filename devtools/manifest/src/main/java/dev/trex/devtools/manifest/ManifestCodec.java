package dev.trex.devtools.manifest;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import dev.trex.devtools.test.Shared;

/**
 * Reads the discovery tool output: {@code [{"file": "...", "tests": ["...", ...]}, ...]}.
 * The document must be strict JSON. Unknown fields are ignored, everything else must match exactly.
 */
public final class ManifestCodec {

    static final String FILE = "file";
    static final String TESTS = "tests";

    private ManifestCodec() {
        //
    }

    public static Manifest parse(String json) throws ManifestFormatException {
        JsonElement root;
        try (JsonReader reader = new JsonReader(new StringReader(json))) {
            reader.setLenient(false);
            root = Shared.GSON.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new ManifestFormatException("Unexpected content after the JSON document");
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new ManifestFormatException("Not a JSON document: " + e.getMessage(), e);
        }
        if (!root.isJsonArray()) {
            throw new ManifestFormatException("Expected a JSON array of entries, got " + describe(root));
        }

        JsonArray array = root.getAsJsonArray();
        List<ManifestEntry> entries = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            entries.add(parseEntry(i, array.get(i)));
        }
        return new Manifest(entries);
    }

    private static ManifestEntry parseEntry(int index, JsonElement element) throws ManifestFormatException {
        if (!element.isJsonObject()) {
            throw new ManifestFormatException("Entry " + index + " is not an object: " + describe(element));
        }
        JsonObject obj = element.getAsJsonObject();

        JsonElement file = obj.get(FILE);
        if (!isString(file)) {
            throw new ManifestFormatException("Entry " + index + " has no string '" + FILE + "'");
        }

        JsonElement tests = obj.get(TESTS);
        if (tests == null || !tests.isJsonArray()) {
            throw new ManifestFormatException("Entry " + index + " has no '" + TESTS + "' array");
        }
        List<String> names = new ArrayList<>();
        for (JsonElement test : tests.getAsJsonArray()) {
            if (!isString(test)) {
                throw new ManifestFormatException("Entry " + index + " has a non-string test: " + describe(test));
            }
            names.add(test.getAsString());
        }
        return new ManifestEntry(file.getAsString(), names);
    }

    private static boolean isString(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static String describe(JsonElement element) {
        if (element.isJsonNull()) {
            return "nothing";
        }
        String text = element.toString();
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
