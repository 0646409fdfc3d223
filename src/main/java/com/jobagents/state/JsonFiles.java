package com.jobagents.state;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.jobagents.core.StateStoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reading and writing of the small JSON documents that back queues and task state.
 *
 * <p>Reads are forgiving: a missing, empty, unreadable or non-object document yields null
 * and the caller starts from an empty structure. Writes go to a sibling temp file that is
 * then moved over the target, so a reader never sees a half-written document.</p>
 */
public final class JsonFiles {
    private static final Logger logger = Logger.getLogger(JsonFiles.class.getName());

    // Shared Gson instance - thread-safe
    static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private JsonFiles() {
    }

    public static Gson gson() {
        return GSON;
    }

    /**
     * Read a JSON object document.
     *
     * @param path document location
     * @return the parsed object, or null if the file is missing or malformed
     */
    public static JsonObject readObject(Path path) {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                return null;
            }
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                logger.warning("Ignoring " + path + ": top-level value is not an object");
                return null;
            }
            return element.getAsJsonObject();
        } catch (IOException | JsonParseException e) {
            logger.log(Level.WARNING, "Ignoring unreadable document " + path, e);
            return null;
        }
    }

    /**
     * Write a JSON document atomically.
     *
     * @param path target location; parent directories are created
     * @param document the content
     * @throws StateStoreException if the document cannot be written
     */
    public static void writeAtomically(Path path, JsonElement document) {
        Path absolute = path.toAbsolutePath();
        Path dir = absolute.getParent();
        Path temp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            temp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
            Files.writeString(temp, GSON.toJson(document), StandardCharsets.UTF_8);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new StateStoreException("Failed to write document", absolute, e);
        }
    }
}
