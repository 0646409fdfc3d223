package com.jobagents.state;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable key/value document owned by exactly one agent.
 *
 * <p>Agents use it to remember what they have already processed: dedup sets, per-id
 * records, progress cursors. The document is loaded once when the agent is constructed
 * and written back with {@link #flush()}.</p>
 *
 * <p><b>Layout:</b> a JSON object. Values are arbitrary JSON. Object-valued entries
 * are called <i>sections</i> and are usually keyed by a candidate id:</p>
 * <pre>
 * {
 *   "processed_jobs": { "17": { "score": 0.52, "matches": [...] } },
 *   "queued_jobs":    { "17": { "score": 0.52, "queued_at": "..." } }
 * }
 * </pre>
 *
 * <p><b>Thread Safety:</b> not thread-safe. The owning agent serializes every read and
 * write, e.g. the matching engine guards its state with a single lock shared by its pool
 * threads. There is no file locking at this layer.</p>
 *
 * @see JsonFiles#writeAtomically(Path, JsonElement)
 */
public class TaskState {
    private static final Logger logger = Logger.getLogger(TaskState.class.getName());

    private final Path path;
    private final JsonObject root;

    private TaskState(Path path, JsonObject root) {
        this.path = path;
        this.root = root;
    }

    /**
     * Load the state document for a task. A missing or corrupt file yields an empty state.
     *
     * @param path location of the state file
     * @return the loaded state, never null
     */
    public static TaskState load(Path path) {
        JsonObject root = JsonFiles.readObject(path);
        if (root == null) {
            logger.info("No usable state at " + path + ", starting empty");
            root = new JsonObject();
        }
        return new TaskState(path, root);
    }

    /**
     * Create an empty state bound to a path without reading it.
     */
    public static TaskState empty(Path path) {
        return new TaskState(path, new JsonObject());
    }

    public Path getPath() {
        return path;
    }

    public boolean contains(String key) {
        return root.has(key);
    }

    public Set<String> keys() {
        return new LinkedHashSet<>(root.keySet());
    }

    public boolean isEmpty() {
        return root.size() == 0;
    }

    /**
     * Read a value as the given type.
     *
     * @return the value, or null if the key is absent or the stored value has another shape
     */
    public <T> T get(String key, Class<T> type) {
        return get(key, (Type) type);
    }

    /**
     * Read a value as a generic type, e.g. {@code new TypeToken<List<String>>(){}.getType()}.
     *
     * @return the value, or null if the key is absent or the stored value has another shape
     */
    public <T> T get(String key, Type type) {
        JsonElement element = root.get(key);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        try {
            return JsonFiles.GSON.fromJson(element, type);
        } catch (JsonParseException | IllegalStateException e) {
            logger.log(Level.WARNING, "State key '" + key + "' in " + path + " has an unexpected shape", e);
            return null;
        }
    }

    public String getString(String key, String defaultValue) {
        JsonElement element = root.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return defaultValue;
        }
        return element.getAsString();
    }

    public long getLong(String key, long defaultValue) {
        JsonElement element = root.get(key);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return defaultValue;
        }
        return element.getAsLong();
    }

    /**
     * Store a value, serialized with Gson. A null value removes the key.
     */
    public void put(String key, Object value) {
        if (value == null) {
            root.remove(key);
            return;
        }
        root.add(key, JsonFiles.GSON.toJsonTree(value));
    }

    public void remove(String key) {
        root.remove(key);
    }

    /**
     * Get an object-valued entry, creating it when missing. The returned object is live:
     * changes are part of this state and are written by the next flush.
     *
     * <p>If the key holds something other than an object it is replaced by an empty one.</p>
     *
     * @param name section name, e.g. "processed_jobs"
     * @return the live section
     */
    public JsonObject section(String name) {
        JsonElement element = root.get(name);
        if (element != null && element.isJsonObject()) {
            return element.getAsJsonObject();
        }
        if (element != null) {
            logger.warning("State key '" + name + "' in " + path + " is not an object, resetting it");
        }
        JsonObject section = new JsonObject();
        root.add(name, section);
        return section;
    }

    /**
     * Read a list of strings. Non-string entries are skipped.
     *
     * @return a mutable copy, empty if the key is missing
     */
    public List<String> getStringList(String key) {
        List<String> values = new ArrayList<>();
        JsonElement element = root.get(key);
        if (element == null || !element.isJsonArray()) {
            return values;
        }
        for (JsonElement item : element.getAsJsonArray()) {
            if (item.isJsonPrimitive()) {
                values.add(item.getAsString());
            }
        }
        return values;
    }

    public void putStringList(String key, List<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        root.add(key, array);
    }

    /**
     * Write the whole document to disk atomically.
     *
     * @throws com.jobagents.core.StateStoreException if the file cannot be written
     */
    public void flush() {
        JsonFiles.writeAtomically(path, root.deepCopy());
    }

    /**
     * @return a detached copy of the document, for inspection and tests
     */
    public JsonObject snapshot() {
        return root.deepCopy();
    }

    @Override
    public String toString() {
        return "TaskState{path=" + path + ", keys=" + root.keySet() + "}";
    }
}
