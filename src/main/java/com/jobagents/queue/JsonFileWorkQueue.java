package com.jobagents.queue;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.jobagents.state.JsonFiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * {@link WorkQueue} stored as a single JSON document: {@code {"queue": [item, item, ...]}}.
 *
 * <p>Every operation takes the queue's lock, loads the whole document, mutates the list
 * and writes the whole document back before releasing the lock. Other callers never see
 * a partial update, and the file is always in a state that a restart can resume from.</p>
 *
 * <p><b>Thread Safety:</b> one lock per instance. Two threads must share the same
 * instance for the same file; {@link WorkQueues} guarantees that inside one process.
 * Different queues never contend.</p>
 *
 * <p><b>Recovery:</b> a missing file, an unparseable file or a document without a
 * {@code queue} list is treated as an empty queue and rewritten as one.</p>
 */
public class JsonFileWorkQueue implements WorkQueue {
    private static final Logger logger = Logger.getLogger(JsonFileWorkQueue.class.getName());

    static final String QUEUE_FIELD = "queue";

    private final String name;
    private final Path path;
    private final Object lock = new Object();

    /**
     * Open (and create if needed) a queue file.
     *
     * @param name logical queue name
     * @param path backing file
     */
    public JsonFileWorkQueue(String name, Path path) {
        this.name = name;
        this.path = path;
        synchronized (lock) {
            if (!Files.exists(path)) {
                write(new ArrayList<>());
                logger.info("Created queue '" + name + "' at " + path);
            }
        }
    }

    @Override
    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void push(WorkItem item) {
        if (item == null) {
            throw new IllegalArgumentException("Cannot push a null work item");
        }
        synchronized (lock) {
            List<JsonObject> items = read();
            items.add(item.toJson());
            write(items);
        }
    }

    @Override
    public WorkItem pop() {
        synchronized (lock) {
            List<JsonObject> items = read();
            if (items.isEmpty()) {
                return null;
            }
            JsonObject head = items.remove(0);
            write(items);
            return WorkItem.fromJson(head);
        }
    }

    @Override
    public WorkItem peek() {
        synchronized (lock) {
            List<JsonObject> items = read();
            return items.isEmpty() ? null : WorkItem.fromJson(items.get(0));
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return read().size();
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            write(new ArrayList<>());
        }
    }

    // Caller holds the lock
    private List<JsonObject> read() {
        List<JsonObject> items = new ArrayList<>();
        JsonObject document = JsonFiles.readObject(path);
        JsonElement queue = document == null ? null : document.get(QUEUE_FIELD);

        if (queue == null || !queue.isJsonArray()) {
            logger.warning("Queue '" + name + "' has no readable backing document, reinitializing " + path);
            write(items);
            return items;
        }

        for (JsonElement element : queue.getAsJsonArray()) {
            if (element.isJsonObject()) {
                items.add(element.getAsJsonObject());
            } else {
                logger.warning("Dropping non-object entry from queue '" + name + "': " + element);
            }
        }
        return items;
    }

    // Caller holds the lock
    private void write(List<JsonObject> items) {
        JsonArray array = new JsonArray();
        for (JsonObject item : items) {
            array.add(item);
        }
        JsonObject document = new JsonObject();
        document.add(QUEUE_FIELD, array);
        JsonFiles.writeAtomically(path, document);
    }

    @Override
    public String toString() {
        return "JsonFileWorkQueue{name='" + name + "', path=" + path + "}";
    }
}
