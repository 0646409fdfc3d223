package com.jobagents.queue;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Opaque unit of work handed from one agent to the next through a {@link WorkQueue}.
 *
 * <p>A work item is a flat JSON object. By convention it carries an {@code id} (the
 * candidate id) and a {@code score}; producers may add any other fields. Queues do not
 * look inside items and do not enforce uniqueness.</p>
 */
public final class WorkItem {
    public static final String ID = "id";
    public static final String SCORE = "score";

    private final JsonObject fields;

    public WorkItem() {
        this.fields = new JsonObject();
    }

    private WorkItem(JsonObject fields) {
        this.fields = fields;
    }

    /**
     * Shortcut for the common {id, score} item.
     */
    public static WorkItem of(long id, double score) {
        return new WorkItem().with(ID, id).with(SCORE, score);
    }

    /**
     * Wrap a JSON object read from a queue file. The object is copied.
     */
    public static WorkItem fromJson(JsonObject json) {
        return new WorkItem(json.deepCopy());
    }

    public WorkItem with(String key, Number value) {
        fields.addProperty(key, value);
        return this;
    }

    public WorkItem with(String key, String value) {
        fields.addProperty(key, value);
        return this;
    }

    public WorkItem with(String key, Boolean value) {
        fields.addProperty(key, value);
        return this;
    }

    public boolean has(String key) {
        return fields.has(key);
    }

    /**
     * @return the numeric identifier, or null if missing or not a number
     */
    public Long getId() {
        JsonPrimitive primitive = primitive(ID);
        if (primitive == null) {
            return null;
        }
        if (primitive.isNumber()) {
            return primitive.getAsLong();
        }
        try {
            return Long.parseLong(primitive.getAsString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * @return the score, or null if missing or not a number
     */
    public Double getScore() {
        JsonPrimitive primitive = primitive(SCORE);
        if (primitive == null || !primitive.isNumber()) {
            return null;
        }
        return primitive.getAsDouble();
    }

    public int getInt(String key, int defaultValue) {
        JsonPrimitive primitive = primitive(key);
        if (primitive == null || !primitive.isNumber()) {
            return defaultValue;
        }
        return primitive.getAsInt();
    }

    public String getString(String key) {
        JsonPrimitive primitive = primitive(key);
        return primitive == null ? null : primitive.getAsString();
    }

    private JsonPrimitive primitive(String key) {
        JsonElement element = fields.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsJsonPrimitive();
    }

    /**
     * @return a copy of the underlying JSON object
     */
    public JsonObject toJson() {
        return fields.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkItem)) {
            return false;
        }
        return fields.equals(((WorkItem) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
