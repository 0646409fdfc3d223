package com.jobagents.queue;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WorkItemTest {

    @Test
    public void testIdAcceptsNumericStrings() {
        JsonObject json = new JsonObject();
        json.addProperty("id", " 42 ");
        assertEquals(42L, WorkItem.fromJson(json).getId());
    }

    @Test
    public void testMissingOrBadFields() {
        JsonObject json = new JsonObject();
        json.addProperty("id", "abc");
        json.addProperty("score", "high");
        WorkItem item = WorkItem.fromJson(json);

        assertNull(item.getId());
        assertNull(item.getScore());
        assertEquals(3, item.getInt("attempts", 3));
    }

    @Test
    public void testFromJsonCopies() {
        JsonObject json = new JsonObject();
        json.addProperty("id", 1);
        WorkItem item = WorkItem.fromJson(json);
        json.addProperty("id", 2);

        assertEquals(1L, item.getId());
        item.toJson().addProperty("id", 3);
        assertEquals(1L, item.getId());
    }
}
