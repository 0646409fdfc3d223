package com.jobagents.app;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.jobagents.matching.MatchingEngine;
import com.jobagents.state.TaskState;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Removes candidates from the matcher's state so the next matching step scores them again.
 */
public class MatcherStateTool {
    private static final Logger logger = Logger.getLogger(MatcherStateTool.class.getName());

    static final List<String> SECTIONS =
            List.of(MatchingEngine.PROCESSED, MatchingEngine.QUEUED, MatchingEngine.SKIPPED);

    /**
     * Remove the given ids from the processed, queued and skipped maps. Keys that do not
     * hold an object are left alone.
     *
     * @return number of entries removed per map, in a fixed order
     */
    public static Map<String, Integer> prune(TaskState state, Collection<Long> candidateIds) {
        Set<String> targets = new HashSet<>();
        for (Long id : candidateIds) {
            targets.add(String.valueOf(id));
        }

        Map<String, Integer> removed = new LinkedHashMap<>();
        for (String name : SECTIONS) {
            removed.put(name, 0);
            JsonObject section = state.get(name, JsonObject.class);
            if (section == null) {
                continue;
            }
            int count = 0;
            for (String target : targets) {
                JsonElement entry = section.remove(target);
                if (entry != null) {
                    count++;
                }
            }
            if (count > 0) {
                state.put(name, section);
            }
            removed.put(name, count);
        }
        return removed;
    }

    /**
     * Prune a state file in place.
     *
     * @param dryRun if true, report what would be removed and leave the file untouched
     * @return number of entries removed per map
     * @throws IllegalArgumentException if the state file does not exist
     */
    public static Map<String, Integer> pruneFile(Path statePath, Collection<Long> candidateIds, boolean dryRun) {
        if (!Files.exists(statePath)) {
            throw new IllegalArgumentException("State file not found: " + statePath);
        }

        TaskState state = TaskState.load(statePath);
        Map<String, Integer> removed = prune(state, candidateIds);
        int total = removed.values().stream().mapToInt(Integer::intValue).sum();

        logger.info("Identified " + candidateIds.size() + " candidates; "
                + (dryRun ? "would remove " : "removing ") + removed.get(MatchingEngine.PROCESSED) + " processed, "
                + removed.get(MatchingEngine.QUEUED) + " queued, "
                + removed.get(MatchingEngine.SKIPPED) + " skipped entries");

        if (dryRun) {
            logger.info("Dry run, state file left untouched");
        } else if (total > 0) {
            state.flush();
            logger.info("State file updated, " + total + " entries removed");
        }
        return removed;
    }
}
