package com.switchboard.core.scheduler;

import com.switchboard.core.model.Plan;
import com.switchboard.core.model.Task;

import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses planner output into a {@link Plan}.
 * <p>
 * Expected shape, one task per line:
 * <pre>
 * 1. [architect] Design the overall architecture
 *    1a. [terraform] Generate networking module
 * 2. [app-developer] Build the API service
 * </pre>
 * Indented lines and {@code Na.} numbering become sub-tasks of the last top-level task.
 * A bracketed worker name is kept only when it is one of the candidate workers.
 */
public final class PlanParser {

    private static final Pattern NUMBERING = Pattern.compile("^\\d+[a-z]?\\.\\s*");
    private static final Pattern BULLET = Pattern.compile("^[-*]\\s*");
    private static final Pattern SUB_NUMBERING = Pattern.compile("^\\d+[a-z]\\..*");
    private static final Pattern ASSIGNED = Pattern.compile("^\\[([^\\]]+)]\\s*(.*)$");

    private PlanParser() {
    }

    public static Plan parse(String objective, String planText, Collection<String> availableWorkers) {
        var plan = new Plan(objective);
        if (planText == null) {
            return plan;
        }
        Task current = null;

        for (String line : planText.strip().split("\\R")) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }

            ParsedLine parsed = parseLine(stripped, availableWorkers);
            if (parsed == null || parsed.description().isEmpty()) {
                continue;
            }

            boolean isSub = line.startsWith(" ") || line.startsWith("\t")
                    || SUB_NUMBERING.matcher(stripped).matches();
            var task = new Task(parsed.description(), parsed.worker());

            if (isSub && current != null) {
                current.addSubTask(task);
            } else {
                current = task;
                plan.addTask(task);
            }
        }
        return plan;
    }

    static ParsedLine parseLine(String line, Collection<String> availableWorkers) {
        String cleaned = NUMBERING.matcher(line).replaceFirst("");
        cleaned = BULLET.matcher(cleaned).replaceFirst("");
        if (cleaned.isEmpty()) {
            return null;
        }

        Matcher m = ASSIGNED.matcher(cleaned);
        if (m.matches()) {
            String worker = m.group(1).strip();
            String description = m.group(2).strip();
            return new ParsedLine(availableWorkers.contains(worker) ? worker : null, description);
        }
        return new ParsedLine(null, cleaned);
    }

    record ParsedLine(String worker, String description) {}
}
