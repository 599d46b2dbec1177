package com.switchboard.core.scheduler;

import com.switchboard.core.model.ConversationMessage;
import com.switchboard.core.model.ExecutionLogEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single point of mutation for the execution log and the shared conversation history.
 * <p>
 * Pool threads never append to either container directly; every write and every snapshot
 * goes through one lock owned by the journal.
 */
final class ExecutionJournal {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ExecutionLogEntry> entries = new ArrayList<>();
    private final List<ConversationMessage> history;

    ExecutionJournal(List<ConversationMessage> history) {
        this.history = history;
    }

    void recordExecution(String worker, String task) {
        append(ExecutionLogEntry.execution(worker, task));
    }

    void recordDelegation(String from, String to, String task) {
        append(ExecutionLogEntry.delegation(from, to, task));
    }

    void appendHistory(ConversationMessage message) {
        lock.lock();
        try {
            history.add(message);
        } finally {
            lock.unlock();
        }
    }

    List<ExecutionLogEntry> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Prefixes the task text with a summary of the other tasks executed so far.
     */
    String enrichWithPriorWork(String taskDescription) {
        var prior = new ArrayList<String>();
        for (var entry : snapshot()) {
            if (entry.type() == ExecutionLogEntry.Type.EXECUTION && !taskDescription.equals(entry.task())) {
                prior.add("[" + entry.worker() + "]: completed");
            }
        }
        if (prior.isEmpty()) {
            return taskDescription;
        }
        return "Previous agent work:\n" + String.join("\n", prior) + "\n\nYour task: " + taskDescription;
    }

    private void append(ExecutionLogEntry entry) {
        lock.lock();
        try {
            entries.add(entry);
        } finally {
            lock.unlock();
        }
    }
}
