package com.switchboard.core.worker;

import com.switchboard.core.model.ConversationMessage;
import com.switchboard.core.model.WorkerResult;

import java.util.List;

/**
 * Chat-completion backend shared by workers and the planner.
 */
@FunctionalInterface
public interface AiProvider {

    WorkerResult chat(List<ConversationMessage> messages, double temperature, int maxTokens);
}
