package com.switchboard.core.model;

/**
 * One entry of the conversation history shared between workers.
 *
 * @param role    "user", "assistant" or "system"
 * @param content message text
 */
public record ConversationMessage(String role, String content) {

    public static ConversationMessage user(String content) {
        return new ConversationMessage("user", content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage("assistant", content);
    }
}
