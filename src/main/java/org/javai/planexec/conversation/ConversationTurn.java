package org.javai.planexec.conversation;

import java.time.Instant;
import java.util.Objects;

/**
 * One message of the conversation.
 *
 * @param role {@code user} or {@code assistant}
 * @param content the message text
 * @param timestamp when the turn was recorded
 */
public record ConversationTurn(String role, String content, Instant timestamp) {

	public static final String USER = "user";
	public static final String ASSISTANT = "assistant";

	public ConversationTurn {
		Objects.requireNonNull(role, "role must not be null");
		content = content != null ? content : "";
		timestamp = timestamp != null ? timestamp : Instant.now();
	}

	public String render() {
		return role + ": " + content;
	}
}
