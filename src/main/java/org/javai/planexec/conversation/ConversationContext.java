package org.javai.planexec.conversation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of conversation memory, passed explicitly into planning and replanning.
 *
 * @param recentTurns the most recent turns, oldest first
 * @param summary the rolling conversation summary
 */
public record ConversationContext(List<ConversationTurn> recentTurns, String summary) {

	public ConversationContext {
		recentTurns = recentTurns != null ? List.copyOf(recentTurns) : List.of();
		summary = summary != null ? summary : "";
	}

	public static ConversationContext empty() {
		return new ConversationContext(List.of(), "");
	}

	/**
	 * Renders the last {@code limit} turns as {@code role: content} lines.
	 */
	public String renderRecent(int limit) {
		int from = Math.max(0, recentTurns.size() - Math.max(0, limit));
		return recentTurns.subList(from, recentTurns.size()).stream()
				.map(ConversationTurn::render)
				.collect(Collectors.joining("\n"));
	}
}
