package org.javai.planexec.conversation;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Short-term conversation memory shared across runs of one conversation session.
 *
 * <p>Holds at most {@code capacity} turns. Runs read it through {@link #snapshot()}; the
 * orchestrator writes to it once per completed run through {@link #commit(String, String)},
 * which also refreshes the rolling summary from the last {@code summaryWindow} turns.</p>
 */
public class ConversationMemory {

	private static final Logger logger = LoggerFactory.getLogger(ConversationMemory.class);

	private final int capacity;
	private final int summaryWindow;
	private final Clock clock;
	private final Deque<ConversationTurn> turns = new ArrayDeque<>();
	private String summary = "";

	public ConversationMemory(int capacity, int summaryWindow) {
		this(capacity, summaryWindow, Clock.systemUTC());
	}

	public ConversationMemory(int capacity, int summaryWindow, Clock clock) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be >= 1");
		}
		if (summaryWindow < 0) {
			throw new IllegalArgumentException("summaryWindow must be non-negative");
		}
		this.capacity = capacity;
		this.summaryWindow = summaryWindow;
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	public synchronized ConversationContext snapshot() {
		return new ConversationContext(new ArrayList<>(turns), summary);
	}

	/**
	 * Records a completed exchange and refreshes the summary.
	 */
	public synchronized void commit(String userInput, String finalAnswer) {
		append(new ConversationTurn(ConversationTurn.USER, userInput, clock.instant()));
		append(new ConversationTurn(ConversationTurn.ASSISTANT, finalAnswer, clock.instant()));
		refreshSummary();
	}

	public synchronized void clear() {
		turns.clear();
		summary = "";
	}

	public synchronized int size() {
		return turns.size();
	}

	private void append(ConversationTurn turn) {
		turns.addLast(turn);
		while (turns.size() > capacity) {
			turns.removeFirst();
		}
	}

	private void refreshSummary() {
		List<ConversationTurn> all = new ArrayList<>(turns);
		int from = Math.max(0, all.size() - summaryWindow);
		summary = all.subList(from, all.size()).stream()
				.map(ConversationTurn::content)
				.collect(Collectors.joining("\n"));
		logger.debug("Summary updated ({} turns)", all.size() - from);
	}
}
