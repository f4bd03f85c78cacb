package org.javai.planexec.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * State of a single agent run, created once per user request.
 *
 * <p>Immutable: every transition returns a new instance. The invariants enforced here are:</p>
 * <ul>
 *   <li>{@code 0 <= cursor <= plan.size()}</li>
 *   <li>{@code finalAnswer} is present exactly when {@code completed} is true</li>
 *   <li>the log only grows; installing a new plan resets the cursor but keeps the log</li>
 *   <li>{@code log.size() - planStartedAt == cursor}: one record per step executed against
 *       the current plan</li>
 * </ul>
 *
 * @param userInput the original user request
 * @param plan the current plan
 * @param cursor position of the next step to execute
 * @param log every execution record of this run, across regenerations
 * @param planStartedAt log size at the moment the current plan was installed
 * @param completed whether the run was finalized
 * @param finalAnswer the composed answer, present only when completed
 */
public record RunState(
		String userInput,
		Plan plan,
		int cursor,
		List<ExecutionRecord> log,
		int planStartedAt,
		boolean completed,
		String finalAnswer
) {

	public RunState {
		Objects.requireNonNull(userInput, "userInput must not be null");
		plan = plan != null ? plan : Plan.empty();
		log = log != null ? List.copyOf(log) : List.of();
		if (cursor < 0 || cursor > plan.size()) {
			throw new IllegalStateException("cursor " + cursor + " outside plan of size " + plan.size());
		}
		if (planStartedAt < 0 || planStartedAt + cursor != log.size()) {
			throw new IllegalStateException("log size " + log.size() + " does not match cursor " + cursor
					+ " for plan started at " + planStartedAt);
		}
		if (completed != (finalAnswer != null)) {
			throw new IllegalStateException("finalAnswer must be present if and only if the run is completed");
		}
	}

	/**
	 * Creates the state for a fresh request, before any plan exists.
	 */
	public static RunState initial(String userInput) {
		return new RunState(userInput, Plan.empty(), 0, List.of(), 0, false, null);
	}

	/**
	 * Installs a plan (initial or regenerated): the cursor returns to the first step and the
	 * existing log is kept as history.
	 */
	public RunState withPlan(Plan newPlan) {
		Objects.requireNonNull(newPlan, "newPlan must not be null");
		return new RunState(userInput, newPlan, 0, log, log.size(), false, null);
	}

	/**
	 * Appends a record and advances the cursor by exactly one.
	 */
	public RunState advance(ExecutionRecord record) {
		Objects.requireNonNull(record, "record must not be null");
		if (completed) {
			throw new IllegalStateException("Cannot advance a completed run");
		}
		List<ExecutionRecord> updated = new ArrayList<>(log);
		updated.add(record);
		return new RunState(userInput, plan, cursor + 1, updated, planStartedAt, false, null);
	}

	/**
	 * The terminal transition: records the final answer and marks the run completed.
	 */
	public RunState finalizeWith(String answer) {
		Objects.requireNonNull(answer, "answer must not be null");
		return new RunState(userInput, plan, cursor, log, planStartedAt, true, answer);
	}

	public boolean isPlanExhausted() {
		return cursor >= plan.size();
	}

	public Optional<ExecutionRecord> lastRecord() {
		return log.isEmpty() ? Optional.empty() : Optional.of(log.get(log.size() - 1));
	}
}
