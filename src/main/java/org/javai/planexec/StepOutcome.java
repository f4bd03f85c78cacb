package org.javai.planexec;

import java.util.Objects;
import org.javai.planexec.plan.ExecutionRecord;
import org.javai.planexec.plan.RunState;

/**
 * Result of one {@link StepExecutor#execute(RunState)} call.
 *
 * @param state the run state after the call
 * @param record the record appended by the call, {@code null} when the plan was already exhausted
 * @param status how the step ended
 */
public record StepOutcome(RunState state, ExecutionRecord record, Status status) {

	public enum Status {
		/** The oracle performed a step without a tool. */
		ORACLE_RESULT,
		/** The oracle failed while performing a step without a tool. */
		TASK_FAILED,
		/** The tool was invoked and returned a result. */
		TOOL_RESULT,
		/** The tool arguments could not be resolved; the tool was not invoked. */
		ARGUMENT_RESOLUTION_FAILED,
		/** The tool arguments were rejected; the tool was not invoked. */
		ARGUMENT_VALIDATION_FAILED,
		/** The tool was missing or raised a failure. */
		TOOL_FAILED,
		/** Nothing left to execute; the state is unchanged. */
		PLAN_EXHAUSTED
	}

	public StepOutcome {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(status, "status must not be null");
		if ((record == null) != (status == Status.PLAN_EXHAUSTED)) {
			throw new IllegalArgumentException("record must be present unless the plan is exhausted");
		}
	}

	public static StepOutcome executed(RunState state, ExecutionRecord record, Status status) {
		return new StepOutcome(state, record, status);
	}

	public static StepOutcome exhausted(RunState state) {
		return new StepOutcome(state, null, Status.PLAN_EXHAUSTED);
	}

	public boolean planExhausted() {
		return status == Status.PLAN_EXHAUSTED;
	}

	/**
	 * Whether the step produced failure text instead of a result.
	 */
	public boolean failed() {
		return switch (status) {
			case TASK_FAILED, ARGUMENT_RESOLUTION_FAILED, ARGUMENT_VALIDATION_FAILED, TOOL_FAILED -> true;
			default -> false;
		};
	}
}
