package org.javai.planexec;

import java.util.List;
import org.javai.planexec.plan.ExecutionRecord;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.RunState;

/**
 * What a finished run returns to its caller.
 *
 * @param plan the plan in force when the run ended
 * @param cursor the cursor into that plan
 * @param log every execution record of the run, across regenerations
 * @param completed whether the run was finalized
 * @param finalAnswer the answer, present when completed
 * @param terminatedEarly whether a step or regeneration bound ended the run with a degraded answer
 * @param executeCalls how many times the step executor was called
 */
public record RunResult(
		Plan plan,
		int cursor,
		List<ExecutionRecord> log,
		boolean completed,
		String finalAnswer,
		boolean terminatedEarly,
		int executeCalls
) {

	public RunResult {
		log = log != null ? List.copyOf(log) : List.of();
	}

	static RunResult of(RunState state, boolean terminatedEarly, int executeCalls) {
		return new RunResult(state.plan(), state.cursor(), state.log(), state.completed(), state.finalAnswer(),
				terminatedEarly, executeCalls);
	}
}
