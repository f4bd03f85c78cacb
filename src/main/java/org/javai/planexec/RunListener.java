package org.javai.planexec;

import org.javai.planexec.plan.Plan;

/**
 * Receives the trace of a run. All methods default to no-ops.
 */
public interface RunListener {

	RunListener NONE = new RunListener() {
	};

	/**
	 * Called with the initial plan and with every regenerated plan.
	 */
	default void planProduced(String userInput, Plan plan) {
	}

	default void stepExecuted(StepOutcome outcome) {
	}

	default void decisionTaken(ReplanOutcome outcome) {
	}

	default void runFinished(RunResult result) {
	}
}
