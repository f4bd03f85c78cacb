package org.javai.planexec;

import java.util.Objects;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.RunState;

/**
 * What the {@link Replanner} decided after a step, and how that decision changes the run.
 */
public sealed interface ReplanOutcome {

	Decision decision();

	/**
	 * Applies the outcome to the state it was decided on.
	 */
	RunState applyTo(RunState state);

	/**
	 * Keep going with the current plan; the state is unchanged.
	 */
	record Continue() implements ReplanOutcome {
		@Override
		public Decision decision() {
			return Decision.CONTINUE;
		}

		@Override
		public RunState applyTo(RunState state) {
			return state;
		}
	}

	/**
	 * Replace the plan wholesale and restart at its first step. The log is kept.
	 */
	record Regenerate(Plan plan) implements ReplanOutcome {
		public Regenerate {
			Objects.requireNonNull(plan, "plan must not be null");
		}

		@Override
		public Decision decision() {
			return Decision.REGENERATE;
		}

		@Override
		public RunState applyTo(RunState state) {
			return state.withPlan(plan);
		}
	}

	/**
	 * A regeneration was decided but no usable plan came back; the plan and cursor stay as
	 * they were.
	 */
	record RegenerationAbandoned(String reason) implements ReplanOutcome {
		@Override
		public Decision decision() {
			return Decision.REGENERATE;
		}

		@Override
		public RunState applyTo(RunState state) {
			return state;
		}
	}

	/**
	 * Complete the run with the composed answer.
	 */
	record Finalize(String answer) implements ReplanOutcome {
		public Finalize {
			Objects.requireNonNull(answer, "answer must not be null");
		}

		@Override
		public Decision decision() {
			return Decision.FINALIZE;
		}

		@Override
		public RunState applyTo(RunState state) {
			return state.finalizeWith(answer);
		}
	}
}
