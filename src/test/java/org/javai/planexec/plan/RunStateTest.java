package org.javai.planexec.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunStateTest {

	private static final Plan TWO_STEPS = Plan.of(
			Step.withoutTool(1, "first", "do first"),
			Step.withoutTool(2, "second", "do second"));

	@Test
	void advanceAppendsOneRecordPerStep() {
		RunState state = RunState.initial("request").withPlan(TWO_STEPS);

		RunState after = state.advance(ExecutionRecord.of(TWO_STEPS.step(0), "ok"));

		assertThat(after.cursor()).isEqualTo(1);
		assertThat(after.log()).hasSize(1);
		assertThat(state.cursor()).isZero();
	}

	@Test
	void newPlanResetsCursorAndKeepsLog() {
		RunState state = RunState.initial("request").withPlan(TWO_STEPS)
				.advance(ExecutionRecord.of(TWO_STEPS.step(0), "failed"));
		Plan replacement = Plan.of(Step.withoutTool(1, "retry", "retry"));

		RunState regenerated = state.withPlan(replacement);

		assertThat(regenerated.plan()).isEqualTo(replacement);
		assertThat(regenerated.cursor()).isZero();
		assertThat(regenerated.log()).hasSize(1);
		assertThat(regenerated.planStartedAt()).isEqualTo(1);
		assertThat(regenerated.lastRecord()).map(ExecutionRecord::result).contains("failed");
	}

	@Test
	void cursorCannotPassThePlan() {
		RunState state = RunState.initial("request").withPlan(Plan.of(Step.withoutTool(1, "only", "only")))
				.advance(new ExecutionRecord(1, "only", "only", "done"));

		assertThat(state.isPlanExhausted()).isTrue();
		assertThatThrownBy(() -> state.advance(new ExecutionRecord(2, "extra", "extra", "x")))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void finalAnswerOnlyWithCompletion() {
		assertThatThrownBy(() -> new RunState("request", TWO_STEPS, 0, List.of(), 0, true, null))
				.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> new RunState("request", TWO_STEPS, 0, List.of(), 0, false, "answer"))
				.isInstanceOf(IllegalStateException.class);

		RunState finalized = RunState.initial("request").withPlan(TWO_STEPS).finalizeWith("answer");

		assertThat(finalized.completed()).isTrue();
		assertThat(finalized.finalAnswer()).isEqualTo("answer");
	}

	@Test
	void completedRunCannotAdvance() {
		RunState finalized = RunState.initial("request").withPlan(TWO_STEPS).finalizeWith("answer");

		assertThatThrownBy(() -> finalized.advance(ExecutionRecord.of(TWO_STEPS.step(0), "x")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("completed");
	}

	@Test
	void logMustMatchCursor() {
		assertThatThrownBy(() -> new RunState("request", TWO_STEPS, 1, List.of(), 0, false, null))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void renderedRecordsAreNumberedBySteps() {
		String rendered = ExecutionRecord.render(List.of(
				new ExecutionRecord(1, "a", "a", "found NVDA"),
				new ExecutionRecord(2, "b", "b", "price 120")));

		assertThat(rendered).isEqualTo("Step 1 result: found NVDA\nStep 2 result: price 120");
	}
}
