package org.javai.planexec;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Instant;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.planexec.conversation.ConversationContext;
import org.javai.planexec.conversation.ConversationTurn;
import org.javai.planexec.oracle.OracleException;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.Step;
import org.javai.planexec.testsupport.LogCaptorAppender;
import org.javai.planexec.testsupport.ScriptedOracle;
import org.junit.jupiter.api.Test;

class PlannerTest {

	@Test
	void parsesTheOraclePlan() {
		ScriptedOracle oracle = ScriptedOracle.of("""
				```json
				[{"step": 1, "description": "Quote", "action": "Fetch NVDA quote", "tool": "akshare_search",
				  "tool_args": {"stock_code": "NVDA", "data_type": "realtime"}}]
				```""");

		Plan plan = new Planner(oracle).plan("NVDA price?", ConversationContext.empty());

		assertThat(plan.steps()).extracting(Step::tool).containsExactly("akshare_search");
	}

	@Test
	void promptCarriesRequestSummaryAndToolNames() {
		ScriptedOracle oracle = ScriptedOracle.of("[{\"step\": 1, \"description\": \"d\"}]");
		ConversationContext context = new ConversationContext(
				List.of(new ConversationTurn(ConversationTurn.USER, "earlier question", Instant.EPOCH)),
				"we discussed semiconductors");

		new Planner(oracle).plan("Compare NVDA and AMD", context);

		assertThat(oracle.lastPrompt())
				.contains("Compare NVDA and AMD")
				.contains("we discussed semiconductors")
				.contains("akshare_search")
				.contains("retrieve_reports")
				.contains("generate_markdown_report")
				.contains("get_current_time");
	}

	@Test
	void unparseableResponseFallsBackToDefaultPlan() {
		ScriptedOracle oracle = ScriptedOracle.of("Sure! First I will look up the price.");

		try (LogCaptorAppender logs = LogCaptorAppender.capture(Planner.class)) {
			Plan plan = new Planner(oracle).plan("NVDA price?", ConversationContext.empty());

			assertThat(plan).isEqualTo(Planner.fallbackPlan());
			assertThat(logs.messagesAt(Level.WARN)).anyMatch(msg -> msg.contains("fallback plan"));
		}
	}

	@Test
	void emptyPlanFallsBackToDefaultPlan() {
		Plan plan = new Planner(ScriptedOracle.of("[]")).plan("anything", ConversationContext.empty());

		assertThat(plan).isEqualTo(Planner.fallbackPlan());
	}

	@Test
	void oracleFailureFallsBackToDefaultPlan() {
		Plan plan = new Planner(ScriptedOracle.of(new OracleException("down"))).plan("anything", null);

		assertThat(plan).isEqualTo(Planner.fallbackPlan());
	}

	@Test
	void fallbackPlanHasThreeToolLessSteps() {
		Plan fallback = Planner.fallbackPlan();

		assertThat(fallback.size()).isEqualTo(3);
		assertThat(fallback.steps()).noneMatch(Step::hasTool);
		assertThat(fallback.steps()).extracting(Step::index).containsExactly(1, 2, 3);
	}
}
