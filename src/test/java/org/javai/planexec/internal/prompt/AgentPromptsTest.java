package org.javai.planexec.internal.prompt;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.planexec.conversation.ConversationContext;
import org.javai.planexec.conversation.ConversationTurn;
import org.javai.planexec.internal.parse.PlanParser;
import org.javai.planexec.plan.ExecutionRecord;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.Step;
import org.javai.planexec.tool.ToolId;
import org.junit.jupiter.api.Test;

class AgentPromptsTest {

	private static final List<ExecutionRecord> LOG = List.of(
			new ExecutionRecord(1, "Find reports", "Search reports", "found NVDA and AMD"));

	@Test
	void planningPromptNamesToolsAndContext() {
		String prompt = AgentPrompts.planning("Analyse the AI industry",
				new ConversationContext(List.of(), "We talked about chips"), ToolId.toolNames());

		assertThat(prompt)
				.contains("## User request\nAnalyse the AI industry")
				.contains("We talked about chips")
				.contains("[add, akshare_search, get_current_time, generate_markdown_report, retrieve_reports]");
	}

	@Test
	void planningPromptWithoutSummary() {
		String prompt = AgentPrompts.planning("hi", ConversationContext.empty(), List.of());

		assertThat(prompt).contains("## Conversation context\n(none)");
	}

	@Test
	void decisionPromptShowsProgressAndResults() {
		String prompt = AgentPrompts.decision("Compare NVDA and AMD", 1, 3, LOG);

		assertThat(prompt)
				.contains("Progress: 1/3")
				.contains("Step 1 result: found NVDA and AMD")
				.contains("Answer with the digit 1, 2 or 3 only.");
	}

	@Test
	void argumentResolutionPromptCarriesCatalog() {
		String prompt = AgentPrompts.argumentResolution("akshare_search", "Query these stocks", "Compare NVDA and AMD", LOG);

		assertThat(prompt)
				.contains("calling the tool \"akshare_search\"")
				.contains("\"data_type\"")
				.contains("\"analysis\"")
				.contains("\"arguments\"");
	}

	@Test
	void regenerationPromptIncludesHistoryAndStalePlan() {
		ConversationContext context = new ConversationContext(
				List.of(new ConversationTurn(ConversationTurn.USER, "earlier question", Instant.EPOCH)), "");
		Plan stale = Plan.of(new Step(1, "Quote", "Fetch quote", "akshare_search", Map.of("stock_code", "XYZ")));

		String prompt = AgentPrompts.regeneration("Quote XYZ", stale, 1, LOG, context, 5);

		assertThat(prompt)
				.contains("user: earlier question")
				.contains("Conversation summary:\n(none)")
				.contains("Steps executed: 1")
				.contains("\"stock_code\" : \"XYZ\"")
				.contains("resolves the exact stock code");
	}

	@Test
	void renderedPlanParsesBackToTheSamePlan() {
		Map<String, Object> args = new HashMap<>();
		args.put("user_requirement", "report");
		args.put("report_content", null);
		Plan plan = Plan.of(
				Step.withoutTool(1, "Extract codes", "List every stock code"),
				new Step(2, "Report", "Write the report", "generate_markdown_report", args));

		assertThat(new PlanParser().parse(AgentPrompts.renderPlan(plan))).isEqualTo(plan);
	}

	@Test
	void answerPromptAsksForSources() {
		assertThat(AgentPrompts.answer("Compare NVDA and AMD", LOG))
				.contains("Cite sources")
				.contains("Step 1 result: found NVDA and AMD");
	}
}
