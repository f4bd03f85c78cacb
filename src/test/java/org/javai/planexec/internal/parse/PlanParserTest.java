package org.javai.planexec.internal.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.Step;
import org.junit.jupiter.api.Test;

class PlanParserTest {

	private final PlanParser parser = new PlanParser();

	@Test
	void parsesFencedStepList() {
		String response = """
				```json
				[
				  {"step": 1, "description": "Query NVDA", "action": "Fetch the quote", "tool": "akshare_search",
				   "tool_args": {"stock_code": "NVDA", "data_type": "realtime"}},
				  {"step": 2, "description": "Summarize", "action": "Summarize the quote", "tool": null}
				]
				```""";

		Plan plan = parser.parse(response);

		assertThat(plan.size()).isEqualTo(2);
		Step first = plan.step(0);
		assertThat(first.index()).isEqualTo(1);
		assertThat(first.tool()).isEqualTo("akshare_search");
		assertThat(first.toolArgs()).containsEntry("stock_code", "NVDA").containsEntry("data_type", "realtime");
		assertThat(first.hasCompleteToolArgs()).isTrue();
		assertThat(plan.step(1).hasTool()).isFalse();
	}

	@Test
	void keepsFencesInsideStepText() {
		String response = "[{\"step\": 1, \"description\": \"Format\", \"action\": \"Wrap the table in ```\", \"tool\": null}]";

		Plan plan = parser.parse(response);

		assertThat(plan.size()).isEqualTo(1);
		assertThat(plan.step(0).action()).isEqualTo("Wrap the table in ```");
	}

	@Test
	void acceptsObjectWithSteps() {
		Plan plan = parser.parse("{\"message\": \"ok\", \"steps\": [{\"description\": \"only\", \"tool\": \"None\"}]}");

		assertThat(plan.size()).isEqualTo(1);
		assertThat(plan.step(0).index()).isEqualTo(1);
		assertThat(plan.step(0).action()).isEqualTo("only");
		assertThat(plan.step(0).hasTool()).isFalse();
	}

	@Test
	void keepsNullArgumentsForResolution() {
		Plan plan = parser.parse("""
				[{"step": 1, "description": "Report", "action": "Write report", "tool": "generate_markdown_report",
				  "tool_args": {"user_requirement": "NVDA report", "report_content": null}}]""");

		Step step = plan.step(0);
		assertThat(step.toolArgs()).containsEntry("report_content", null);
		assertThat(step.hasCompleteToolArgs()).isFalse();
	}

	@Test
	void nonObjectToolArgsAreTreatedAsAbsent() {
		Plan plan = parser.parse("[{\"step\": 1, \"description\": \"d\", \"tool\": \"add\", \"tool_args\": \"see step 0\"}]");

		assertThat(plan.step(0).toolArgs()).isNull();
	}

	@Test
	void rejectsProse() {
		assertThatThrownBy(() -> parser.parse("I would first look up the stock."))
				.isInstanceOf(PlanParseException.class)
				.hasMessageContaining("Failed to parse JSON plan");
	}

	@Test
	void rejectsEmptyPlans() {
		assertThatThrownBy(() -> parser.parse("[]"))
				.isInstanceOf(PlanParseException.class)
				.hasMessageContaining("no steps");
		assertThatThrownBy(() -> parser.parse("   "))
				.isInstanceOf(PlanParseException.class);
	}

	@Test
	void rejectsNonObjectEntries() {
		assertThatThrownBy(() -> parser.parse("[\"step one\"]"))
				.isInstanceOf(PlanParseException.class)
				.hasMessageContaining("not a step object");
	}

	@Test
	void rejectsObjectWithoutSteps() {
		assertThatThrownBy(() -> parser.parse("{\"plan\": \"none\"}"))
				.isInstanceOf(PlanParseException.class);
	}
}
