package org.javai.planexec.internal.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.planexec.conversation.ConversationContext;
import org.javai.planexec.plan.ExecutionRecord;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.Step;
import org.javai.planexec.tool.ToolCatalogJsonMapper;

/**
 * The fixed prompt contracts used by the planner, the step executor and the replanner.
 */
public final class AgentPrompts {

	private static final ObjectMapper mapper = new ObjectMapper();

	private static final String PLAN_STEP_FORMAT = """
			[
			  {
			    "step": 1,
			    "description": "What this step is for",
			    "action": "The operation to perform",
			    "tool": "tool name from the available tools, or null when no tool is needed",
			    "tool_args": {"argument name": "argument value"}
			  }
			]""";

	private static final String PLANNING_TEMPLATE = """
			## Task
			Produce a detailed execution plan for the user request, using the conversation context.
			Each step has:
			  1. a step number
			  2. a description
			  3. the operation to perform
			  4. the tool to call (one of the available tools, or null if no tool is needed)
			  5. the tool arguments (a JSON object, only when a tool is called)

			## Mandatory rules
			- If the request is about industry analysis, company research or research reports, the first step must call `retrieve_reports`.
			- Extracting stock codes from earlier results is a separate step without a tool, described as "exhaustively extract every A-share, US and HK stock code and company name mentioned in the reports".
			- If the request involves share prices, financial indicators, realtime quotes or historical data, the plan must call `akshare_search`.
			- When an argument has to be extracted from the output of an earlier step, create a dedicated extraction step (tool: null) before the tool call. Never extract and query in the same step.
			- When an argument value depends on the output of an earlier step, never guess it and never write descriptive text such as "result of step 1". Leave the value null, or set the whole `tool_args` to null; it is resolved at execution time.
			- The plan must be step by step, logically clear, and directly executable.

			## Output format
			Respond with a JSON list only:
			%s

			## Examples

			### Example 1: industry analysis
			Request: "Give me the latest research on the artificial intelligence industry."
			Plan:
			[
			  {"step": 1, "description": "Retrieve the latest AI industry research", "action": "Search research reports about the AI industry", "tool": "retrieve_reports", "tool_args": {"query": "latest artificial intelligence industry research", "filters": {"ticker": "INDUSTRY"}}},
			  {"step": 2, "description": "Write the AI industry investment report", "action": "Compose an investment report from the retrieved research", "tool": "generate_markdown_report", "tool_args": {"user_requirement": "AI industry investment report", "report_content": null}}
			]

			### Example 2: realtime quote
			Request: "What is NVIDIA (NVDA) trading at right now?"
			Plan:
			[
			  {"step": 1, "description": "Query the realtime NVDA quote", "action": "Fetch the latest NVIDIA quote with the stock data tool", "tool": "akshare_search", "tool_args": {"stock_code": "NVDA", "data_type": "realtime"}},
			  {"step": 2, "description": "Write the NVDA quote report", "action": "Compose a report from the fetched quote", "tool": "generate_markdown_report", "tool_args": {"user_requirement": "NVIDIA realtime quote report", "report_content": null}}
			]

			### Example 3: macroeconomic outlook
			Request: "I want the latest macroeconomic outlook."
			Plan:
			[
			  {"step": 1, "description": "Retrieve the latest macroeconomic research", "action": "Search research reports about the macroeconomic situation", "tool": "retrieve_reports", "tool_args": {"query": "latest macroeconomic outlook", "filters": {"ticker": "MACRO"}}},
			  {"step": 2, "description": "Write the macroeconomic report", "action": "Compose a macroeconomic analysis from the retrieved research", "tool": "generate_markdown_report", "tool_args": {"user_requirement": "macroeconomic analysis report", "report_content": null}}
			]

			## Conversation context
			%s

			## User request
			%s

			## Available tools
			%s
			""";

	private static final String TASK_TEMPLATE = """
			Perform the following task using the context.

			Task: %s
			Original user request: %s

			Results of earlier steps (context):
			%s

			Output the result of the task directly. If the task is to extract information, list the extracted information.
			""";

	private static final String ARGUMENT_RESOLUTION_TEMPLATE = """
			Work out the arguments for calling the tool "%s" for the task below.

			Task: %s
			Original user request: %s

			Results of earlier steps (context):
			%s

			## Rules
			1. Argument names must match the keys of the tool definition exactly. Never translate or rename them.
			2. If the earlier results are empty or lack the needed information, never invent values. Explain the situation under "analysis" and leave the argument out or empty.
			3. When a value comes from earlier results, extract every matching concrete value (for example every stock mentioned: "NVDA, AMD, MSFT"), never just one, and never descriptive text such as "result of step 1".

			## Rules for generate_markdown_report
			- `report_content` must be a complete, readable text that integrates all earlier step results. Never use placeholders.

			## Rules for akshare_search
			- `data_type` must be exactly one of "realtime", "history" or "info".
			- `stock_code` accepts several codes separated by commas (e.g. "NVDA, AAPL, MSFT").

			## Tool definitions
			%s

			## Answer format (strict JSON)
			{
			  "analysis": "your reasoning, including what is missing if anything",
			  "arguments": {"argument name": "argument value"}
			}

			Example:
			Context: Step 1 result: found stocks NVDA and AMD.
			Task: query these stocks.
			{
			  "analysis": "Step 1 found NVDA and AMD; their realtime quotes are needed.",
			  "arguments": {"stock_code": "NVDA, AMD", "data_type": "realtime"}
			}
			""";

	private static final String DECISION_TEMPLATE = """
			Decide what to do next based on the current execution.

			Original user request: %s
			Progress: %d/%d
			Results so far:
			%s

			Notes:
			- If steps remain (current step < total steps), choose "1" to continue.
			- Choose "2" to compose the final answer only when every step has been executed.
			- Choose "3" to replan only if the current step failed.

			Options:
			1. Continue with the next step
			2. Compose the final answer
			3. Regenerate the plan

			Answer with the digit 1, 2 or 3 only.
			""";

	private static final String REGENERATION_TEMPLATE = """
			Regenerate the execution plan from the current results and the conversation.

			Conversation history:
			%s

			Conversation summary:
			%s

			Original user request: %s
			Current plan:
			%s
			Steps executed: %d
			Results:
			%s

			## Pay attention
			1. If the results show a failure (for example "no reports found" or "argument validation failed"), the plan must change.
			2. If report retrieval returned nothing, broaden the search: drop the filters or use a more general query.
			3. If a step failed because of wrong arguments, retry it with correct arguments.
			4. If earlier steps produced a concrete list of A-share companies, query those companies first.
			5. If the last step reported that a stock code was not found or not recognized, add a step that first resolves the exact stock code (for example with the `info` mode of akshare_search) before querying quotes again.

			Generate a new plan containing the steps that still need to run.

			Answer format (strict JSON):
			%s
			""";

	private static final String ANSWER_TEMPLATE = """
			Compose a complete, detailed and professional final answer from the execution results and the original request.

			Original user request: %s
			Execution results:
			%s

			## Requirements
			1. Cite sources: when the answer uses information from research reports, name the source explicitly (institution, date and report title).
			2. Complete data: include every key finding extracted from reports and every queried figure such as quotes.
			3. Clear format: use Markdown so the answer is well structured and easy to read.
			4. Professional language: use proper financial terminology.

			Answer the user's question directly without explaining the process.
			""";

	private AgentPrompts() {
	}

	public static String planning(String userInput, ConversationContext context, List<String> toolNames) {
		String summary = context.summary().isBlank() ? "(none)" : context.summary();
		return PLANNING_TEMPLATE.formatted(PLAN_STEP_FORMAT, summary, userInput, toolNames);
	}

	public static String task(String action, String userInput, List<ExecutionRecord> log) {
		return TASK_TEMPLATE.formatted(action, userInput, ExecutionRecord.render(log));
	}

	public static String argumentResolution(String toolName, String action, String userInput, List<ExecutionRecord> log) {
		return ARGUMENT_RESOLUTION_TEMPLATE.formatted(toolName, action, userInput, ExecutionRecord.render(log),
				ToolCatalogJsonMapper.renderCatalog());
	}

	public static String decision(String userInput, int cursor, int planSize, List<ExecutionRecord> log) {
		return DECISION_TEMPLATE.formatted(userInput, cursor, planSize, ExecutionRecord.render(log));
	}

	public static String regeneration(String userInput, Plan stalePlan, int cursor, List<ExecutionRecord> log,
			ConversationContext context, int recentTurns) {
		String history = context.renderRecent(recentTurns);
		return REGENERATION_TEMPLATE.formatted(
				history.isBlank() ? "(none)" : history,
				context.summary().isBlank() ? "(none)" : context.summary(),
				userInput,
				renderPlan(stalePlan),
				cursor,
				ExecutionRecord.render(log),
				PLAN_STEP_FORMAT);
	}

	public static String answer(String userInput, List<ExecutionRecord> log) {
		return ANSWER_TEMPLATE.formatted(userInput, ExecutionRecord.render(log));
	}

	/**
	 * Renders a plan as the same JSON list the planner is asked to produce.
	 */
	public static String renderPlan(Plan plan) {
		ArrayNode steps = mapper.createArrayNode();
		for (Step step : plan.steps()) {
			ObjectNode node = steps.addObject();
			node.put("step", step.index());
			node.put("description", step.description());
			node.put("action", step.action());
			node.put("tool", step.tool());
			node.set("tool_args", step.toolArgs() != null ? mapper.valueToTree(step.toolArgs()) : null);
		}
		return steps.toPrettyString();
	}
}
