package org.javai.planexec;

import java.util.List;
import java.util.Objects;
import org.javai.planexec.conversation.ConversationContext;
import org.javai.planexec.internal.parse.PlanParseException;
import org.javai.planexec.internal.parse.PlanParser;
import org.javai.planexec.internal.prompt.AgentPrompts;
import org.javai.planexec.oracle.Oracle;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.Step;
import org.javai.planexec.tool.ToolId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the initial plan for a user request.
 *
 * <p>The planner never fails: when the oracle cannot be called or its answer cannot be read
 * as a plan, the {@linkplain #fallbackPlan() fallback plan} is returned, so the run always
 * starts with a non-empty, executable plan.</p>
 */
public class Planner {

	private static final Logger logger = LoggerFactory.getLogger(Planner.class);

	private final Oracle oracle;
	private final PlanParser parser;
	private final List<String> toolNames;

	public Planner(Oracle oracle) {
		this(oracle, new PlanParser(), ToolId.toolNames());
	}

	/**
	 * @param oracle the text-generation oracle
	 * @param parser parser for the oracle's plan response
	 * @param toolNames the tools a plan may reference
	 */
	public Planner(Oracle oracle, PlanParser parser, List<String> toolNames) {
		this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.toolNames = List.copyOf(toolNames);
	}

	public Plan plan(String userInput, ConversationContext context) {
		Objects.requireNonNull(userInput, "userInput must not be null");
		ConversationContext safeContext = context != null ? context : ConversationContext.empty();
		String prompt = AgentPrompts.planning(userInput, safeContext, toolNames);
		logger.debug("Planning prompt:\n{}", prompt);

		String response;
		try {
			response = oracle.generate(prompt);
		} catch (RuntimeException ex) {
			logger.warn("Planning call failed, using fallback plan: {}", ex.getMessage());
			return fallbackPlan();
		}

		try {
			Plan plan = parser.parse(response);
			logger.info("Generated {}", plan.describe());
			return plan;
		} catch (PlanParseException ex) {
			logger.warn("Could not parse plan, using fallback plan: {}", ex.getMessage());
			return fallbackPlan();
		}
	}

	/**
	 * Three tool-less steps: analyze the request, perform the core task, summarize.
	 */
	public static Plan fallbackPlan() {
		return Plan.of(
				Step.withoutTool(1, "Analyze the user request", "Analyze what the user input asks for"),
				Step.withoutTool(2, "Perform the core task", "Carry out the main work the request needs"),
				Step.withoutTool(3, "Summarize the results", "Summarize the execution results for the user"));
	}
}
