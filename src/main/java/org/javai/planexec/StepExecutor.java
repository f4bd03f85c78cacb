package org.javai.planexec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Objects;
import org.javai.planexec.config.AgentConfig;
import org.javai.planexec.internal.exec.ArgumentNormalizer;
import org.javai.planexec.internal.exec.ArgumentResolution;
import org.javai.planexec.internal.exec.ArgumentResolver;
import org.javai.planexec.internal.exec.ArgumentValidator;
import org.javai.planexec.internal.exec.ValidationResult;
import org.javai.planexec.internal.prompt.AgentPrompts;
import org.javai.planexec.oracle.Oracle;
import org.javai.planexec.plan.ExecutionRecord;
import org.javai.planexec.plan.RunState;
import org.javai.planexec.plan.Step;
import org.javai.planexec.tool.ToolInvocationException;
import org.javai.planexec.tool.ToolInvoker;
import org.javai.planexec.tool.ToolNotRegisteredException;
import org.javai.planexec.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advances a run by exactly one step.
 *
 * <p>Every call that finds a step to run appends exactly one {@link ExecutionRecord} and moves
 * the cursor forward by one, whether the step succeeded or not. Failures never propagate:
 * they become the record's result text, and recovery is left to the replanner. A step is
 * never retried in place.</p>
 *
 * <h2>Tool steps</h2>
 * <ol>
 *   <li>Planned arguments are used verbatim when present and free of {@code null} values;
 *       otherwise they are resolved through the oracle ({@link ArgumentResolver}).</li>
 *   <li>Values are normalized against the tool schema ({@link ArgumentNormalizer}).</li>
 *   <li>Values are validated ({@link ArgumentValidator}); a rejection skips the tool.</li>
 *   <li>The tool is invoked through the {@link ToolInvoker}.</li>
 * </ol>
 */
public class StepExecutor {

	private static final Logger logger = LoggerFactory.getLogger(StepExecutor.class);
	private static final ObjectMapper mapper = new ObjectMapper();

	private final Oracle oracle;
	private final ToolInvoker toolInvoker;
	private final ArgumentResolver argumentResolver;
	private final ArgumentValidator argumentValidator;

	public StepExecutor(Oracle oracle, ToolInvoker toolInvoker, AgentConfig config) {
		this(oracle, toolInvoker,
				new ArgumentResolver(oracle, config.argumentAliases(), config.rawResponseSnippetLimit()),
				new ArgumentValidator(config));
	}

	public StepExecutor(Oracle oracle, ToolInvoker toolInvoker, ArgumentResolver argumentResolver,
			ArgumentValidator argumentValidator) {
		this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
		this.toolInvoker = Objects.requireNonNull(toolInvoker, "toolInvoker must not be null");
		this.argumentResolver = Objects.requireNonNull(argumentResolver, "argumentResolver must not be null");
		this.argumentValidator = Objects.requireNonNull(argumentValidator, "argumentValidator must not be null");
	}

	public StepOutcome execute(RunState state) {
		Objects.requireNonNull(state, "state must not be null");
		if (state.isPlanExhausted()) {
			logger.debug("Plan exhausted at cursor {}, nothing to execute", state.cursor());
			return StepOutcome.exhausted(state);
		}
		Step step = state.plan().step(state.cursor());
		logger.info("Executing {}", step.describe());

		StepOutcome outcome = step.hasTool() ? executeTool(step, state) : executeWithOracle(step, state);
		logger.debug("Step {} finished with {}: {}", step.index(), outcome.status(), outcome.record().result());
		return outcome;
	}

	private StepOutcome executeWithOracle(Step step, RunState state) {
		String prompt = AgentPrompts.task(step.action(), state.userInput(), state.log());
		try {
			String result = oracle.generate(prompt);
			return record(state, step, result, StepOutcome.Status.ORACLE_RESULT);
		} catch (RuntimeException ex) {
			logger.warn("Task execution failed for step {}: {}", step.index(), ex.getMessage());
			return record(state, step, "Task execution failed: " + ex.getMessage(), StepOutcome.Status.TASK_FAILED);
		}
	}

	private StepOutcome executeTool(Step step, RunState state) {
		Map<String, Object> args;
		if (step.hasCompleteToolArgs()) {
			args = step.toolArgs();
		} else {
			ArgumentResolution resolution = argumentResolver.resolve(step, state);
			if (!resolution.resolved()) {
				logger.warn("Argument resolution failed for step {}: {}", step.index(), resolution.failure());
				return record(state, step, "Argument resolution failed: " + resolution.failure(),
						StepOutcome.Status.ARGUMENT_RESOLUTION_FAILED);
			}
			args = resolution.arguments();
		}

		Map<String, Object> finalArgs = ArgumentNormalizer.normalize(step.tool(), args);

		ValidationResult validation = argumentValidator.validate(finalArgs);
		if (!validation.valid()) {
			logger.warn("Rejected arguments for step {}: {}", step.index(), validation.message());
			return record(state, step, validation.message(), StepOutcome.Status.ARGUMENT_VALIDATION_FAILED);
		}

		try {
			ToolResult result = toolInvoker.invoke(step.tool(), finalArgs);
			return record(state, step, renderContent(result.content()), StepOutcome.Status.TOOL_RESULT);
		} catch (ToolNotRegisteredException | ToolInvocationException ex) {
			logger.warn("Tool {} failed for step {}: {}", step.tool(), step.index(), ex.getMessage());
			return record(state, step, toolFailure(step, ex), StepOutcome.Status.TOOL_FAILED);
		} catch (RuntimeException ex) {
			logger.warn("Tool {} raised an unexpected failure for step {}", step.tool(), step.index(), ex);
			return record(state, step, toolFailure(step, ex), StepOutcome.Status.TOOL_FAILED);
		}
	}

	private static String toolFailure(Step step, RuntimeException ex) {
		return "Tool '" + step.tool() + "' invocation failed: " + (ex.getMessage() != null ? ex.getMessage() : ex.toString());
	}

	private static StepOutcome record(RunState state, Step step, String result, StepOutcome.Status status) {
		ExecutionRecord record = ExecutionRecord.of(step, result);
		return StepOutcome.executed(state.advance(record), record, status);
	}

	static String renderContent(Object content) {
		if (content == null) {
			return "";
		}
		if (content instanceof CharSequence text) {
			return text.toString();
		}
		try {
			return mapper.writeValueAsString(content);
		} catch (JsonProcessingException ex) {
			logger.debug("Tool content is not serializable as JSON, using toString()", ex);
			return content.toString();
		}
	}
}
