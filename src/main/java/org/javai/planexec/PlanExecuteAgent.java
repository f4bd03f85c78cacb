package org.javai.planexec;

import java.util.Objects;
import org.javai.planexec.config.AgentConfig;
import org.javai.planexec.conversation.ConversationContext;
import org.javai.planexec.conversation.ConversationMemory;
import org.javai.planexec.oracle.Oracle;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.RunState;
import org.javai.planexec.tool.ToolInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a run: plan once, then alternate execute and replan until the run is finalized.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PlanExecuteAgent agent = PlanExecuteAgent.builder()
 *     .oracle(new ChatClientOracle(chatClient))
 *     .toolInvoker(registry)
 *     .config(AgentConfig.defaults())
 *     .listener(new ConsoleRunListener(System.out))
 *     .build();
 *
 * RunResult result = agent.run("What is NVDA trading at?");
 * }</pre>
 *
 * <h2>Bounds</h2>
 * <p>A run ends with a degraded answer, built from the execution log, when it would need more
 * than {@link AgentConfig#maxTotalSteps()} execute calls, or when the replanner decides to
 * regenerate more than {@link AgentConfig#maxConsecutiveRegenerations()} times in a row
 * (abandoned regenerations included). Such runs are still completed through the finalize
 * transition and report {@link RunResult#terminatedEarly()}.</p>
 *
 * <p>The conversation context is snapshotted once at the start of a run. Memory is written
 * only after the run completes.</p>
 */
public class PlanExecuteAgent {

	private static final Logger logger = LoggerFactory.getLogger(PlanExecuteAgent.class);

	private final Planner planner;
	private final StepExecutor executor;
	private final Replanner replanner;
	private final ConversationMemory memory;
	private final RunListener listener;
	private final int maxTotalSteps;
	private final int maxConsecutiveRegenerations;

	public PlanExecuteAgent(Planner planner, StepExecutor executor, Replanner replanner, ConversationMemory memory,
			RunListener listener, AgentConfig config) {
		this.planner = Objects.requireNonNull(planner, "planner must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.replanner = Objects.requireNonNull(replanner, "replanner must not be null");
		this.memory = Objects.requireNonNull(memory, "memory must not be null");
		this.listener = listener != null ? listener : RunListener.NONE;
		this.maxTotalSteps = config.maxTotalSteps();
		this.maxConsecutiveRegenerations = config.maxConsecutiveRegenerations();
	}

	public static Builder builder() {
		return new Builder();
	}

	public RunResult run(String userInput) {
		Objects.requireNonNull(userInput, "userInput must not be null");
		logger.info("Starting run for: {}", userInput);
		ConversationContext context = memory.snapshot();

		Plan initialPlan = planner.plan(userInput, context);
		RunState state = RunState.initial(userInput).withPlan(initialPlan);
		listener.planProduced(userInput, initialPlan);

		int executeCalls = 0;
		int consecutiveRegenerations = 0;
		boolean terminatedEarly = false;

		while (!state.completed()) {
			if (executeCalls >= maxTotalSteps) {
				logger.warn("Step limit of {} reached, ending run", maxTotalSteps);
				state = state.finalizeWith(Replanner.degradedAnswer(state,
						"the step limit of " + maxTotalSteps + " was reached"));
				terminatedEarly = true;
				break;
			}

			StepOutcome step = executor.execute(state);
			executeCalls++;
			state = step.state();
			listener.stepExecuted(step);

			ReplanOutcome outcome = replanner.replan(state, context);
			listener.decisionTaken(outcome);
			state = outcome.applyTo(state);
			if (outcome instanceof ReplanOutcome.Regenerate regenerate) {
				listener.planProduced(userInput, regenerate.plan());
			}

			consecutiveRegenerations = outcome.decision() == Decision.REGENERATE ? consecutiveRegenerations + 1 : 0;
			if (!state.completed() && consecutiveRegenerations > maxConsecutiveRegenerations) {
				logger.warn("{} consecutive regenerations, ending run", consecutiveRegenerations);
				state = state.finalizeWith(Replanner.degradedAnswer(state,
						"the plan had to be regenerated " + consecutiveRegenerations + " times in a row"));
				terminatedEarly = true;
			}
		}

		memory.commit(userInput, state.finalAnswer());
		RunResult result = RunResult.of(state, terminatedEarly, executeCalls);
		logger.info("Run finished after {} steps{}", executeCalls, terminatedEarly ? " (terminated early)" : "");
		listener.runFinished(result);
		return result;
	}

	public ConversationMemory memory() {
		return memory;
	}

	/**
	 * Builder for {@link PlanExecuteAgent}. An oracle and a tool invoker are required.
	 */
	public static class Builder {
		private Oracle oracle;
		private ToolInvoker toolInvoker;
		private AgentConfig config = AgentConfig.defaults();
		private ConversationMemory memory;
		private RunListener listener = RunListener.NONE;

		private Builder() {
		}

		public Builder oracle(Oracle oracle) {
			this.oracle = oracle;
			return this;
		}

		public Builder toolInvoker(ToolInvoker toolInvoker) {
			this.toolInvoker = toolInvoker;
			return this;
		}

		public Builder config(AgentConfig config) {
			this.config = config;
			return this;
		}

		/**
		 * Shares memory across agents; by default each agent gets its own.
		 */
		public Builder memory(ConversationMemory memory) {
			this.memory = memory;
			return this;
		}

		public Builder listener(RunListener listener) {
			this.listener = listener;
			return this;
		}

		public PlanExecuteAgent build() {
			Objects.requireNonNull(oracle, "oracle must not be null");
			Objects.requireNonNull(toolInvoker, "toolInvoker must not be null");
			Objects.requireNonNull(config, "config must not be null");
			ConversationMemory effectiveMemory = memory != null
					? memory
					: new ConversationMemory(config.memoryCapacity(), config.summaryWindow());
			return new PlanExecuteAgent(
					new Planner(oracle),
					new StepExecutor(oracle, toolInvoker, config),
					new Replanner(oracle, config),
					effectiveMemory,
					listener,
					config);
		}
	}
}
