package org.javai.planexec;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.javai.planexec.config.AgentConfig;
import org.javai.planexec.conversation.ConversationContext;
import org.javai.planexec.internal.parse.DecisionParser;
import org.javai.planexec.internal.parse.PlanParseException;
import org.javai.planexec.internal.parse.PlanParser;
import org.javai.planexec.internal.prompt.AgentPrompts;
import org.javai.planexec.oracle.Oracle;
import org.javai.planexec.plan.ExecutionRecord;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, after each executed step, whether to continue, regenerate the plan or finalize.
 *
 * <p>The oracle is always asked for a decision, but two deterministic rules take precedence,
 * in this order:</p>
 * <ol>
 *   <li>if the latest execution record contains a known failure marker, the decision is
 *       {@link Decision#REGENERATE}, whatever the oracle answered;</li>
 *   <li>if the current plan is exhausted, the decision is {@link Decision#FINALIZE}.</li>
 * </ol>
 * <p>Otherwise the oracle's answer is used, and an unrecognized answer means
 * {@link Decision#CONTINUE}.</p>
 */
public class Replanner {

	private static final Logger logger = LoggerFactory.getLogger(Replanner.class);

	private final Oracle oracle;
	private final PlanParser parser;
	private final List<String> failureMarkers;
	private final int recentTurns;

	public Replanner(Oracle oracle, AgentConfig config) {
		this(oracle, new PlanParser(), config.failureMarkers(), config.recentTurns());
	}

	public Replanner(Oracle oracle, PlanParser parser, List<String> failureMarkers, int recentTurns) {
		this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.failureMarkers = List.copyOf(failureMarkers);
		this.recentTurns = recentTurns;
	}

	public ReplanOutcome replan(RunState state, ConversationContext context) {
		Objects.requireNonNull(state, "state must not be null");
		ConversationContext safeContext = context != null ? context : ConversationContext.empty();

		Decision decision = decide(state);
		return switch (decision) {
			case CONTINUE -> new ReplanOutcome.Continue();
			case REGENERATE -> regenerate(state, safeContext);
			case FINALIZE -> new ReplanOutcome.Finalize(composeAnswer(state));
		};
	}

	/**
	 * Applies the override rules to the oracle's decision.
	 */
	Decision decide(RunState state) {
		Decision proposed = askForDecision(state);

		Optional<String> marker = state.lastRecord().flatMap(r -> findFailureMarker(r.result()));
		if (marker.isPresent()) {
			logger.info("Known failure '{}' in latest result, forcing regeneration (oracle proposed {})",
					marker.get(), proposed);
			return Decision.REGENERATE;
		}
		if (state.isPlanExhausted()) {
			if (proposed != Decision.FINALIZE) {
				logger.info("Plan exhausted at {}/{}, finalizing (oracle proposed {})",
						state.cursor(), state.plan().size(), proposed);
			}
			return Decision.FINALIZE;
		}
		logger.info("Decision: {}", proposed);
		return proposed;
	}

	/**
	 * Finds the first configured failure marker contained in the result, ignoring case.
	 */
	public Optional<String> findFailureMarker(String result) {
		if (result == null || result.isEmpty()) {
			return Optional.empty();
		}
		String lower = result.toLowerCase(Locale.ROOT);
		return failureMarkers.stream()
				.filter(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)))
				.findFirst();
	}

	private Decision askForDecision(RunState state) {
		String prompt = AgentPrompts.decision(state.userInput(), state.cursor(), state.plan().size(), state.log());
		try {
			String answer = oracle.generate(prompt);
			logger.debug("Decision answer: {}", answer);
			return DecisionParser.parse(answer).orElseGet(() -> {
				logger.warn("Unrecognized decision answer '{}', continuing", answer);
				return Decision.CONTINUE;
			});
		} catch (RuntimeException ex) {
			logger.warn("Decision call failed, continuing: {}", ex.getMessage());
			return Decision.CONTINUE;
		}
	}

	private ReplanOutcome regenerate(RunState state, ConversationContext context) {
		String prompt = AgentPrompts.regeneration(state.userInput(), state.plan(), state.cursor(), state.log(),
				context, recentTurns);
		try {
			Plan plan = parser.parse(oracle.generate(prompt));
			logger.info("Regenerated {}", plan.describe());
			return new ReplanOutcome.Regenerate(plan);
		} catch (PlanParseException ex) {
			logger.warn("Regenerated plan could not be parsed, keeping the current plan: {}", ex.getMessage());
			return new ReplanOutcome.RegenerationAbandoned("unparseable plan: " + ex.getMessage());
		} catch (RuntimeException ex) {
			logger.warn("Regeneration call failed, keeping the current plan: {}", ex.getMessage());
			return new ReplanOutcome.RegenerationAbandoned("oracle call failed: " + ex.getMessage());
		}
	}

	private String composeAnswer(RunState state) {
		try {
			String answer = oracle.generate(AgentPrompts.answer(state.userInput(), state.log()));
			if (answer != null && !answer.isBlank()) {
				return answer.trim();
			}
			logger.warn("Answer composition returned nothing, using degraded answer");
			return degradedAnswer(state, "the answer could not be composed");
		} catch (RuntimeException ex) {
			logger.warn("Answer composition failed, using degraded answer: {}", ex.getMessage());
			return degradedAnswer(state, "the answer could not be composed");
		}
	}

	/**
	 * Composes an answer from the execution log alone, stating that the information gathered
	 * may be insufficient.
	 */
	public static String degradedAnswer(RunState state, String reason) {
		StringBuilder sb = new StringBuilder()
				.append("I could not gather sufficient information to fully answer the request (")
				.append(reason).append(").\n\n")
				.append("Request: ").append(state.userInput()).append("\n\n");
		List<ExecutionRecord> log = state.log();
		if (log.isEmpty()) {
			sb.append("No steps produced any results.");
		} else {
			sb.append("Results gathered so far:\n").append(ExecutionRecord.render(log));
		}
		return sb.toString();
	}
}
