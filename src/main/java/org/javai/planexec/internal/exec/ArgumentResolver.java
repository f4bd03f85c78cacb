package org.javai.planexec.internal.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.planexec.internal.parse.JsonResponses;
import org.javai.planexec.internal.prompt.AgentPrompts;
import org.javai.planexec.oracle.Oracle;
import org.javai.planexec.plan.RunState;
import org.javai.planexec.plan.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the oracle for the arguments of a tool step whose planned arguments are incomplete.
 *
 * <p>The oracle answers with a JSON object holding a rationale and an argument mapping.
 * Both English and Chinese key names are accepted. Argument names the oracle translated are
 * mapped back to their canonical names through the alias table.</p>
 */
public class ArgumentResolver {

	private static final Logger logger = LoggerFactory.getLogger(ArgumentResolver.class);

	private static final List<String> ANALYSIS_KEYS = List.of("analysis", "分析", "rationale");
	private static final List<String> ARGUMENT_KEYS = List.of("arguments", "参数", "args", "parameters");

	private final Oracle oracle;
	private final Map<String, String> aliases;
	private final int snippetLimit;
	private final ObjectMapper mapper;

	public ArgumentResolver(Oracle oracle, Map<String, String> aliases, int snippetLimit) {
		this(oracle, aliases, snippetLimit, new ObjectMapper());
	}

	public ArgumentResolver(Oracle oracle, Map<String, String> aliases, int snippetLimit, ObjectMapper mapper) {
		this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
		this.aliases = Map.copyOf(aliases);
		this.snippetLimit = snippetLimit;
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	public ArgumentResolution resolve(Step step, RunState state) {
		String prompt = AgentPrompts.argumentResolution(step.tool(), step.action(), state.userInput(), state.log());

		String response;
		try {
			response = oracle.generate(prompt);
		} catch (RuntimeException ex) {
			logger.warn("Argument resolution call failed for step {}: {}", step.index(), ex.getMessage());
			return ArgumentResolution.failed("oracle call failed: " + ex.getMessage());
		}
		logger.debug("Argument resolution response for step {}:\n{}", step.index(), response);

		JsonNode root;
		try {
			root = mapper.readTree(JsonResponses.stripFences(response));
		} catch (JsonProcessingException ex) {
			return ArgumentResolution.failed("JSON parse error: " + ex.getOriginalMessage()
					+ "; raw response: " + JsonResponses.snippet(response, snippetLimit));
		}
		if (root == null || !root.isObject()) {
			return ArgumentResolution.failed("response is not a JSON object; raw response: "
					+ JsonResponses.snippet(response, snippetLimit));
		}

		String analysis = firstPresent(root, ANALYSIS_KEYS).map(JsonNode::asText).orElse("");
		JsonNode argsNode = firstPresent(root, ARGUMENT_KEYS).orElse(null);
		if (argsNode != null && !argsNode.isNull() && !argsNode.isObject()) {
			return ArgumentResolution.failed("arguments are not a JSON object; raw response: "
					+ JsonResponses.snippet(response, snippetLimit));
		}

		Map<String, Object> arguments = new LinkedHashMap<>();
		if (argsNode != null && argsNode.isObject()) {
			argsNode.fields().forEachRemaining(e -> arguments.put(
					canonicalName(e.getKey()),
					e.getValue().isNull() ? null : mapper.convertValue(e.getValue(), Object.class)));
		}
		if (!analysis.isEmpty()) {
			logger.info("Argument analysis for step {}: {}", step.index(), analysis);
		}
		return ArgumentResolution.resolved(analysis, arguments);
	}

	private String canonicalName(String name) {
		String canonical = aliases.get(name.trim());
		if (canonical != null) {
			logger.debug("Mapped argument name '{}' to '{}'", name, canonical);
			return canonical;
		}
		return name;
	}

	private static Optional<JsonNode> firstPresent(JsonNode root, List<String> keys) {
		return keys.stream()
				.map(root::get)
				.filter(Objects::nonNull)
				.findFirst();
	}
}
