package org.javai.planexec.internal.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.javai.planexec.plan.Plan;
import org.javai.planexec.plan.Step;

/**
 * Parses oracle output into a {@link Plan}.
 *
 * <p>Accepts a JSON array of step objects, or an object whose {@code steps} field holds that
 * array, optionally wrapped in a markdown code fence. A response that yields no steps is a
 * parse failure, so every plan that leaves this parser can be executed.</p>
 */
public final class PlanParser {

	private final ObjectMapper mapper;

	public PlanParser() {
		this(new ObjectMapper());
	}

	public PlanParser(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * @throws PlanParseException if the response is empty, not JSON, or holds no steps
	 */
	public Plan parse(String response) {
		if (response == null || response.isBlank()) {
			throw new PlanParseException("LLM returned empty plan response");
		}
		String json = JsonResponses.stripFences(response);

		JsonNode root;
		try {
			root = mapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new PlanParseException("Failed to parse JSON plan: " + e.getOriginalMessage(), e);
		}

		JsonNode stepsNode = root != null && root.isObject() ? root.get("steps") : root;
		if (stepsNode == null || !stepsNode.isArray()) {
			throw new PlanParseException("LLM response does not contain a JSON list of steps");
		}
		if (stepsNode.isEmpty()) {
			throw new PlanParseException("LLM returned a plan with no steps");
		}

		List<Step> steps = new ArrayList<>();
		for (int i = 0; i < stepsNode.size(); i++) {
			JsonNode node = stepsNode.get(i);
			if (!node.isObject()) {
				throw new PlanParseException("Plan entry " + (i + 1) + " is not a step object: " + node);
			}
			try {
				steps.add(mapper.treeToValue(node, RawStep.class).toStep(i, mapper));
			} catch (JsonProcessingException | IllegalArgumentException e) {
				throw new PlanParseException("Plan entry " + (i + 1) + " is malformed: " + e.getMessage(), e);
			}
		}
		return new Plan(steps);
	}
}
