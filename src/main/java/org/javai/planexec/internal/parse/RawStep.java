package org.javai.planexec.internal.parse;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.planexec.plan.Step;

/**
 * Raw JSON representation of a plan step for Jackson deserialization.
 *
 * <p>Example JSON:
 * <pre>
 * {
 *   "step": 1,
 *   "description": "Query the realtime NVDA quote",
 *   "action": "Use the market data tool to fetch the latest quote",
 *   "tool": "akshare_search",
 *   "tool_args": {"stock_code": "NVDA", "data_type": "realtime"}
 * }
 * </pre>
 *
 * @param step the step number, may be absent
 * @param description what the step is for
 * @param action the operation to perform
 * @param tool tool name, {@code null} or {@code "None"} when no tool is needed
 * @param toolArgs tool arguments; anything other than a JSON object is treated as absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawStep(
		@JsonProperty("step") Integer step,
		@JsonProperty("description") String description,
		@JsonProperty("action") String action,
		@JsonProperty("tool") String tool,
		@JsonProperty("tool_args") JsonNode toolArgs
) {

	/**
	 * Converts to a {@link Step}, numbering it by position when the step number is missing.
	 */
	Step toStep(int position, ObjectMapper mapper) {
		int index = step != null ? step : position + 1;
		return new Step(index, description, action, tool, argumentMap(mapper));
	}

	private Map<String, Object> argumentMap(ObjectMapper mapper) {
		if (toolArgs == null || !toolArgs.isObject()) {
			return null;
		}
		Map<String, Object> args = new LinkedHashMap<>();
		toolArgs.fields().forEachRemaining(e ->
				args.put(e.getKey(), e.getValue().isNull() ? null : mapper.convertValue(e.getValue(), Object.class)));
		return args;
	}
}
