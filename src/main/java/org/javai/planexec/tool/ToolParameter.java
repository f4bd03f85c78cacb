package org.javai.planexec.tool;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * LLM-facing description of a tool argument.
 *
 * @param name the canonical argument name
 * @param type short type identifier communicated to the LLM ({@code str}, {@code int}, {@code dict})
 * @param description human-friendly description
 * @param allowedValues enumerated values, empty when the argument is unconstrained
 * @param coercions synonyms mapped to their canonical allowed value
 * @param required whether the tool cannot run without this argument
 */
public record ToolParameter(
		String name,
		String type,
		String description,
		List<String> allowedValues,
		Map<String, String> coercions,
		boolean required
) {

	public ToolParameter {
		allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
		coercions = coercions != null ? Map.copyOf(coercions) : Map.of();
	}

	public static ToolParameter required(String name, String type, String description) {
		return new ToolParameter(name, type, description, List.of(), Map.of(), true);
	}

	public static ToolParameter optional(String name, String type, String description) {
		return new ToolParameter(name, type, description, List.of(), Map.of(), false);
	}

	public ToolParameter withAllowedValues(String... values) {
		return new ToolParameter(name, type, description, List.of(values), coercions, required);
	}

	public ToolParameter withCoercions(Map<String, String> synonyms) {
		return new ToolParameter(name, type, description, allowedValues, synonyms, required);
	}

	/**
	 * Maps a synonym to its canonical value.
	 *
	 * @return the canonical value, or empty if the value is not a known synonym
	 */
	public Optional<String> coerce(String value) {
		if (value == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(coercions.get(value.trim()));
	}
}
