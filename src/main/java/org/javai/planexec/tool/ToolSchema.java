package org.javai.planexec.tool;

import java.util.List;
import java.util.Optional;

/**
 * Fixed argument contract of a tool.
 *
 * @param description what the tool does
 * @param parameters the accepted arguments, in prompt order
 */
public record ToolSchema(String description, List<ToolParameter> parameters) {

	public ToolSchema {
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
	}

	public Optional<ToolParameter> parameter(String name) {
		return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
	}
}
