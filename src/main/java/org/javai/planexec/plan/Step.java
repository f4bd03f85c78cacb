package org.javai.planexec.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single planned action, optionally bound to a tool and its arguments.
 *
 * <p>A step without a tool is performed by asking the oracle directly. A step with a tool
 * but without complete arguments (absent, empty, or containing {@code null} values) has its
 * arguments resolved at execution time.</p>
 *
 * @param index the 1-based step number as produced by the planner
 * @param description short description of the step
 * @param action the operation to perform
 * @param tool registry name of the tool to call, or {@code null} for an oracle-only step
 * @param toolArgs planned tool arguments, or {@code null} when none were planned
 */
public record Step(
		int index,
		String description,
		String action,
		String tool,
		Map<String, Object> toolArgs
) {

	public Step {
		description = description != null ? description : "";
		action = action != null ? action : description;
		tool = normalizeTool(tool);
		// LinkedHashMap keeps null values, which Map.copyOf would reject
		toolArgs = toolArgs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(toolArgs)) : null;
	}

	/**
	 * Creates a step that is performed by the oracle without any tool.
	 */
	public static Step withoutTool(int index, String description, String action) {
		return new Step(index, description, action, null, null);
	}

	public boolean hasTool() {
		return tool != null;
	}

	/**
	 * Whether the planned arguments can be passed to the tool verbatim.
	 */
	public boolean hasCompleteToolArgs() {
		return toolArgs != null && !toolArgs.isEmpty() && toolArgs.values().stream().allMatch(Objects::nonNull);
	}

	/**
	 * Returns a developer-friendly description of this step for diagnostics.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder("Step[")
				.append(index)
				.append(", '").append(description).append("'");
		if (tool != null) {
			sb.append(", tool=").append(tool);
			sb.append(", args=").append(toolArgs != null ? toolArgs : "{}");
		}
		return sb.append("]").toString();
	}

	private static String normalizeTool(String tool) {
		if (tool == null) {
			return null;
		}
		String trimmed = tool.trim();
		if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("none") || trimmed.equalsIgnoreCase("null")) {
			return null;
		}
		return trimmed;
	}
}
