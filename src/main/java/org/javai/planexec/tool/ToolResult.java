package org.javai.planexec.tool;

import java.util.Objects;

/**
 * Structured result of a tool invocation.
 *
 * @param type always {@link #TYPE}
 * @param tool the registry name of the invoked tool
 * @param content whatever the tool returned; may be a string, a number, a map or a list
 */
public record ToolResult(String type, String tool, Object content) {

	public static final String TYPE = "tool_result";

	public ToolResult {
		type = type != null ? type : TYPE;
		Objects.requireNonNull(tool, "tool must not be null");
	}

	public static ToolResult of(String tool, Object content) {
		return new ToolResult(TYPE, tool, content);
	}
}
