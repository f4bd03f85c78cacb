package org.javai.planexec.tool;

/**
 * Raised when a plan names a tool that has no bound handler.
 */
public class ToolNotRegisteredException extends RuntimeException {

	private final String toolName;

	public ToolNotRegisteredException(String toolName) {
		super("Tool " + toolName + " not registered");
		this.toolName = toolName;
	}

	public String toolName() {
		return toolName;
	}
}
