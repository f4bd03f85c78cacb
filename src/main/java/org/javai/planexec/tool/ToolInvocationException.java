package org.javai.planexec.tool;

/**
 * Raised when a registered tool fails or cannot be called with the given arguments.
 */
public class ToolInvocationException extends RuntimeException {

	public ToolInvocationException(String message) {
		super(message);
	}

	public ToolInvocationException(String message, Throwable cause) {
		super(message, cause);
	}
}
