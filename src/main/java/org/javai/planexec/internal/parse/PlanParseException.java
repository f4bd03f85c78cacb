package org.javai.planexec.internal.parse;

/**
 * Raised when oracle output cannot be read as a plan.
 */
public class PlanParseException extends RuntimeException {

	public PlanParseException(String message) {
		super(message);
	}

	public PlanParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
