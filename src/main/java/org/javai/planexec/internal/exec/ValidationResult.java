package org.javai.planexec.internal.exec;

/**
 * Outcome of validating resolved tool arguments.
 *
 * @param valid whether every checked argument passed
 * @param argument the first rejected argument, {@code null} when valid
 * @param message why the argument was rejected, {@code null} when valid
 */
public record ValidationResult(boolean valid, String argument, String message) {

	private static final ValidationResult OK = new ValidationResult(true, null, null);

	public static ValidationResult ok() {
		return OK;
	}

	public static ValidationResult rejected(String argument, String message) {
		return new ValidationResult(false, argument, message);
	}
}
