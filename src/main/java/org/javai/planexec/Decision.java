package org.javai.planexec;

import java.util.Optional;

/**
 * The replanner's choice after a step has been executed.
 */
public enum Decision {

	/** Execute the next step of the current plan. */
	CONTINUE('1'),
	/** Compose the final answer and complete the run. */
	FINALIZE('2'),
	/** Replace the current plan with a freshly generated one. */
	REGENERATE('3');

	private final char code;

	Decision(char code) {
		this.code = code;
	}

	/**
	 * The digit the oracle answers with for this decision.
	 */
	public char code() {
		return code;
	}

	public static Optional<Decision> fromCode(char code) {
		for (Decision decision : values()) {
			if (decision.code == code) {
				return Optional.of(decision);
			}
		}
		return Optional.empty();
	}
}
