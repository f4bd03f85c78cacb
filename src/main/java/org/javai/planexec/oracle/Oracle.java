package org.javai.planexec.oracle;

/**
 * Blocking text-generation function used for planning, argument resolution, decisions and
 * answer composition.
 *
 * <p>Output is untrusted: callers strip markdown fences and validate JSON before use.
 * Implementations report failures by throwing {@link OracleException}.</p>
 */
@FunctionalInterface
public interface Oracle {

	/**
	 * Generate a completion for the prompt.
	 *
	 * @param prompt the full prompt text
	 * @return the generated text
	 * @throws OracleException if the underlying model could not be called
	 */
	String generate(String prompt);
}
