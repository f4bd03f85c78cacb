package org.javai.planexec.internal.exec;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.javai.planexec.config.AgentConfig;

/**
 * Rejects argument values that cannot be meant literally: empty values, the string
 * {@code none}, and descriptive prose such as "extract the codes from step 1" posing as a
 * value. Free-text arguments are not checked.
 */
public final class ArgumentValidator {

	public static final String FAILURE_PREFIX = "Argument validation failed";

	private final List<String> freeTextArguments;
	private final List<String> placeholderKeywords;
	private final int placeholderLengthThreshold;

	public ArgumentValidator(AgentConfig config) {
		this(config.freeTextArguments(), config.placeholderKeywords(), config.placeholderLengthThreshold());
	}

	public ArgumentValidator(List<String> freeTextArguments, List<String> placeholderKeywords,
			int placeholderLengthThreshold) {
		this.freeTextArguments = List.copyOf(freeTextArguments);
		this.placeholderKeywords = placeholderKeywords.stream()
				.map(k -> k.toLowerCase(Locale.ROOT))
				.toList();
		this.placeholderLengthThreshold = placeholderLengthThreshold;
	}

	/**
	 * Checks every argument in order and reports the first rejection.
	 */
	public ValidationResult validate(Map<String, Object> args) {
		for (Map.Entry<String, Object> entry : args.entrySet()) {
			String key = entry.getKey();
			if (freeTextArguments.contains(key)) {
				continue;
			}
			Object value = entry.getValue();
			if (value == null) {
				return empty(key);
			}
			if (!(value instanceof String text)) {
				continue;
			}
			if (text.isBlank() || text.trim().equalsIgnoreCase("none")) {
				return empty(key);
			}
			if (text.length() > placeholderLengthThreshold && containsPlaceholderKeyword(text)) {
				return ValidationResult.rejected(key, FAILURE_PREFIX + ": argument '" + key + "' has value '" + text
						+ "', which reads as a description rather than a value. Check whether the previous steps produced the data.");
			}
		}
		return ValidationResult.ok();
	}

	private boolean containsPlaceholderKeyword(String text) {
		String lower = text.toLowerCase(Locale.ROOT);
		return placeholderKeywords.stream().anyMatch(lower::contains);
	}

	private static ValidationResult empty(String key) {
		return ValidationResult.rejected(key, FAILURE_PREFIX + ": argument '" + key
				+ "' is empty. Check whether the previous steps produced the data.");
	}
}
