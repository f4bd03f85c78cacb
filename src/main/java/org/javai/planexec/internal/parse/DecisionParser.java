package org.javai.planexec.internal.parse;

import java.util.Optional;
import org.javai.planexec.Decision;

/**
 * Reads the oracle's answer to the decision prompt.
 *
 * <p>The answer must start with one of the digits {@code 1}, {@code 2} or {@code 3}, after
 * optional whitespace, quotes, markdown emphasis or an {@code Option}/{@code 选项} prefix.
 * Anything else is unrecognized.</p>
 */
public final class DecisionParser {

	private DecisionParser() {
	}

	public static Optional<Decision> parse(String answer) {
		if (answer == null) {
			return Optional.empty();
		}
		String text = answer.strip();
		int i = 0;
		while (i < text.length() && isDecoration(text.charAt(i))) {
			i++;
		}
		text = text.substring(i);
		for (String prefix : new String[] {"option", "选项", "choice"}) {
			if (text.regionMatches(true, 0, prefix, 0, prefix.length())) {
				text = text.substring(prefix.length()).stripLeading();
				if (text.startsWith(":") || text.startsWith("：")) {
					text = text.substring(1).stripLeading();
				}
				break;
			}
		}
		if (text.isEmpty()) {
			return Optional.empty();
		}
		return Decision.fromCode(text.charAt(0));
	}

	private static boolean isDecoration(char c) {
		return c == '"' || c == '\'' || c == '*' || c == '`' || c == '#' || c == '“' || Character.isWhitespace(c);
	}
}
