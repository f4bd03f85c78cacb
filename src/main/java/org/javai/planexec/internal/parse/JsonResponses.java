package org.javai.planexec.internal.parse;

import java.util.regex.Pattern;

/**
 * Helpers for reading oracle output that is expected to be JSON.
 */
public final class JsonResponses {

	private static final String FENCE = "```";
	private static final Pattern OPENING_FENCE = Pattern.compile("^```(?:json|JSON)?");

	private JsonResponses() {
	}

	/**
	 * Removes a markdown code-fence wrapper from a response.
	 *
	 * <p>Only the wrapper is removed: fences inside JSON string values are kept. A response
	 * that starts with JSON is taken as is, apart from a dangling closing fence. Otherwise the
	 * first fence opens the wrapped block and the last fence that follows the JSON closes it.</p>
	 */
	public static String stripFences(String response) {
		if (response == null) {
			return "";
		}
		String trimmed = response.trim();
		if (trimmed.startsWith(FENCE)) {
			return unwrap(trimmed);
		}
		if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
			int opening = trimmed.indexOf(FENCE);
			if (opening >= 0) {
				return unwrap(trimmed.substring(opening));
			}
		}
		return trimmed.endsWith(FENCE) ? trimmed.substring(0, trimmed.length() - FENCE.length()).trim() : trimmed;
	}

	private static String unwrap(String fenced) {
		String body = OPENING_FENCE.matcher(fenced).replaceFirst("").trim();
		if (body.endsWith(FENCE)) {
			return body.substring(0, body.length() - FENCE.length()).trim();
		}
		// closing fence followed by prose; a fence inside a string value is not preceded by } or ]
		int closing = body.lastIndexOf(FENCE);
		if (closing >= 0) {
			String candidate = body.substring(0, closing).trim();
			if (candidate.endsWith("}") || candidate.endsWith("]")) {
				return candidate;
			}
		}
		return body;
	}

	/**
	 * Shortens a raw response for inclusion in failure text.
	 */
	public static String snippet(String response, int limit) {
		if (response == null) {
			return "<null>";
		}
		if (response.length() <= limit) {
			return response;
		}
		return response.substring(0, limit) + "...(truncated)";
	}
}
