package org.javai.planexec.internal.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of resolving tool arguments through the oracle.
 *
 * @param resolved whether usable arguments were obtained
 * @param analysis the oracle's rationale, empty when absent
 * @param arguments canonical argument names mapped to values; empty on failure
 * @param failure why resolution failed, {@code null} when resolved
 */
public record ArgumentResolution(
		boolean resolved,
		String analysis,
		Map<String, Object> arguments,
		String failure
) {

	public ArgumentResolution {
		analysis = analysis != null ? analysis : "";
		arguments = arguments != null ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments)) : Map.of();
	}

	public static ArgumentResolution resolved(String analysis, Map<String, Object> arguments) {
		return new ArgumentResolution(true, analysis, arguments, null);
	}

	public static ArgumentResolution failed(String failure) {
		return new ArgumentResolution(false, "", Map.of(), failure);
	}
}
