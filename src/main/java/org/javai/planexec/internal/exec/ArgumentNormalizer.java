package org.javai.planexec.internal.exec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.javai.planexec.tool.ToolId;
import org.javai.planexec.tool.ToolParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the value coercions declared in a tool's schema, e.g. collapsing
 * {@code daily_history} into {@code history} for the market data tool.
 */
public final class ArgumentNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(ArgumentNormalizer.class);

	private ArgumentNormalizer() {
	}

	/**
	 * Returns a copy of {@code args} with synonyms replaced by their canonical values. Tools
	 * outside the catalog are returned unchanged.
	 */
	public static Map<String, Object> normalize(String toolName, Map<String, Object> args) {
		Map<String, Object> normalized = new LinkedHashMap<>(args);
		Optional<ToolId> id = ToolId.fromName(toolName);
		if (id.isEmpty()) {
			return normalized;
		}
		for (ToolParameter parameter : id.get().schema().parameters()) {
			if (normalized.get(parameter.name()) instanceof String value) {
				parameter.coerce(value).ifPresent(canonical -> {
					logger.debug("Coerced {}.{} from '{}' to '{}'", toolName, parameter.name(), value, canonical);
					normalized.put(parameter.name(), canonical);
				});
			}
		}
		return normalized;
	}
}
